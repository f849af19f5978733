package me.golemcore.relay.domain.model.rule;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Parsed content of a heuristic policy: rules in fixed evaluation order.
 */
public final class HeuristicRuleSet {

    private final List<HeuristicRule> rules;

    public HeuristicRuleSet(List<HeuristicRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(HeuristicRule::order))
                .toList();
    }

    public List<HeuristicRule> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Returns the first violated rule, if any.
     */
    public Optional<Violation> evaluate(RuleInput input) {
        for (HeuristicRule rule : rules) {
            Optional<String> reason = rule.check(input);
            if (reason.isPresent()) {
                return Optional.of(new Violation(rule, reason.get()));
            }
        }
        return Optional.empty();
    }

    public record Violation(HeuristicRule rule, String reason) {
    }
}
