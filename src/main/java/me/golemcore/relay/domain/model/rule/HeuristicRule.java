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

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One recognized key of a heuristic policy. The set of variants is closed;
 * {@link HeuristicRuleSet} evaluates them in {@link #order()}.
 */
public sealed interface HeuristicRule {

    /**
     * Fixed evaluation position of the rule kind within a rule set.
     */
    int order();

    /**
     * @return the rejection reason, or empty when the rule is satisfied
     */
    Optional<String> check(RuleInput input);

    record MaxLength(int limit) implements HeuristicRule {
        @Override
        public int order() {
            return 0;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            if (input.message().length() > limit) {
                return Optional.of("Message exceeds maximum length of " + limit);
            }
            return Optional.empty();
        }
    }

    record MinLength(int limit) implements HeuristicRule {
        @Override
        public int order() {
            return 1;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            if (input.message().length() < limit) {
                return Optional.of("Message is shorter than minimum length of " + limit);
            }
            return Optional.empty();
        }
    }

    record BlockedPatterns(List<Pattern> patterns) implements HeuristicRule {
        @Override
        public int order() {
            return 2;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(input.message()).find()) {
                    return Optional.of("Message contains blocked pattern");
                }
            }
            return Optional.empty();
        }
    }

    record RequiredPatterns(List<Pattern> patterns) implements HeuristicRule {
        @Override
        public int order() {
            return 3;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            for (Pattern pattern : patterns) {
                if (!pattern.matcher(input.message()).find()) {
                    return Optional.of("Message missing required pattern");
                }
            }
            return Optional.empty();
        }
    }

    record RequireContext() implements HeuristicRule {
        @Override
        public int order() {
            return 4;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            if (input.hasContext()) {
                return Optional.empty();
            }
            if (input.groupName() != null) {
                return Optional.of("Context is required for messages to group '" + input.groupName() + "'");
            }
            return Optional.of("Context is required for this message");
        }
    }

    // Recipient lists compare usernames and do not apply to group sends.

    record BlockedRecipients(List<String> usernames) implements HeuristicRule {
        @Override
        public int order() {
            return 5;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            if (input.recipientUsername() != null && usernames.contains(input.recipientUsername())) {
                return Optional.of("Recipient is blocked by policy");
            }
            return Optional.empty();
        }
    }

    record TrustedRecipients(List<String> usernames) implements HeuristicRule {
        @Override
        public int order() {
            return 6;
        }

        @Override
        public Optional<String> check(RuleInput input) {
            if (input.recipientUsername() != null && !usernames.contains(input.recipientUsername())) {
                return Optional.of("Recipient not in trusted list");
            }
            return Optional.empty();
        }
    }
}
