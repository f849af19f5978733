package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.Group;
import me.golemcore.relay.domain.model.LlmVerdict;
import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.model.PolicyDecision;
import me.golemcore.relay.domain.model.PolicyScope;
import me.golemcore.relay.domain.model.PolicyType;
import me.golemcore.relay.domain.model.UserAccount;
import me.golemcore.relay.domain.model.rule.HeuristicRule;
import me.golemcore.relay.domain.model.rule.HeuristicRuleSet;
import me.golemcore.relay.domain.model.rule.RuleInput;
import me.golemcore.relay.port.outbound.PolicyStorePort;
import me.golemcore.relay.port.outbound.RelationshipPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Pre-send policy gate. Collects the policies that apply to a send, orders
 * them by priority and returns the first violation.
 *
 * <p>
 * Direct sends use the sender's global policies, its user-scope policies
 * targeting the recipient and its role-scope policies for every role the
 * sender assigned to the recipient, merged into one priority order. Group
 * sends use the sender's global policies followed by the group's own
 * policies. Callers only invoke the evaluator for plaintext payloads in
 * trusted mode.
 */
@Service
@Slf4j
public class PolicyEvaluator {

    private static final String GROUP_SUFFIX = " (group policy)";
    private static final Comparator<Policy> BY_PRIORITY_DESC = Comparator
            .comparingInt(Policy::getPriority).reversed();

    private final PolicyStorePort policyStore;
    private final RelationshipPort relationshipPort;
    private final HeuristicRuleParser ruleParser;
    private final LlmPolicyJudge llmJudge;

    public PolicyEvaluator(PolicyStorePort policyStore, RelationshipPort relationshipPort,
            HeuristicRuleParser ruleParser, LlmPolicyJudge llmJudge) {
        this.policyStore = policyStore;
        this.relationshipPort = relationshipPort;
        this.ruleParser = ruleParser;
        this.llmJudge = llmJudge;
    }

    public PolicyDecision evaluateDirect(String senderUserId, UserAccount recipient, String message,
            String context) {
        List<Policy> policies = new ArrayList<>(policyStore.findEnabled(senderUserId, PolicyScope.GLOBAL, null));
        policies.addAll(policyStore.findEnabled(senderUserId, PolicyScope.USER, recipient.id()));
        List<String> roles = relationshipPort.rolesAssignedBy(senderUserId, recipient.id());
        if (!roles.isEmpty()) {
            policies.addAll(policyStore.findEnabledForRoles(senderUserId, roles));
        }
        List<Policy> ordered = policies.stream().sorted(BY_PRIORITY_DESC).toList();

        RuleInput input = RuleInput.direct(message, context, recipient.username());
        for (Policy policy : ordered) {
            Optional<String> violation = evaluate(policy, input, recipient.username());
            if (violation.isPresent()) {
                log.debug("[Policy] Send {} -> {} blocked by policy {}", senderUserId, recipient.id(),
                        policy.getId());
                return PolicyDecision.block(violation.get());
            }
        }
        return PolicyDecision.allow();
    }

    public PolicyDecision evaluateGroup(String senderUserId, Group group, String message, String context) {
        List<Policy> ordered = new ArrayList<>(policyStore.findEnabled(senderUserId, PolicyScope.GLOBAL, null)
                .stream().sorted(BY_PRIORITY_DESC).toList());
        ordered.addAll(policyStore.findEnabledForGroup(group.id()).stream().sorted(BY_PRIORITY_DESC).toList());

        RuleInput input = RuleInput.group(message, context, group.name());
        for (Policy policy : ordered) {
            Optional<String> violation = evaluate(policy, input, group.name());
            if (violation.isPresent()) {
                log.debug("[Policy] Group send {} -> {} blocked by policy {}", senderUserId, group.id(),
                        policy.getId());
                return PolicyDecision.block(violation.get());
            }
        }
        return PolicyDecision.allow();
    }

    private Optional<String> evaluate(Policy policy, RuleInput input, String recipientLabel) {
        boolean groupSend = input.groupName() != null;
        if (policy.getPolicyType() == PolicyType.HEURISTIC) {
            HeuristicRuleSet ruleSet;
            try {
                ruleSet = ruleParser.parse(policy.getPolicyContent());
            } catch (RelayException e) {
                log.warn("[Policy] Skipping malformed heuristic policy {}: {}", policy.getId(), e.getMessage());
                return Optional.empty();
            }
            return ruleSet.evaluate(input).map(violation -> {
                if (groupSend && !(violation.rule() instanceof HeuristicRule.RequireContext)) {
                    return violation.reason() + GROUP_SUFFIX;
                }
                return violation.reason();
            });
        }

        LlmVerdict verdict = llmJudge.evaluate(policy.getPolicyContent(), recipientLabel, input.message(),
                input.context());
        if (verdict.passed()) {
            return Optional.empty();
        }
        String reason = verdict.reasoning() != null && !verdict.reasoning().isBlank()
                ? verdict.reasoning()
                : "Message blocked by LLM policy";
        return Optional.of(groupSend ? reason + GROUP_SUFFIX : reason);
    }
}
