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
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.CreatePolicyCommand;
import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.model.PolicyScope;
import me.golemcore.relay.domain.model.PolicyType;
import me.golemcore.relay.port.outbound.PolicyStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Policy write operations. Content is validated before it is stored so the
 * evaluator only meets malformed rules written by other tools.
 */
@Service
@Slf4j
public class PolicyService {

    private final PolicyStorePort policyStore;
    private final HeuristicRuleParser ruleParser;
    private final Clock clock;

    public PolicyService(PolicyStorePort policyStore, HeuristicRuleParser ruleParser, Clock clock) {
        this.policyStore = policyStore;
        this.ruleParser = ruleParser;
        this.clock = clock;
    }

    public Policy create(String ownerUserId, CreatePolicyCommand command) {
        PolicyScope scope = parseScope(command.getScope());
        PolicyType type = parseType(command.getPolicyType());

        String targetId = command.getTargetId();
        if (scope.requiresTarget() && (targetId == null || targetId.isBlank())) {
            throw new RelayException(ErrorCode.INVALID_POLICY,
                    "target_id is required for " + scope.value() + " policies");
        }
        if (!scope.requiresTarget()) {
            targetId = null;
        }

        validateContent(type, command.getPolicyContent());

        Policy policy = Policy.builder()
                .id(UUID.randomUUID().toString())
                .userId(ownerUserId)
                .scope(scope)
                .targetId(targetId)
                .policyType(type)
                .policyContent(command.getPolicyContent())
                .priority(command.getPriority())
                .enabled(command.isEnabled())
                .createdAt(clock.instant())
                .build();
        policyStore.insert(policy);
        log.info("[Policy] Created {} {} policy {} for user {}", scope.value(), type.value(), policy.getId(),
                ownerUserId);
        return policy;
    }

    public List<Policy> list(String ownerUserId) {
        return policyStore.findByOwner(ownerUserId);
    }

    public void delete(String ownerUserId, String policyId) {
        Policy policy = policyStore.findById(policyId)
                .filter(p -> ownerUserId.equals(p.getUserId()))
                .orElseThrow(() -> new RelayException(ErrorCode.POLICY_NOT_FOUND, "Policy not found"));
        policyStore.delete(policy.getId());
        log.info("[Policy] Deleted policy {} of user {}", policyId, ownerUserId);
    }

    /**
     * Write-time content contract: heuristic content must parse into a rule
     * set, llm content must be a non-empty prompt.
     */
    public void validateContent(PolicyType type, String content) {
        if (type == PolicyType.HEURISTIC) {
            ruleParser.parse(content);
            return;
        }
        if (content == null || content.isBlank()) {
            throw new RelayException(ErrorCode.INVALID_POLICY, "LLM policy must have a non-empty prompt");
        }
    }

    private PolicyScope parseScope(String value) {
        if (value == null || value.isBlank()) {
            throw new RelayException(ErrorCode.INVALID_POLICY, "Policy scope is required");
        }
        try {
            return PolicyScope.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new RelayException(ErrorCode.INVALID_POLICY, "Unknown policy scope: " + value);
        }
    }

    private PolicyType parseType(String value) {
        if (value == null || value.isBlank()) {
            throw new RelayException(ErrorCode.INVALID_POLICY, "Policy type is required");
        }
        try {
            return PolicyType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new RelayException(ErrorCode.INVALID_POLICY, "Unknown policy type: " + value);
        }
    }
}
