package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.model.PolicyScope;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Policy persistence. Every {@code findEnabled*} query returns enabled
 * policies only, highest priority first.
 */
public interface PolicyStorePort {

    /**
     * Enabled policies of the owner in the given scope. A {@code null} target
     * matches any target (used for the global scope).
     */
    List<Policy> findEnabled(String ownerUserId, PolicyScope scope, String targetId);

    List<Policy> findEnabledForRoles(String ownerUserId, Collection<String> roleNames);

    /**
     * Group-scope policies targeting the group, whoever owns them.
     */
    List<Policy> findEnabledForGroup(String groupId);

    List<Policy> findByOwner(String ownerUserId);

    Optional<Policy> findById(String policyId);

    void insert(Policy policy);

    boolean delete(String policyId);
}
