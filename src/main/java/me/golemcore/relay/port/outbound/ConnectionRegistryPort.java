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

import me.golemcore.relay.domain.model.AgentConnection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registered agent webhooks.
 */
public interface ConnectionRegistryPort {

    Optional<AgentConnection> findById(String connectionId);

    /**
     * Active connections of a user, highest routing priority first.
     */
    List<AgentConnection> findActiveByUser(String userId);

    List<AgentConnection> findByUser(String userId);

    Optional<AgentConnection> findByUserFrameworkLabel(String userId, String framework, String label);

    void insert(AgentConnection connection);

    void update(AgentConnection connection);

    /**
     * Refreshes {@code last_seen}. Concurrent updates are last-write-wins.
     */
    void touchLastSeen(String connectionId, Instant seenAt);
}
