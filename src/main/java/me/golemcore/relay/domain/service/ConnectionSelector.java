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

import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.RoutingHints;
import me.golemcore.relay.port.outbound.ConnectionRegistryPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the connection a direct message is delivered to.
 *
 * <p>
 * An explicit connection id wins and must be an active connection of the
 * recipient. Otherwise the first active connection (by routing priority)
 * whose label is hinted is used, then the first whose capabilities match a
 * hinted tag, then the top one.
 */
@Component
public class ConnectionSelector {

    private final ConnectionRegistryPort connectionRegistry;

    public ConnectionSelector(ConnectionRegistryPort connectionRegistry) {
        this.connectionRegistry = connectionRegistry;
    }

    public AgentConnection select(String recipientUserId, String explicitConnectionId, RoutingHints hints) {
        if (explicitConnectionId != null && !explicitConnectionId.isBlank()) {
            return connectionRegistry.findById(explicitConnectionId)
                    .filter(connection -> recipientUserId.equals(connection.getUserId()))
                    .filter(AgentConnection::isActive)
                    .orElseThrow(() -> new RelayException(ErrorCode.CONNECTION_NOT_FOUND,
                            "Recipient connection not found"));
        }

        List<AgentConnection> connections = connectionRegistry.findActiveByUser(recipientUserId);
        if (connections.isEmpty()) {
            throw new RelayException(ErrorCode.NO_CONNECTIONS, "Recipient has no active agent connections");
        }

        RoutingHints effective = hints != null ? hints : RoutingHints.none();
        Optional<AgentConnection> byLabel = connections.stream()
                .filter(connection -> effective.labels().contains(connection.getLabel()))
                .findFirst();
        if (byLabel.isPresent()) {
            return byLabel.get();
        }
        return connections.stream()
                .filter(connection -> connection.getCapabilities() != null
                        && connection.getCapabilities().stream().anyMatch(effective.tags()::contains))
                .findFirst()
                .orElse(connections.get(0));
    }

    /**
     * Highest-priority active connection of a group member, if any.
     */
    public Optional<AgentConnection> primary(String userId) {
        return connectionRegistry.findActiveByUser(userId).stream().findFirst();
    }
}
