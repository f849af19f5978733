package me.golemcore.relay.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.port.outbound.ConnectionRegistryPort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.instant;
import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.toMillis;

/**
 * {@link ConnectionRegistryPort} over {@code agent_connections}. Capabilities
 * are stored as a JSON array.
 */
@Component
@Slf4j
public class JdbcConnectionRegistryAdapter implements ConnectionRegistryPort {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<AgentConnection> mapper = this::map;

    public JdbcConnectionRegistryAdapter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AgentConnection> findById(String connectionId) {
        return jdbcTemplate.query("SELECT * FROM agent_connections WHERE id = ?", mapper, connectionId)
                .stream().findFirst();
    }

    @Override
    public List<AgentConnection> findActiveByUser(String userId) {
        return jdbcTemplate.query("""
                SELECT * FROM agent_connections
                WHERE user_id = ? AND status = ?
                ORDER BY routing_priority DESC, created_at_ms ASC, id ASC
                """, mapper, userId, AgentConnection.STATUS_ACTIVE);
    }

    @Override
    public List<AgentConnection> findByUser(String userId) {
        return jdbcTemplate.query("""
                SELECT * FROM agent_connections
                WHERE user_id = ?
                ORDER BY routing_priority DESC, created_at_ms ASC, id ASC
                """, mapper, userId);
    }

    @Override
    public Optional<AgentConnection> findByUserFrameworkLabel(String userId, String framework, String label) {
        return jdbcTemplate.query(
                "SELECT * FROM agent_connections WHERE user_id = ? AND framework = ? AND label = ?",
                mapper, userId, framework, label)
                .stream().findFirst();
    }

    @Override
    public void insert(AgentConnection connection) {
        jdbcTemplate.update("""
                INSERT INTO agent_connections (id, user_id, framework, label, description, capabilities,
                    public_key, public_key_alg, routing_priority, callback_url, callback_secret, status,
                    last_seen_ms, created_at_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                connection.getId(),
                connection.getUserId(),
                connection.getFramework(),
                connection.getLabel(),
                connection.getDescription(),
                capabilitiesJson(connection.getCapabilities()),
                connection.getPublicKey(),
                connection.getPublicKeyAlg(),
                connection.getRoutingPriority(),
                connection.getCallbackUrl(),
                connection.getCallbackSecret(),
                connection.getStatus(),
                toMillis(connection.getLastSeen()),
                toMillis(connection.getCreatedAt()));
    }

    @Override
    public void update(AgentConnection connection) {
        jdbcTemplate.update("""
                UPDATE agent_connections
                SET description = ?, capabilities = ?, public_key = ?, public_key_alg = ?, routing_priority = ?,
                    callback_url = ?, callback_secret = ?, status = ?
                WHERE id = ?
                """,
                connection.getDescription(),
                capabilitiesJson(connection.getCapabilities()),
                connection.getPublicKey(),
                connection.getPublicKeyAlg(),
                connection.getRoutingPriority(),
                connection.getCallbackUrl(),
                connection.getCallbackSecret(),
                connection.getStatus(),
                connection.getId());
    }

    @Override
    public void touchLastSeen(String connectionId, Instant seenAt) {
        jdbcTemplate.update("UPDATE agent_connections SET last_seen_ms = ? WHERE id = ?",
                toMillis(seenAt), connectionId);
    }

    private AgentConnection map(ResultSet rs, int rowNum) throws SQLException {
        return AgentConnection.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .framework(rs.getString("framework"))
                .label(rs.getString("label"))
                .description(rs.getString("description"))
                .capabilities(parseCapabilities(rs.getString("capabilities")))
                .publicKey(rs.getString("public_key"))
                .publicKeyAlg(rs.getString("public_key_alg"))
                .routingPriority(rs.getInt("routing_priority"))
                .callbackUrl(rs.getString("callback_url"))
                .callbackSecret(rs.getString("callback_secret"))
                .status(rs.getString("status"))
                .lastSeen(instant(rs, "last_seen_ms"))
                .createdAt(instant(rs, "created_at_ms"))
                .build();
    }

    private String capabilitiesJson(List<String> capabilities) {
        try {
            return objectMapper.writeValueAsString(capabilities != null ? capabilities : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize capabilities", e);
        }
    }

    private List<String> parseCapabilities(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[Registry] Unreadable capabilities column: {}", e.getMessage());
            return List.of();
        }
    }
}
