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

import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.model.PolicyScope;
import me.golemcore.relay.domain.model.PolicyType;
import me.golemcore.relay.port.outbound.PolicyStorePort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.instant;
import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.toMillis;

@Component
public class JdbcPolicyStoreAdapter implements PolicyStorePort {

    private static final String ORDER = " ORDER BY priority DESC, created_at_ms ASC, id ASC";

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<Policy> mapper = this::map;

    public JdbcPolicyStoreAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Policy> findEnabled(String ownerUserId, PolicyScope scope, String targetId) {
        if (targetId == null) {
            return jdbcTemplate.query("SELECT * FROM policies WHERE user_id = ? AND scope = ? AND enabled = 1"
                    + ORDER, mapper, ownerUserId, scope.value());
        }
        return jdbcTemplate.query("SELECT * FROM policies WHERE user_id = ? AND scope = ? AND target_id = ? "
                + "AND enabled = 1" + ORDER, mapper, ownerUserId, scope.value(), targetId);
    }

    @Override
    public List<Policy> findEnabledForRoles(String ownerUserId, Collection<String> roleNames) {
        if (roleNames.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(roleNames.size(), "?"));
        List<Object> args = new ArrayList<>();
        args.add(ownerUserId);
        args.add(PolicyScope.ROLE.value());
        args.addAll(roleNames);
        return jdbcTemplate.query("SELECT * FROM policies WHERE user_id = ? AND scope = ? AND target_id IN ("
                + placeholders + ") AND enabled = 1" + ORDER, mapper, args.toArray());
    }

    @Override
    public List<Policy> findEnabledForGroup(String groupId) {
        return jdbcTemplate.query("SELECT * FROM policies WHERE scope = ? AND target_id = ? AND enabled = 1"
                + ORDER, mapper, PolicyScope.GROUP.value(), groupId);
    }

    @Override
    public List<Policy> findByOwner(String ownerUserId) {
        return jdbcTemplate.query("SELECT * FROM policies WHERE user_id = ?" + ORDER, mapper, ownerUserId);
    }

    @Override
    public Optional<Policy> findById(String policyId) {
        return jdbcTemplate.query("SELECT * FROM policies WHERE id = ?", mapper, policyId).stream().findFirst();
    }

    @Override
    public void insert(Policy policy) {
        jdbcTemplate.update("""
                INSERT INTO policies (id, user_id, scope, target_id, policy_type, policy_content, priority,
                    enabled, created_at_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                policy.getId(),
                policy.getUserId(),
                policy.getScope().value(),
                policy.getTargetId(),
                policy.getPolicyType().value(),
                policy.getPolicyContent(),
                policy.getPriority(),
                policy.isEnabled() ? 1 : 0,
                toMillis(policy.getCreatedAt()));
    }

    @Override
    public boolean delete(String policyId) {
        return jdbcTemplate.update("DELETE FROM policies WHERE id = ?", policyId) > 0;
    }

    private Policy map(ResultSet rs, int rowNum) throws SQLException {
        return Policy.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .scope(PolicyScope.fromValue(rs.getString("scope")))
                .targetId(rs.getString("target_id"))
                .policyType(PolicyType.fromValue(rs.getString("policy_type")))
                .policyContent(rs.getString("policy_content"))
                .priority(rs.getInt("priority"))
                .enabled(rs.getInt("enabled") != 0)
                .createdAt(instant(rs, "created_at_ms"))
                .build();
    }
}
