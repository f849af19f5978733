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

import me.golemcore.relay.domain.model.FriendshipStatus;
import me.golemcore.relay.domain.model.Group;
import me.golemcore.relay.domain.model.UserAccount;
import me.golemcore.relay.port.outbound.RelationshipPort;
import me.golemcore.relay.port.outbound.UserDirectoryPort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the user, friendship, role and group tables maintained by
 * the account service.
 */
@Component
public class JdbcRelationshipAdapter implements RelationshipPort, UserDirectoryPort {

    private static final String ACTIVE_MEMBERSHIP = "active";

    private final JdbcTemplate jdbcTemplate;

    public JdbcRelationshipAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public FriendshipStatus friendshipStatus(String userId, String otherUserId) {
        List<String> statuses = jdbcTemplate.queryForList("""
                SELECT status FROM friendships
                WHERE (requester_id = ? AND addressee_id = ?) OR (requester_id = ? AND addressee_id = ?)
                """, String.class, userId, otherUserId, otherUserId, userId);
        FriendshipStatus result = FriendshipStatus.NONE;
        for (String status : statuses) {
            FriendshipStatus parsed = FriendshipStatus.valueOf(status.toUpperCase(Locale.ROOT));
            if (parsed == FriendshipStatus.BLOCKED) {
                return parsed;
            }
            if (parsed == FriendshipStatus.ACCEPTED || result == FriendshipStatus.NONE) {
                result = parsed;
            }
        }
        return result;
    }

    @Override
    public List<String> rolesAssignedBy(String ownerUserId, String friendUserId) {
        return jdbcTemplate.queryForList(
                "SELECT role_name FROM friend_roles WHERE owner_user_id = ? AND friend_user_id = ? ORDER BY role_name",
                String.class, ownerUserId, friendUserId);
    }

    @Override
    public Optional<Group> findGroup(String groupId) {
        return jdbcTemplate.query("SELECT id, name FROM user_groups WHERE id = ?",
                (rs, rowNum) -> new Group(rs.getString("id"), rs.getString("name")), groupId)
                .stream().findFirst();
    }

    @Override
    public boolean isActiveMember(String groupId, String userId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM group_memberships WHERE group_id = ? AND user_id = ? AND status = ?",
                Integer.class, groupId, userId, ACTIVE_MEMBERSHIP);
        return count != null && count > 0;
    }

    @Override
    public List<String> activeMemberIds(String groupId) {
        return jdbcTemplate.queryForList(
                "SELECT user_id FROM group_memberships WHERE group_id = ? AND status = ? ORDER BY user_id",
                String.class, groupId, ACTIVE_MEMBERSHIP);
    }

    @Override
    public Optional<UserAccount> findByUsername(String username) {
        return jdbcTemplate.query("SELECT id, username FROM users WHERE username = ? COLLATE NOCASE",
                (rs, rowNum) -> new UserAccount(rs.getString("id"), rs.getString("username")), username)
                .stream().findFirst();
    }

    @Override
    public Optional<UserAccount> findById(String userId) {
        return jdbcTemplate.query("SELECT id, username FROM users WHERE id = ?",
                (rs, rowNum) -> new UserAccount(rs.getString("id"), rs.getString("username")), userId)
                .stream().findFirst();
    }

    @Override
    public Map<String, String> usernamesByIds(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        List<Object> args = new ArrayList<>(userIds);
        String placeholders = String.join(", ", Collections.nCopies(args.size(), "?"));
        Map<String, String> result = new HashMap<>();
        jdbcTemplate.query("SELECT id, username FROM users WHERE id IN (" + placeholders + ")",
                rs -> {
                    result.put(rs.getString("id"), rs.getString("username"));
                }, args.toArray());
        return result;
    }
}
