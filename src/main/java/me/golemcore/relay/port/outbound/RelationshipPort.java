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

import me.golemcore.relay.domain.model.FriendshipStatus;
import me.golemcore.relay.domain.model.Group;

import java.util.List;
import java.util.Optional;

/**
 * Relationship oracle: friendship state, friend roles and group membership.
 * Friend-graph and group CRUD live outside the relay; this port only reads.
 */
public interface RelationshipPort {

    /**
     * Friendship between two users regardless of who sent the request.
     * {@link FriendshipStatus#BLOCKED} wins over any other row.
     */
    FriendshipStatus friendshipStatus(String userId, String otherUserId);

    /**
     * Role names the owner has assigned to a friend (e.g. "close_friends").
     */
    List<String> rolesAssignedBy(String ownerUserId, String friendUserId);

    Optional<Group> findGroup(String groupId);

    boolean isActiveMember(String groupId, String userId);

    /**
     * Active member user ids of the group.
     */
    List<String> activeMemberIds(String groupId);
}
