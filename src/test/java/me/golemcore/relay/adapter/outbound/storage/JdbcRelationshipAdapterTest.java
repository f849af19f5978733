package me.golemcore.relay.adapter.outbound.storage;

import me.golemcore.relay.domain.model.FriendshipStatus;
import me.golemcore.relay.testsupport.db.SqliteTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcRelationshipAdapterTest {

    private SqliteTestDatabase database;
    private JdbcRelationshipAdapter adapter;

    @BeforeEach
    void setUp() {
        database = new SqliteTestDatabase();
        adapter = new JdbcRelationshipAdapter(database.jdbcTemplate());
        database.user("user-a", "alice");
        database.user("user-b", "Bob");
        database.user("user-c", "carol");
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldLookUpUsersCaseInsensitively() {
        assertEquals("user-b", adapter.findByUsername("bob").orElseThrow().id());
        assertEquals("alice", adapter.findById("user-a").orElseThrow().username());
        assertTrue(adapter.findByUsername("dave").isEmpty());
        assertEquals(Map.of("user-a", "alice", "user-c", "carol"),
                adapter.usernamesByIds(Set.of("user-a", "user-c", "user-x")));
        assertTrue(adapter.usernamesByIds(Set.of()).isEmpty());
    }

    @Test
    void shouldResolveFriendshipInEitherDirection() {
        database.friendship("user-b", "user-a", "accepted");
        database.friendship("user-a", "user-c", "pending");

        assertEquals(FriendshipStatus.ACCEPTED, adapter.friendshipStatus("user-a", "user-b"));
        assertEquals(FriendshipStatus.ACCEPTED, adapter.friendshipStatus("user-b", "user-a"));
        assertEquals(FriendshipStatus.PENDING, adapter.friendshipStatus("user-c", "user-a"));
        assertEquals(FriendshipStatus.NONE, adapter.friendshipStatus("user-b", "user-c"));
    }

    @Test
    void shouldLetBlockWinOverAcceptance() {
        database.friendship("user-a", "user-b", "accepted");
        database.friendship("user-b", "user-a", "blocked");

        assertEquals(FriendshipStatus.BLOCKED, adapter.friendshipStatus("user-a", "user-b"));
    }

    @Test
    void shouldListRolesAssignedByOwner() {
        database.friendRole("user-a", "user-b", "coworkers");
        database.friendRole("user-a", "user-b", "close_friends");
        database.friendRole("user-b", "user-a", "family");

        assertEquals(List.of("close_friends", "coworkers"), adapter.rolesAssignedBy("user-a", "user-b"));
        assertTrue(adapter.rolesAssignedBy("user-a", "user-c").isEmpty());
    }

    @Test
    void shouldReportActiveGroupMembers() {
        database.group("group-1", "Team");
        database.membership("group-1", "user-a", "active");
        database.membership("group-1", "user-b", "active");
        database.membership("group-1", "user-c", "invited");

        assertEquals("Team", adapter.findGroup("group-1").orElseThrow().name());
        assertTrue(adapter.findGroup("group-2").isEmpty());
        assertTrue(adapter.isActiveMember("group-1", "user-a"));
        assertFalse(adapter.isActiveMember("group-1", "user-c"));
        assertEquals(List.of("user-a", "user-b"), adapter.activeMemberIds("group-1"));
    }
}
