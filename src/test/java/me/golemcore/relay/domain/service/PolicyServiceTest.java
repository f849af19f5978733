package me.golemcore.relay.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.CreatePolicyCommand;
import me.golemcore.relay.domain.model.Policy;
import me.golemcore.relay.domain.model.PolicyScope;
import me.golemcore.relay.domain.model.PolicyType;
import me.golemcore.relay.port.outbound.PolicyStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PolicyServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private PolicyStorePort policyStore;
    private PolicyService service;

    @BeforeEach
    void setUp() {
        policyStore = mock(PolicyStorePort.class);
        service = new PolicyService(policyStore, new HeuristicRuleParser(new ObjectMapper()),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateHeuristicPolicy() {
        Policy created = service.create("user-a", CreatePolicyCommand.builder()
                .scope("user")
                .targetId("user-b")
                .policyType("heuristic")
                .policyContent("{\"maxLength\": 200}")
                .priority(7)
                .build());

        ArgumentCaptor<Policy> captor = ArgumentCaptor.forClass(Policy.class);
        verify(policyStore).insert(captor.capture());
        Policy stored = captor.getValue();
        assertNotNull(created.getId());
        assertEquals(created.getId(), stored.getId());
        assertEquals("user-a", stored.getUserId());
        assertEquals(PolicyScope.USER, stored.getScope());
        assertEquals("user-b", stored.getTargetId());
        assertEquals(PolicyType.HEURISTIC, stored.getPolicyType());
        assertEquals(7, stored.getPriority());
        assertTrue(stored.isEnabled());
        assertEquals(NOW, stored.getCreatedAt());
    }

    @Test
    void shouldDropTargetForGlobalScope() {
        Policy created = service.create("user-a", CreatePolicyCommand.builder()
                .scope("GLOBAL")
                .targetId("ignored")
                .policyType("llm")
                .policyContent("Never share passwords")
                .build());

        assertNull(created.getTargetId());
    }

    @Test
    void shouldRequireTargetForScopedPolicies() {
        RelayException error = assertThrows(RelayException.class, () -> service.create("user-a",
                CreatePolicyCommand.builder().scope("role").policyType("llm").policyContent("x").build()));

        assertEquals(ErrorCode.INVALID_POLICY, error.getCode());
        assertEquals("target_id is required for role policies", error.getMessage());
        verify(policyStore, never()).insert(any());
    }

    @Test
    void shouldRejectUnknownScopeAndType() {
        RelayException scope = assertThrows(RelayException.class, () -> service.create("user-a",
                CreatePolicyCommand.builder().scope("planet").policyType("llm").policyContent("x").build()));
        RelayException type = assertThrows(RelayException.class, () -> service.create("user-a",
                CreatePolicyCommand.builder().scope("global").policyType("magic").policyContent("x").build()));

        assertEquals("Unknown policy scope: planet", scope.getMessage());
        assertEquals("Unknown policy type: magic", type.getMessage());
    }

    @Test
    void shouldRejectInvalidContentAtWriteTime() {
        RelayException heuristic = assertThrows(RelayException.class, () -> service.create("user-a",
                CreatePolicyCommand.builder().scope("global").policyType("heuristic")
                        .policyContent("{\"maxLength\": \"ten\"}").build()));
        RelayException llm = assertThrows(RelayException.class, () -> service.create("user-a",
                CreatePolicyCommand.builder().scope("global").policyType("llm").policyContent("  ").build()));

        assertEquals("maxLength must be a number", heuristic.getMessage());
        assertEquals("LLM policy must have a non-empty prompt", llm.getMessage());
        verify(policyStore, never()).insert(any());
    }

    @Test
    void shouldDeleteOwnPolicy() {
        when(policyStore.findById("p1")).thenReturn(Optional.of(Policy.builder().id("p1").userId("user-a").build()));

        service.delete("user-a", "p1");

        verify(policyStore).delete("p1");
    }

    @Test
    void shouldNotRevealOtherUsersPolicies() {
        when(policyStore.findById("p1")).thenReturn(Optional.of(Policy.builder().id("p1").userId("user-b").build()));
        when(policyStore.findById("missing")).thenReturn(Optional.empty());

        RelayException foreign = assertThrows(RelayException.class, () -> service.delete("user-a", "p1"));
        RelayException missing = assertThrows(RelayException.class, () -> service.delete("user-a", "missing"));

        assertEquals(ErrorCode.POLICY_NOT_FOUND, foreign.getCode());
        assertEquals(ErrorCode.POLICY_NOT_FOUND, missing.getCode());
        verify(policyStore, never()).delete(anyString());
    }
}
