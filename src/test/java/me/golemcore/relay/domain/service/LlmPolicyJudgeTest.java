package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.LlmVerdict;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.LlmJudgePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmPolicyJudgeTest {

    private LlmJudgePort judgePort;
    private RelayProperties properties;
    private LlmPolicyJudge judge;

    @BeforeEach
    void setUp() {
        judgePort = mock(LlmJudgePort.class);
        properties = new RelayProperties();
        properties.getLlm().setTimeoutMs(200);
        judge = new LlmPolicyJudge(judgePort, properties);
    }

    @Test
    void shouldPassOnPassAnswer() {
        when(judgePort.complete(anyString()))
                .thenReturn(CompletableFuture.completedFuture("PASS\nThe message is a friendly greeting."));

        LlmVerdict verdict = judge.evaluate("No financial data", "bob", "Hello!", null);

        assertTrue(verdict.passed());
        assertEquals("The message is a friendly greeting.", verdict.reasoning());
        assertNull(verdict.error());
    }

    @Test
    void shouldFailOnFailAnswerCaseInsensitively() {
        when(judgePort.complete(anyString()))
                .thenReturn(CompletableFuture.completedFuture("  fail\nContains an account number.\nSecond line"));

        LlmVerdict verdict = judge.evaluate("No financial data", "bob", "My IBAN is ...", null);

        assertFalse(verdict.passed());
        assertEquals("Contains an account number.\nSecond line", verdict.reasoning());
    }

    @Test
    void shouldSupplyDefaultReasoningWhenOmitted() {
        when(judgePort.complete(anyString())).thenReturn(CompletableFuture.completedFuture("FAIL"));

        LlmVerdict verdict = judge.evaluate("policy", "bob", "msg", null);

        assertFalse(verdict.passed());
        assertEquals("No reasoning provided", verdict.reasoning());
    }

    @Test
    void shouldUseDefaultVerdictForUnclearAnswer() {
        when(judgePort.complete(anyString())).thenReturn(CompletableFuture.completedFuture("Maybe?"));

        LlmVerdict open = judge.evaluate("policy", "bob", "msg", null);
        properties.getLlm().setFailOpen(false);
        LlmVerdict closed = judge.evaluate("policy", "bob", "msg", null);

        assertTrue(open.passed());
        assertEquals("Unclear response: Maybe?", open.reasoning());
        assertFalse(closed.passed());
    }

    @Test
    void shouldFailOpenWhenProviderErrors() {
        when(judgePort.complete(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        LlmVerdict verdict = judge.evaluate("policy", "bob", "msg", null);

        assertTrue(verdict.passed());
        assertEquals("LLM evaluation failed, defaulting to PASS", verdict.reasoning());
        assertEquals("rate limited", verdict.error());
    }

    @Test
    void shouldFailClosedWhenConfigured() {
        properties.getLlm().setFailOpen(false);
        when(judgePort.complete(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        LlmVerdict verdict = judge.evaluate("policy", "bob", "msg", null);

        assertFalse(verdict.passed());
        assertEquals("LLM evaluation failed, defaulting to FAIL", verdict.reasoning());
    }

    @Test
    void shouldFallBackWhenJudgeTimesOut() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(judgePort.complete(anyString())).thenReturn(pending);

        LlmVerdict verdict = judge.evaluate("policy", "bob", "msg", null);

        assertTrue(verdict.passed());
        assertEquals("timed out after 200ms", verdict.error());
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldBuildPromptWithOptionalContext() {
        String withContext = LlmPolicyJudge.buildPrompt("Be polite", "bob", "hi", "weekly sync");
        String withoutContext = LlmPolicyJudge.buildPrompt("Be polite", "bob", "hi", null);

        assertTrue(withContext.contains("POLICY: Be polite\n\nMESSAGE TO: bob\nMESSAGE CONTENT: hi\n"
                + "MESSAGE CONTEXT: weekly sync\n\nDoes this message comply with the policy?"));
        assertFalse(withoutContext.contains("MESSAGE CONTEXT"));
        assertTrue(withoutContext.endsWith("Do not include any other text before PASS or FAIL."));
    }
}
