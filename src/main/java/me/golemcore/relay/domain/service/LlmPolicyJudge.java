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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.LlmVerdict;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.LlmJudgePort;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Judges a message against a natural-language policy using
 * {@link LlmJudgePort}.
 *
 * <p>
 * The model must answer {@code PASS} or {@code FAIL} on the first line.
 * Errors, timeouts and ambiguous answers resolve to the configured default
 * verdict ({@code relay.llm.fail-open}, PASS by default) and never propagate.
 */
@Service
@Slf4j
public class LlmPolicyJudge {

    private final LlmJudgePort judgePort;
    private final RelayProperties properties;

    public LlmPolicyJudge(LlmJudgePort judgePort, RelayProperties properties) {
        this.judgePort = judgePort;
        this.properties = properties;
    }

    public LlmVerdict evaluate(String policy, String recipient, String message, String context) {
        String prompt = buildPrompt(policy, recipient, message, context);
        long timeoutMs = properties.getLlm().getTimeoutMs();
        CompletableFuture<String> pending = null;
        try {
            pending = judgePort.complete(prompt);
            String response = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            return parseResponse(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            return fallback("interrupted");
        } catch (TimeoutException e) {
            pending.cancel(true);
            return fallback("timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fallback(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (RuntimeException e) {
            return fallback(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    static String buildPrompt(String policy, String recipient, String message, String context) {
        StringBuilder prompt = new StringBuilder()
                .append("You are evaluating if a message complies with a policy.\n\n")
                .append("POLICY: ").append(policy).append("\n\n")
                .append("MESSAGE TO: ").append(recipient).append('\n')
                .append("MESSAGE CONTENT: ").append(message);
        if (context != null && !context.isEmpty()) {
            prompt.append("\nMESSAGE CONTEXT: ").append(context);
        }
        prompt.append("\n\nDoes this message comply with the policy?\n")
                .append("Answer with PASS or FAIL on the first line, followed by brief reasoning on the next line.\n")
                .append("Do not include any other text before PASS or FAIL.");
        return prompt.toString();
    }

    LlmVerdict parseResponse(String response) {
        String text = response != null ? response.trim() : "";
        String[] lines = text.split("\\R", -1);
        String firstLine = lines[0].trim().toUpperCase(Locale.ROOT);

        boolean passed;
        if (firstLine.startsWith("PASS")) {
            passed = true;
        } else if (firstLine.startsWith("FAIL")) {
            passed = false;
        } else {
            boolean failOpen = properties.getLlm().isFailOpen();
            log.warn("[Judge] Unclear response, defaulting to {}", failOpen ? "PASS" : "FAIL");
            return new LlmVerdict(failOpen, "Unclear response: " + text, null);
        }

        StringBuilder reasoning = new StringBuilder();
        for (int i = 1; i < lines.length; i++) {
            if (reasoning.length() > 0) {
                reasoning.append('\n');
            }
            reasoning.append(lines[i]);
        }
        String trimmed = reasoning.toString().trim();
        String finalReasoning = trimmed.isEmpty() ? "No reasoning provided" : trimmed;
        return passed ? LlmVerdict.pass(finalReasoning) : LlmVerdict.fail(finalReasoning);
    }

    private LlmVerdict fallback(String error) {
        boolean failOpen = properties.getLlm().isFailOpen();
        String verdict = failOpen ? "PASS" : "FAIL";
        log.warn("[Judge] LLM evaluation failed ({}), defaulting to {}", error, verdict);
        return new LlmVerdict(failOpen, "LLM evaluation failed, defaulting to " + verdict, error);
    }
}
