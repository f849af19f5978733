package me.golemcore.relay.adapter.outbound.llm;

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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.LlmJudgePort;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * LLM judge backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * Supports Anthropic (default) and OpenAI-compatible endpoints. The model is
 * called once per policy with no retries; the caller bounds the wait and
 * applies the default verdict on failure.
 */
@Slf4j
public class Langchain4jJudgeAdapter implements LlmJudgePort {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_OPENAI = "openai";

    private final String providerId;
    private final ChatModel chatModel;

    public Langchain4jJudgeAdapter(RelayProperties.LlmProperties config) {
        this(config.getProvider(), createModel(config));
    }

    Langchain4jJudgeAdapter(String providerId, ChatModel chatModel) {
        this.providerId = providerId;
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        return CompletableFuture.supplyAsync(() -> {
            String text = chatModel.chat(prompt);
            log.trace("[Judge] {} answered {} chars", providerId, text != null ? text.length() : 0);
            return text;
        });
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private static ChatModel createModel(RelayProperties.LlmProperties config) {
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());
        if (PROVIDER_OPENAI.equalsIgnoreCase(config.getProvider())) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxRetries(0)
                    .maxTokens(config.getMaxTokens())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .maxTokens(config.getMaxTokens())
                .timeout(timeout);
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
