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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.LlmJudgePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Chooses the {@link LlmJudgePort} implementation from {@code relay.llm.*}.
 * Without an API key, or with provider {@code none}, llm-type policies always
 * pass.
 */
@Configuration
@Slf4j
public class LlmJudgeConfig {

    @Bean
    public LlmJudgePort llmJudgePort(RelayProperties properties) {
        return select(properties.getLlm());
    }

    static LlmJudgePort select(RelayProperties.LlmProperties config) {
        String provider = config.getProvider() != null ? config.getProvider().toLowerCase(Locale.ROOT) : "none";
        if ("none".equals(provider) || config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.info("[Judge] No LLM configured, llm policies will pass");
            return new NoOpJudgeAdapter();
        }
        if (!Langchain4jJudgeAdapter.PROVIDER_ANTHROPIC.equals(provider)
                && !Langchain4jJudgeAdapter.PROVIDER_OPENAI.equals(provider)) {
            throw new IllegalStateException("Unsupported relay.llm.provider: " + config.getProvider()
                    + " (expected anthropic, openai or none)");
        }
        log.info("[Judge] Using {} model {}", provider, config.getModel());
        return new Langchain4jJudgeAdapter(config);
    }
}
