package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All relay configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link ModeProperties} - trusted/production/private-network switches</li>
 * <li>{@link MessageProperties} - payload ceiling and history paging</li>
 * <li>{@link DeliveryProperties} - webhook attempt timeout</li>
 * <li>{@link RetryProperties} - retry budget and scheduler tick</li>
 * <li>{@link LlmProperties} - LLM judge provider for llm-type policies</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private ModeProperties mode = new ModeProperties();
    private MessageProperties message = new MessageProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private RetryProperties retry = new RetryProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ModeProperties {
        /**
         * The registry may read plaintext payloads and run policies on them.
         */
        private boolean trusted = false;

        /**
         * Hosted/production deployment. Tightens callback URL validation.
         */
        private boolean production = false;

        /**
         * Self-hosted deployments may register callbacks on private networks.
         */
        private boolean allowPrivateIps = false;
    }

    @Data
    public static class MessageProperties {
        private int maxPayloadBytes = 32768;
        private int historyDefaultLimit = 50;
        private int historyMaxLimit = 100;
    }

    @Data
    public static class DeliveryProperties {
        private long timeoutMs = 30000;
    }

    @Data
    public static class RetryProperties {
        private boolean enabled = true;
        private int maxRetries = 5;
        private long tickIntervalMs = 1000;
    }

    @Data
    public static class LlmProperties {
        /** anthropic | openai */
        private String provider = "anthropic";
        private String apiKey = "";
        private String baseUrl;
        private String model = "claude-3-haiku-20240307";
        private int maxTokens = 256;
        private long timeoutMs = 5000;

        /**
         * Verdict used when the judge errors, times out or answers ambiguously.
         */
        private boolean failOpen = true;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
