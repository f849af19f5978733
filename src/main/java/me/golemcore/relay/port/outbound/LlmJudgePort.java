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

import java.util.concurrent.CompletableFuture;

/**
 * Completion capability used to judge llm-type policies. Implementations
 * either call a real model or answer {@code PASS} without one.
 */
public interface LlmJudgePort {

    /**
     * Returns the provider identifier (e.g., "anthropic", "none").
     */
    String getProviderId();

    /**
     * Sends a single-turn prompt and returns the raw model text.
     */
    CompletableFuture<String> complete(String prompt);

    /**
     * Checks if a real model is configured behind this port.
     */
    boolean isAvailable();
}
