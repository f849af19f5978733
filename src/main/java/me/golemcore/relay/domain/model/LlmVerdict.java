package me.golemcore.relay.domain.model;

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

/**
 * Answer of the LLM judge for one llm-type policy. {@code error} keeps the
 * underlying failure when the verdict fell back to the configured default.
 */
public record LlmVerdict(boolean passed, String reasoning, String error) {

    public static LlmVerdict pass(String reasoning) {
        return new LlmVerdict(true, reasoning, null);
    }

    public static LlmVerdict fail(String reasoning) {
        return new LlmVerdict(false, reasoning, null);
    }
}
