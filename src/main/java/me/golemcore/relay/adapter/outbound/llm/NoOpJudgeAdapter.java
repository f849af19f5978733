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

import me.golemcore.relay.port.outbound.LlmJudgePort;

import java.util.concurrent.CompletableFuture;

/**
 * Judge used when no model is configured: every llm-type policy passes.
 */
public class NoOpJudgeAdapter implements LlmJudgePort {

    static final String RESPONSE = "PASS\nLLM evaluation not configured";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<String> complete(String prompt) {
        return CompletableFuture.completedFuture(RESPONSE);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
