package me.golemcore.relay.domain.model.rule;

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
 * What a heuristic rule sees. {@code recipientUsername} is {@code null} for
 * group sends, {@code groupName} is {@code null} for direct sends.
 */
public record RuleInput(String message, String context, String recipientUsername, String groupName) {

    public static RuleInput direct(String message, String context, String recipientUsername) {
        return new RuleInput(message, context, recipientUsername, null);
    }

    public static RuleInput group(String message, String context, String groupName) {
        return new RuleInput(message, context, null, groupName);
    }

    public boolean hasContext() {
        return context != null && !context.isEmpty();
    }
}
