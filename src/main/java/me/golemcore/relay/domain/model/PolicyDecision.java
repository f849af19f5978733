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
 * Verdict of the policy evaluator. {@code reason} is set only when blocked.
 */
public record PolicyDecision(boolean allowed, String reason) {

    private static final PolicyDecision ALLOWED = new PolicyDecision(true, null);

    public static PolicyDecision allow() {
        return ALLOWED;
    }

    public static PolicyDecision block(String reason) {
        return new PolicyDecision(false, reason);
    }
}
