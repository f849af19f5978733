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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Applicability of a {@link Policy}. Every scope except {@code GLOBAL} names a
 * target: a user id, a role name or a group id.
 */
public enum PolicyScope {
    GLOBAL, USER, ROLE, GROUP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean requiresTarget() {
        return this != GLOBAL;
    }

    public static PolicyScope fromValue(String value) {
        return PolicyScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
