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
 * Result of exactly one webhook POST. {@code statusCode} is 0 when no HTTP
 * response was received (timeout, connection refused, TLS failure).
 */
public record DeliveryAttempt(boolean success, int statusCode, String error) {

    public static DeliveryAttempt delivered(int statusCode) {
        return new DeliveryAttempt(true, statusCode, null);
    }

    public static DeliveryAttempt rejected(int statusCode) {
        return new DeliveryAttempt(false, statusCode, "Callback returned " + statusCode);
    }

    public static DeliveryAttempt transportError(String error) {
        return new DeliveryAttempt(false, 0, error != null ? error : "Unknown error");
    }
}
