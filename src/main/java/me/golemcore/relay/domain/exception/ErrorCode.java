package me.golemcore.relay.domain.exception;

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
 * Stable error codes surfaced to API callers, with the HTTP status each maps
 * to.
 */
public enum ErrorCode {
    INVALID_REQUEST(400),
    PAYLOAD_TOO_LARGE(400),
    INVALID_CALLBACK_URL(400),
    INVALID_POLICY(400),
    INVALID_SINCE(400),
    UNAUTHORIZED(401),
    NOT_FRIENDS(403),
    BLOCKED(403),
    NOT_MEMBER(403),
    USER_NOT_FOUND(404),
    GROUP_NOT_FOUND(404),
    CONNECTION_NOT_FOUND(404),
    NO_CONNECTIONS(404),
    POLICY_NOT_FOUND(404),
    MESSAGE_NOT_FOUND(404);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
