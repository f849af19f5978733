package me.golemcore.relay.domain.service;

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

import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Enforces the payload ceiling, measured in UTF-8 bytes.
 */
@Component
public class PayloadSizeValidator {

    private final RelayProperties properties;

    public PayloadSizeValidator(RelayProperties properties) {
        this.properties = properties;
    }

    public void validate(String payload) {
        int max = properties.getMessage().getMaxPayloadBytes();
        if (payload != null && payload.getBytes(StandardCharsets.UTF_8).length > max) {
            throw new RelayException(ErrorCode.PAYLOAD_TOO_LARGE,
                    "Payload exceeds maximum size of " + max + " bytes");
        }
    }
}
