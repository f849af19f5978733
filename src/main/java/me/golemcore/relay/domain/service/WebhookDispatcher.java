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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.DeliveryAttempt;
import me.golemcore.relay.domain.model.WebhookPayload;
import me.golemcore.relay.port.outbound.WebhookPort;
import me.golemcore.relay.security.CallbackSigner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performs exactly one signed webhook attempt and classifies the outcome.
 * Never touches the ledger.
 */
@Component
@Slf4j
public class WebhookDispatcher {

    public static final String HEADER_SIGNATURE = "X-Mahilo-Signature";
    public static final String HEADER_TIMESTAMP = "X-Mahilo-Timestamp";
    public static final String HEADER_MESSAGE_ID = "X-Mahilo-Message-Id";
    public static final String HEADER_DELIVERY_ID = "X-Mahilo-Delivery-Id";
    public static final String HEADER_GROUP_ID = "X-Mahilo-Group-Id";

    private final WebhookPort webhookPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookDispatcher(WebhookPort webhookPort, ObjectMapper objectMapper, Clock clock) {
        this.webhookPort = webhookPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public DeliveryAttempt dispatch(AgentConnection connection, WebhookPayload payload) {
        String body = serialize(payload);
        long timestamp = clock.instant().getEpochSecond();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_SIGNATURE, CallbackSigner.signatureHeader(connection.getCallbackSecret(), timestamp, body));
        headers.put(HEADER_TIMESTAMP, Long.toString(timestamp));
        headers.put(HEADER_MESSAGE_ID, payload.getMessageId());
        if (payload.getDeliveryId() != null) {
            headers.put(HEADER_DELIVERY_ID, payload.getDeliveryId());
        }
        if (payload.getGroupId() != null) {
            headers.put(HEADER_GROUP_ID, payload.getGroupId());
        }

        try {
            int status = webhookPort.post(connection.getCallbackUrl(), headers, body);
            if (status >= 200 && status < 300) {
                log.debug("[Delivery] Message {} delivered to connection {} ({})",
                        payload.getMessageId(), connection.getId(), status);
                return DeliveryAttempt.delivered(status);
            }
            log.warn("[Delivery] Connection {} answered {} for message {}",
                    connection.getId(), status, payload.getMessageId());
            return DeliveryAttempt.rejected(status);
        } catch (IOException e) {
            log.warn("[Delivery] Attempt for message {} to connection {} failed: {}",
                    payload.getMessageId(), connection.getId(), e.getMessage());
            return DeliveryAttempt.transportError(e.getMessage());
        } catch (RuntimeException e) {
            // e.g. OkHttp refusing a URL it cannot route
            log.warn("[Delivery] Attempt for message {} to connection {} could not be sent: {}",
                    payload.getMessageId(), connection.getId(), e.toString());
            return DeliveryAttempt.transportError(e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName());
        }
    }

    private String serialize(WebhookPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook payload", e);
        }
    }
}
