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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A send request as accepted from the routing layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageCommand {

    /** Recipient username for user sends, group id for group sends. */
    private String recipient;

    @Builder.Default
    private RecipientType recipientType = RecipientType.USER;

    private String recipientConnectionId;
    private RoutingHints routingHints;
    private String message;
    private String context;
    private String payloadType;
    private EncryptionInfo encryption;
    private SenderSignature senderSignature;
    private String correlationId;
    private String idempotencyKey;

    public String effectivePayloadType() {
        return payloadType != null && !payloadType.isBlank() ? payloadType : Message.DEFAULT_PAYLOAD_TYPE;
    }

    public RoutingHints effectiveRoutingHints() {
        return routingHints != null ? routingHints : RoutingHints.none();
    }
}
