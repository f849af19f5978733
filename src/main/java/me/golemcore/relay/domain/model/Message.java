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

import java.time.Instant;

/**
 * One logical send from a sender to a single recipient (a user or a group).
 *
 * <p>
 * {@code (senderUserId, idempotencyKey)} is unique when the key is present.
 * For group recipients the per-connection progress lives in
 * {@link MessageDelivery} rows and {@link #status} is their aggregate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String DEFAULT_PAYLOAD_TYPE = "text/plain";
    public static final String CIPHERTEXT_PAYLOAD_TYPE = "application/mahilo+ciphertext";

    private String id;
    private String correlationId;
    private String senderUserId;
    private String senderAgent;
    private RecipientType recipientType;
    private String recipientId;
    private String recipientConnectionId;
    private String payload;

    @Builder.Default
    private String payloadType = DEFAULT_PAYLOAD_TYPE;

    private EncryptionInfo encryption;
    private SenderSignature senderSignature;
    private String context;

    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    private String rejectionReason;
    private int retryCount;
    private String idempotencyKey;
    private Instant createdAt;
    private Instant deliveredAt;

    public boolean isPlaintext() {
        return !CIPHERTEXT_PAYLOAD_TYPE.equals(payloadType);
    }
}
