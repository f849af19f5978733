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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body POSTed to a recipient agent's callback URL. Fan-out deliveries
 * additionally carry {@code delivery_id}, {@code group_id} and
 * {@code group_name}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "message_id", "delivery_id", "correlation_id", "recipient_connection_id", "sender",
        "sender_agent", "message", "payload_type", "encryption", "sender_signature", "context", "group_id",
        "group_name", "timestamp" })
public class WebhookPayload {

    @JsonProperty("message_id")
    private String messageId;

    @JsonProperty("delivery_id")
    private String deliveryId;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("recipient_connection_id")
    private String recipientConnectionId;

    @JsonProperty("sender")
    private String sender;

    @JsonProperty("sender_agent")
    private String senderAgent;

    @JsonProperty("message")
    private String message;

    @JsonProperty("payload_type")
    private String payloadType;

    @JsonProperty("encryption")
    private EncryptionInfo encryption;

    @JsonProperty("sender_signature")
    private SenderSignature senderSignature;

    @JsonProperty("context")
    private String context;

    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("group_name")
    private String groupName;

    @JsonProperty("timestamp")
    private String timestamp;
}
