package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * History entry with sender and recipient resolved to names.
 */
public record MessageDto(
        @JsonProperty("id") String id,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("sender") String sender,
        @JsonProperty("sender_agent") String senderAgent,
        @JsonProperty("recipient") String recipient,
        @JsonProperty("recipient_type") String recipientType,
        @JsonProperty("message") String message,
        @JsonProperty("context") String context,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("delivered_at") Instant deliveredAt) {
}
