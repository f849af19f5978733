package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.relay.domain.model.EncryptionInfo;
import me.golemcore.relay.domain.model.RoutingHints;
import me.golemcore.relay.domain.model.SenderSignature;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

    private String recipient;

    @JsonProperty("recipient_type")
    private String recipientType;

    @JsonProperty("recipient_connection_id")
    private String recipientConnectionId;

    @JsonProperty("routing_hints")
    private RoutingHints routingHints;

    private String message;
    private String context;

    @JsonProperty("payload_type")
    private String payloadType;

    private EncryptionInfo encryption;

    @JsonProperty("sender_signature")
    private SenderSignature senderSignature;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("idempotency_key")
    private String idempotencyKey;
}
