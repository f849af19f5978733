package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A connection as listed to its owner. The callback secret is never included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentConnectionDto(
        @JsonProperty("id") String id,
        @JsonProperty("framework") String framework,
        @JsonProperty("label") String label,
        @JsonProperty("description") String description,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("routing_priority") int routingPriority,
        @JsonProperty("callback_url") String callbackUrl,
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("public_key_alg") String publicKeyAlg,
        @JsonProperty("status") String status,
        @JsonProperty("last_seen") Instant lastSeen,
        @JsonProperty("created_at") Instant createdAt) {
}
