package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PolicyDto(
        @JsonProperty("id") String id,
        @JsonProperty("scope") String scope,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("policy_type") String policyType,
        @JsonProperty("policy_content") String policyContent,
        @JsonProperty("priority") int priority,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("created_at") Instant createdAt) {
}
