package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageSummaryDto(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("recipient_type") String recipientType,
        @JsonProperty("status") String status,
        @JsonProperty("rejection_reason") String rejectionReason,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("deliveries") DeliveryCountsDto deliveries) {

    public record DeliveryCountsDto(
            @JsonProperty("delivered") int delivered,
            @JsonProperty("pending") int pending,
            @JsonProperty("failed") int failed,
            @JsonProperty("total") int total) {
    }
}
