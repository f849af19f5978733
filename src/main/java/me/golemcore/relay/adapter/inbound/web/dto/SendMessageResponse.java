package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Send outcome. Group counters and {@code deduplicated} are omitted when not
 * applicable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendMessageResponse {

    @JsonProperty("message_id")
    private String messageId;

    private String status;

    private Boolean deduplicated;

    @JsonProperty("rejection_reason")
    private String rejectionReason;

    private Integer recipients;
    private Integer delivered;
    private Integer pending;
    private Integer failed;
}
