package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentRegistrationResponse(
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("callback_secret") String callbackSecret,
        @JsonProperty("updated") Boolean updated) {
}
