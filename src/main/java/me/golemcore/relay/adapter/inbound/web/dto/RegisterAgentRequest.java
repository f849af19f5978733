package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterAgentRequest {

    private String framework;
    private String label;
    private String description;
    private List<String> capabilities;

    @JsonProperty("routing_priority")
    private int routingPriority;

    @JsonProperty("callback_url")
    private String callbackUrl;

    @JsonProperty("callback_secret")
    private String callbackSecret;

    @JsonProperty("public_key")
    private String publicKey;

    @JsonProperty("public_key_alg")
    private String publicKeyAlg;

    @JsonProperty("rotate_secret")
    private boolean rotateSecret;
}
