package me.golemcore.relay.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePolicyRequest {

    private String scope;

    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("policy_type")
    private String policyType;

    @JsonProperty("policy_content")
    private String policyContent;

    private int priority;

    private Boolean enabled;
}
