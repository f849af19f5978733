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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered agent webhook. The callback secret is the HMAC key for
 * outbound deliveries and is only returned to its owner on creation or
 * rotation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConnection {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";

    private String id;
    private String userId;
    private String framework;
    private String label;
    private String description;

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    private String publicKey;
    private String publicKeyAlg;
    private int routingPriority;
    private String callbackUrl;

    @ToString.Exclude
    private String callbackSecret;

    @Builder.Default
    private String status = STATUS_ACTIVE;

    private Instant lastSeen;
    private Instant createdAt;

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }
}
