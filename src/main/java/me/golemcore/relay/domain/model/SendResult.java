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

/**
 * Outcome of a send as reported to the caller. Group sends fill the aggregate
 * counters; direct sends leave them {@code null}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendResult {

    private String messageId;
    private MessageStatus status;
    private boolean deduplicated;
    private String rejectionReason;
    private Integer recipients;
    private Integer delivered;
    private Integer pending;
    private Integer failed;

    public static SendResult duplicate(Message existing) {
        return SendResult.builder()
                .messageId(existing.getId())
                .status(existing.getStatus())
                .deduplicated(true)
                .build();
    }

    public boolean isRejected() {
        return status == MessageStatus.REJECTED;
    }
}
