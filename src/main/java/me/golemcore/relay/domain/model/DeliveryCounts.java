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

/**
 * Per-status counts of the fan-out deliveries of one message.
 */
public record DeliveryCounts(int delivered, int pending, int failed) {

    public int total() {
        return delivered + pending + failed;
    }

    /**
     * Aggregate message status: anything pending keeps the message pending,
     * all-failed fails it, otherwise it counts as delivered.
     */
    public MessageStatus aggregateStatus() {
        if (pending > 0) {
            return MessageStatus.PENDING;
        }
        if (total() > 0 && failed == total()) {
            return MessageStatus.FAILED;
        }
        return MessageStatus.DELIVERED;
    }
}
