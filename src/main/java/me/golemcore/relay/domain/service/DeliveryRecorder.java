package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.MessageStatus;
import me.golemcore.relay.port.outbound.ConnectionRegistryPort;
import me.golemcore.relay.port.outbound.MessageLedgerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes delivery outcomes to the ledger. Fan-out outcomes also refresh the
 * parent message, which is finalized once none of its deliveries is pending.
 */
@Component
@Slf4j
public class DeliveryRecorder {

    private final MessageLedgerPort ledger;
    private final ConnectionRegistryPort connectionRegistry;
    private final Clock clock;

    public DeliveryRecorder(MessageLedgerPort ledger, ConnectionRegistryPort connectionRegistry, Clock clock) {
        this.ledger = ledger;
        this.connectionRegistry = connectionRegistry;
        this.clock = clock;
    }

    public void recordDelivered(DeliveryTarget target, String connectionId) {
        Instant now = clock.instant();
        boolean updated = ledger.markDelivered(target, now);
        connectionRegistry.touchLastSeen(connectionId, now);
        if (!updated) {
            log.debug("[Ledger] {} already terminal, delivered outcome ignored", target.key());
            return;
        }
        if (target.isFanOut()) {
            refreshAggregate(target.messageId());
        }
    }

    public void recordFailed(DeliveryTarget target, String reason) {
        boolean updated = ledger.markFailed(target, reason);
        if (!updated) {
            log.debug("[Ledger] {} already terminal, failed outcome ignored", target.key());
            return;
        }
        log.info("[Ledger] {} marked failed: {}", target.key(), reason);
        if (target.isFanOut()) {
            refreshAggregate(target.messageId());
        }
    }

    public void recordRetryCount(DeliveryTarget target, int retryCount) {
        ledger.updateRetryCount(target, retryCount);
    }

    /**
     * Finalizes a group message when no delivery is pending any more.
     *
     * @return the aggregate counts after the refresh
     */
    public DeliveryCounts refreshAggregate(String messageId) {
        DeliveryCounts counts = ledger.countDeliveries(messageId);
        MessageStatus aggregate = counts.aggregateStatus();
        if (aggregate.isTerminal()) {
            Instant deliveredAt = aggregate == MessageStatus.DELIVERED ? clock.instant() : null;
            if (ledger.finalizeMessage(messageId, aggregate, deliveredAt)) {
                log.info("[Ledger] Group message {} finalized as {} ({} delivered, {} failed)",
                        messageId, aggregate.value(), counts.delivered(), counts.failed());
            }
        }
        return counts;
    }
}
