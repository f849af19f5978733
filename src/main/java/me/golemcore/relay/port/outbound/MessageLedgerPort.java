package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.HistoryDirection;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.MessageDelivery;
import me.golemcore.relay.domain.model.MessageStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted record of every message and fan-out delivery.
 *
 * <p>
 * All state transitions are single guarded updates that only apply while the
 * row is still {@code pending}, so a terminal row is never rewritten even when
 * the synchronous send path and the retry scheduler race on it.
 */
public interface MessageLedgerPort {

    /**
     * Inserts a message.
     *
     * @return {@code false} when the {@code (sender, idempotency_key)} unique
     *         constraint rejected the row
     */
    boolean insertMessage(Message message);

    Optional<Message> findMessage(String messageId);

    Optional<Message> findBySenderAndIdempotencyKey(String senderUserId, String idempotencyKey);

    void insertDelivery(MessageDelivery delivery);

    List<MessageDelivery> findDeliveries(String messageId);

    DeliveryCounts countDeliveries(String messageId);

    /**
     * @return {@code true} if the row was pending and is now delivered
     */
    boolean markDelivered(DeliveryTarget target, Instant deliveredAt);

    /**
     * @return {@code true} if the row was pending and is now failed
     */
    boolean markFailed(DeliveryTarget target, String reason);

    void updateRetryCount(DeliveryTarget target, int retryCount);

    /**
     * Moves a pending message to a terminal status.
     */
    boolean finalizeMessage(String messageId, MessageStatus status, Instant deliveredAt);

    /**
     * Newest first.
     *
     * @param since
     *            exclusive lower bound on creation time, or {@code null}
     */
    List<Message> findHistory(String userId, HistoryDirection direction, Instant since, int limit);
}
