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
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.port.outbound.MessageLedgerPort;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Duplicate-send detection scoped to {@code (sender, idempotency_key)}.
 *
 * <p>
 * The pre-check answers the common case. Two concurrent sends with the same
 * key can both pass it; the ledger's unique index then rejects the loser,
 * whose caller receives the winning row instead. Existing rows are never
 * updated.
 */
@Component
@Slf4j
public class IdempotencyGuard {

    private final MessageLedgerPort ledger;

    public IdempotencyGuard(MessageLedgerPort ledger) {
        this.ledger = ledger;
    }

    public Optional<Message> findPrior(String senderUserId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isEmpty()) {
            return Optional.empty();
        }
        return ledger.findBySenderAndIdempotencyKey(senderUserId, idempotencyKey);
    }

    /**
     * Persists a new message.
     *
     * @return empty when the message was stored, or the row that won a
     *         concurrent insert with the same key
     */
    public Optional<Message> insertOrGetWinner(Message message) {
        if (ledger.insertMessage(message)) {
            return Optional.empty();
        }
        Message winner = ledger.findBySenderAndIdempotencyKey(message.getSenderUserId(), message.getIdempotencyKey())
                .orElseThrow(() -> new IllegalStateException(
                        "Idempotency conflict without a stored message for key " + message.getIdempotencyKey()));
        log.debug("[Idempotency] Concurrent send lost to message {}", winner.getId());
        return Optional.of(winner);
    }
}
