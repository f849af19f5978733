package me.golemcore.relay.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.DeliveryStatus;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.EncryptionInfo;
import me.golemcore.relay.domain.model.HistoryDirection;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.MessageDelivery;
import me.golemcore.relay.domain.model.MessageStatus;
import me.golemcore.relay.domain.model.RecipientType;
import me.golemcore.relay.domain.model.SenderSignature;
import me.golemcore.relay.port.outbound.MessageLedgerPort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.instant;
import static me.golemcore.relay.adapter.outbound.storage.JdbcColumns.toMillis;

/**
 * {@link MessageLedgerPort} over the {@code messages} and
 * {@code message_deliveries} tables. Every state change is one
 * {@code UPDATE ... WHERE status = 'pending'} statement.
 */
@Component
@Slf4j
public class JdbcMessageLedgerAdapter implements MessageLedgerPort {

    private static final String PENDING = MessageStatus.PENDING.value();

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<Message> messageMapper = this::mapMessage;
    private final RowMapper<MessageDelivery> deliveryMapper = this::mapDelivery;

    public JdbcMessageLedgerAdapter(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean insertMessage(Message message) {
        try {
            jdbcTemplate.update("""
                    INSERT INTO messages (id, correlation_id, sender_user_id, sender_agent, recipient_type,
                        recipient_id, recipient_connection_id, payload, payload_type, encryption, sender_signature,
                        context, status, rejection_reason, retry_count, idempotency_key, created_at_ms,
                        delivered_at_ms)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    message.getId(),
                    message.getCorrelationId(),
                    message.getSenderUserId(),
                    message.getSenderAgent(),
                    message.getRecipientType().value(),
                    message.getRecipientId(),
                    message.getRecipientConnectionId(),
                    message.getPayload(),
                    message.getPayloadType(),
                    toJson(message.getEncryption()),
                    toJson(message.getSenderSignature()),
                    message.getContext(),
                    message.getStatus().value(),
                    message.getRejectionReason(),
                    message.getRetryCount(),
                    message.getIdempotencyKey(),
                    toMillis(message.getCreatedAt()),
                    toMillis(message.getDeliveredAt()));
            return true;
        } catch (DataAccessException e) {
            if (message.getIdempotencyKey() != null
                    && findBySenderAndIdempotencyKey(message.getSenderUserId(), message.getIdempotencyKey())
                            .isPresent()) {
                log.debug("[Ledger] Idempotency conflict for sender {} key {}", message.getSenderUserId(),
                        message.getIdempotencyKey());
                return false;
            }
            throw e;
        }
    }

    @Override
    public Optional<Message> findMessage(String messageId) {
        return jdbcTemplate.query("SELECT * FROM messages WHERE id = ?", messageMapper, messageId)
                .stream().findFirst();
    }

    @Override
    public Optional<Message> findBySenderAndIdempotencyKey(String senderUserId, String idempotencyKey) {
        return jdbcTemplate.query("SELECT * FROM messages WHERE sender_user_id = ? AND idempotency_key = ?",
                messageMapper, senderUserId, idempotencyKey)
                .stream().findFirst();
    }

    @Override
    public void insertDelivery(MessageDelivery delivery) {
        jdbcTemplate.update("""
                INSERT INTO message_deliveries (id, message_id, recipient_user_id, connection_id, status,
                    retry_count, error_message, created_at_ms, delivered_at_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                delivery.getId(),
                delivery.getMessageId(),
                delivery.getRecipientUserId(),
                delivery.getConnectionId(),
                delivery.getStatus().value(),
                delivery.getRetryCount(),
                delivery.getErrorMessage(),
                toMillis(delivery.getCreatedAt()),
                toMillis(delivery.getDeliveredAt()));
    }

    @Override
    public List<MessageDelivery> findDeliveries(String messageId) {
        return jdbcTemplate.query("SELECT * FROM message_deliveries WHERE message_id = ? ORDER BY created_at_ms, id",
                deliveryMapper, messageId);
    }

    @Override
    public DeliveryCounts countDeliveries(String messageId) {
        int[] counts = new int[3];
        jdbcTemplate.query("SELECT status, COUNT(*) AS total FROM message_deliveries WHERE message_id = ? "
                + "GROUP BY status", rs -> {
                    DeliveryStatus status = DeliveryStatus.fromValue(rs.getString("status"));
                    counts[status.ordinal()] = rs.getInt("total");
                }, messageId);
        return new DeliveryCounts(counts[DeliveryStatus.DELIVERED.ordinal()],
                counts[DeliveryStatus.PENDING.ordinal()],
                counts[DeliveryStatus.FAILED.ordinal()]);
    }

    @Override
    public boolean markDelivered(DeliveryTarget target, Instant deliveredAt) {
        String sql = "UPDATE " + table(target)
                + " SET status = ?, delivered_at_ms = ? WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, DeliveryStatus.DELIVERED.value(), toMillis(deliveredAt),
                target.recordId(), PENDING) > 0;
    }

    @Override
    public boolean markFailed(DeliveryTarget target, String reason) {
        String reasonColumn = target.isFanOut() ? "error_message" : "rejection_reason";
        String sql = "UPDATE " + table(target) + " SET status = ?, " + reasonColumn
                + " = ? WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, DeliveryStatus.FAILED.value(), reason, target.recordId(), PENDING) > 0;
    }

    @Override
    public void updateRetryCount(DeliveryTarget target, int retryCount) {
        jdbcTemplate.update("UPDATE " + table(target) + " SET retry_count = ? WHERE id = ? AND status = ?",
                retryCount, target.recordId(), PENDING);
    }

    @Override
    public boolean finalizeMessage(String messageId, MessageStatus status, Instant deliveredAt) {
        return jdbcTemplate.update(
                "UPDATE messages SET status = ?, delivered_at_ms = ? WHERE id = ? AND status = ?",
                status.value(), toMillis(deliveredAt), messageId, PENDING) > 0;
    }

    @Override
    public List<Message> findHistory(String userId, HistoryDirection direction, Instant since, int limit) {
        String received = "(status <> 'rejected' AND ((recipient_type = 'user' AND recipient_id = ?) "
                + "OR id IN (SELECT message_id FROM message_deliveries WHERE recipient_user_id = ?)))";
        StringBuilder sql = new StringBuilder("SELECT * FROM messages WHERE ");
        List<Object> args = new ArrayList<>();
        switch (direction) {
        case SENT -> {
            sql.append("sender_user_id = ?");
            args.add(userId);
        }
        case RECEIVED -> {
            sql.append(received);
            args.add(userId);
            args.add(userId);
        }
        default -> {
            sql.append("(sender_user_id = ? OR ").append(received).append(')');
            args.add(userId);
            args.add(userId);
            args.add(userId);
        }
        }
        if (since != null) {
            sql.append(" AND created_at_ms > ?");
            args.add(since.toEpochMilli());
        }
        sql.append(" ORDER BY created_at_ms DESC, id DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), messageMapper, args.toArray());
    }

    private static String table(DeliveryTarget target) {
        return target.isFanOut() ? "message_deliveries" : "messages";
    }

    private Message mapMessage(ResultSet rs, int rowNum) throws SQLException {
        return Message.builder()
                .id(rs.getString("id"))
                .correlationId(rs.getString("correlation_id"))
                .senderUserId(rs.getString("sender_user_id"))
                .senderAgent(rs.getString("sender_agent"))
                .recipientType(RecipientType.fromValue(rs.getString("recipient_type")))
                .recipientId(rs.getString("recipient_id"))
                .recipientConnectionId(rs.getString("recipient_connection_id"))
                .payload(rs.getString("payload"))
                .payloadType(rs.getString("payload_type"))
                .encryption(fromJson(rs.getString("encryption"), EncryptionInfo.class))
                .senderSignature(fromJson(rs.getString("sender_signature"), SenderSignature.class))
                .context(rs.getString("context"))
                .status(MessageStatus.fromValue(rs.getString("status")))
                .rejectionReason(rs.getString("rejection_reason"))
                .retryCount(rs.getInt("retry_count"))
                .idempotencyKey(rs.getString("idempotency_key"))
                .createdAt(instant(rs, "created_at_ms"))
                .deliveredAt(instant(rs, "delivered_at_ms"))
                .build();
    }

    private MessageDelivery mapDelivery(ResultSet rs, int rowNum) throws SQLException {
        return MessageDelivery.builder()
                .id(rs.getString("id"))
                .messageId(rs.getString("message_id"))
                .recipientUserId(rs.getString("recipient_user_id"))
                .connectionId(rs.getString("connection_id"))
                .status(DeliveryStatus.fromValue(rs.getString("status")))
                .retryCount(rs.getInt("retry_count"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(instant(rs, "created_at_ms"))
                .deliveredAt(instant(rs, "delivered_at_ms"))
                .build();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Unreadable {} column: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
