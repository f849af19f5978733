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

import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.Group;
import me.golemcore.relay.domain.model.HistoryDirection;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.MessageDelivery;
import me.golemcore.relay.domain.model.MessageSummary;
import me.golemcore.relay.domain.model.MessageView;
import me.golemcore.relay.domain.model.RecipientType;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.MessageLedgerPort;
import me.golemcore.relay.port.outbound.RelationshipPort;
import me.golemcore.relay.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read side of the ledger: message history and per-message delivery
 * summaries.
 */
@Service
public class MessageHistoryService {

    private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

    private final MessageLedgerPort ledger;
    private final UserDirectoryPort userDirectory;
    private final RelationshipPort relationshipPort;
    private final RelayProperties properties;

    public MessageHistoryService(MessageLedgerPort ledger, UserDirectoryPort userDirectory,
            RelationshipPort relationshipPort, RelayProperties properties) {
        this.ledger = ledger;
        this.userDirectory = userDirectory;
        this.relationshipPort = relationshipPort;
        this.properties = properties;
    }

    public List<MessageView> history(String userId, String direction, String since, Integer limit) {
        HistoryDirection parsedDirection;
        try {
            parsedDirection = HistoryDirection.fromValue(direction);
        } catch (IllegalArgumentException e) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "direction must be sent, received or both");
        }
        Instant sinceInstant = parseSince(since);
        int effectiveLimit = effectiveLimit(limit);

        List<Message> messages = ledger.findHistory(userId, parsedDirection, sinceInstant, effectiveLimit);

        Set<String> userIds = new HashSet<>();
        for (Message message : messages) {
            userIds.add(message.getSenderUserId());
            if (message.getRecipientType() == RecipientType.USER) {
                userIds.add(message.getRecipientId());
            }
        }
        Map<String, String> usernames = userDirectory.usernamesByIds(userIds);

        return messages.stream()
                .map(message -> toView(message, usernames))
                .toList();
    }

    public MessageSummary summary(String userId, String messageId) {
        Message message = ledger.findMessage(messageId)
                .filter(m -> isVisibleTo(m, userId))
                .orElseThrow(() -> new RelayException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found"));
        DeliveryCounts counts = message.getRecipientType() == RecipientType.GROUP
                ? ledger.countDeliveries(messageId)
                : null;
        return new MessageSummary(message.getId(), message.getRecipientType(), message.getStatus(),
                message.getRejectionReason(), message.getRetryCount(), counts);
    }

    /**
     * Parses a history cursor: epoch seconds, epoch millis (values of 10^12 and
     * above) or an ISO-8601 instant/offset date-time. Blank means no cursor.
     */
    static Instant parseSince(String since) {
        if (since == null || since.isBlank()) {
            return null;
        }
        String value = since.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                long number = Long.parseLong(value);
                return number < MILLIS_THRESHOLD ? Instant.ofEpochSecond(number) : Instant.ofEpochMilli(number);
            } catch (NumberFormatException e) {
                throw new RelayException(ErrorCode.INVALID_SINCE, "Invalid since timestamp: " + since);
            }
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException notAnInstant) {
                throw new RelayException(ErrorCode.INVALID_SINCE, "Invalid since timestamp: " + since);
            }
        }
    }

    private int effectiveLimit(Integer limit) {
        RelayProperties.MessageProperties config = properties.getMessage();
        if (limit == null || limit < 1) {
            return config.getHistoryDefaultLimit();
        }
        return Math.min(limit, config.getHistoryMaxLimit());
    }

    private boolean isVisibleTo(Message message, String userId) {
        if (userId.equals(message.getSenderUserId())) {
            return true;
        }
        if (message.getRecipientType() == RecipientType.USER) {
            return userId.equals(message.getRecipientId());
        }
        List<MessageDelivery> deliveries = ledger.findDeliveries(message.getId());
        return deliveries.stream().anyMatch(delivery -> userId.equals(delivery.getRecipientUserId()));
    }

    private MessageView toView(Message message, Map<String, String> usernames) {
        String recipient;
        if (message.getRecipientType() == RecipientType.GROUP) {
            recipient = relationshipPort.findGroup(message.getRecipientId())
                    .map(Group::name)
                    .orElse(message.getRecipientId());
        } else {
            recipient = usernames.getOrDefault(message.getRecipientId(), message.getRecipientId());
        }
        return new MessageView(
                message.getId(),
                message.getCorrelationId(),
                usernames.getOrDefault(message.getSenderUserId(), message.getSenderUserId()),
                message.getSenderAgent(),
                recipient,
                message.getRecipientType(),
                message.getPayload(),
                message.getContext(),
                message.getStatus(),
                message.getCreatedAt(),
                message.getDeliveredAt());
    }
}
