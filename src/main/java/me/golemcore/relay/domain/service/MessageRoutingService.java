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
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.DeliveryStatus;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.FriendshipStatus;
import me.golemcore.relay.domain.model.Group;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.MessageDelivery;
import me.golemcore.relay.domain.model.MessageStatus;
import me.golemcore.relay.domain.model.PolicyDecision;
import me.golemcore.relay.domain.model.RecipientType;
import me.golemcore.relay.domain.model.SendMessageCommand;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.model.UserAccount;
import me.golemcore.relay.domain.model.WebhookPayload;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.MessageLedgerPort;
import me.golemcore.relay.port.outbound.RelationshipPort;
import me.golemcore.relay.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Send orchestration for direct and group messages.
 *
 * <p>
 * Direct: recipient lookup, relationship check, idempotency, payload size,
 * connection selection, policy gate, persist, first attempt. Group:
 * membership check, idempotency, payload size, policy gate, persist the
 * parent and one delivery row per member, then one first attempt per row.
 *
 * <p>
 * The first attempt is synchronous; failed attempts continue in the retry
 * scheduler and the caller gets the status as of now.
 */
@Service
@Slf4j
public class MessageRoutingService {

    static final String DEFAULT_SENDER_AGENT = "agent";
    static final String NO_ACTIVE_CONNECTION = "No active connection";

    private final UserDirectoryPort userDirectory;
    private final RelationshipPort relationshipPort;
    private final MessageLedgerPort ledger;
    private final ConnectionSelector connectionSelector;
    private final IdempotencyGuard idempotencyGuard;
    private final PayloadSizeValidator payloadSizeValidator;
    private final PolicyEvaluator policyEvaluator;
    private final DeliveryService deliveryService;
    private final DeliveryRecorder deliveryRecorder;
    private final RelayProperties properties;
    private final Clock clock;

    public MessageRoutingService(UserDirectoryPort userDirectory, RelationshipPort relationshipPort,
            MessageLedgerPort ledger, ConnectionSelector connectionSelector, IdempotencyGuard idempotencyGuard,
            PayloadSizeValidator payloadSizeValidator, PolicyEvaluator policyEvaluator,
            DeliveryService deliveryService, DeliveryRecorder deliveryRecorder, RelayProperties properties,
            Clock clock) {
        this.userDirectory = userDirectory;
        this.relationshipPort = relationshipPort;
        this.ledger = ledger;
        this.connectionSelector = connectionSelector;
        this.idempotencyGuard = idempotencyGuard;
        this.payloadSizeValidator = payloadSizeValidator;
        this.policyEvaluator = policyEvaluator;
        this.deliveryService = deliveryService;
        this.deliveryRecorder = deliveryRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    public SendResult send(String senderUserId, SendMessageCommand command) {
        if (command.getRecipient() == null || command.getRecipient().isBlank()) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "recipient is required");
        }
        if (command.getMessage() == null) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "message is required");
        }
        UserAccount sender = userDirectory.findById(senderUserId)
                .orElseThrow(() -> new RelayException(ErrorCode.UNAUTHORIZED, "Unknown sender"));

        if (command.getRecipientType() == RecipientType.GROUP) {
            return sendToGroup(sender, command);
        }
        return sendDirect(sender, command);
    }

    private SendResult sendDirect(UserAccount sender, SendMessageCommand command) {
        UserAccount recipient = userDirectory.findByUsername(command.getRecipient())
                .orElseThrow(() -> new RelayException(ErrorCode.USER_NOT_FOUND, "Recipient user not found"));

        FriendshipStatus friendship = relationshipPort.friendshipStatus(sender.id(), recipient.id());
        if (friendship == FriendshipStatus.BLOCKED) {
            throw new RelayException(ErrorCode.BLOCKED, "Messaging between these users is blocked");
        }
        if (friendship != FriendshipStatus.ACCEPTED) {
            throw new RelayException(ErrorCode.NOT_FRIENDS, "You are not friends with this user");
        }

        Optional<Message> prior = idempotencyGuard.findPrior(sender.id(), command.getIdempotencyKey());
        if (prior.isPresent()) {
            log.debug("[Routing] Duplicate send {} by {}", command.getIdempotencyKey(), sender.id());
            return SendResult.duplicate(prior.get());
        }

        payloadSizeValidator.validate(command.getMessage());

        AgentConnection connection = connectionSelector.select(recipient.id(), command.getRecipientConnectionId(),
                command.getRoutingHints());

        Message message = newMessage(sender, command, RecipientType.USER, recipient.id())
                .recipientConnectionId(connection.getId())
                .build();

        if (shouldEvaluatePolicies(message)) {
            PolicyDecision decision = policyEvaluator.evaluateDirect(sender.id(), recipient, command.getMessage(),
                    command.getContext());
            if (!decision.allowed()) {
                return persistRejected(message, decision.reason());
            }
        }

        Optional<Message> winner = idempotencyGuard.insertOrGetWinner(message);
        if (winner.isPresent()) {
            return SendResult.duplicate(winner.get());
        }

        WebhookPayload payload = payloadFor(message, sender, connection).build();
        DeliveryStatus status = deliveryService.deliver(DeliveryTarget.message(message.getId()), connection, payload);
        log.info("[Routing] Message {} {} -> {} is {}", message.getId(), sender.username(), recipient.username(),
                status.value());
        return SendResult.builder()
                .messageId(message.getId())
                .status(status.toMessageStatus())
                .build();
    }

    private SendResult sendToGroup(UserAccount sender, SendMessageCommand command) {
        Group group = relationshipPort.findGroup(command.getRecipient())
                .orElseThrow(() -> new RelayException(ErrorCode.GROUP_NOT_FOUND, "Group not found"));
        if (!relationshipPort.isActiveMember(group.id(), sender.id())) {
            throw new RelayException(ErrorCode.NOT_MEMBER, "You are not a member of this group");
        }

        Optional<Message> prior = idempotencyGuard.findPrior(sender.id(), command.getIdempotencyKey());
        if (prior.isPresent()) {
            return SendResult.duplicate(prior.get());
        }

        payloadSizeValidator.validate(command.getMessage());

        Message message = newMessage(sender, command, RecipientType.GROUP, group.id()).build();

        if (shouldEvaluatePolicies(message)) {
            PolicyDecision decision = policyEvaluator.evaluateGroup(sender.id(), group, command.getMessage(),
                    command.getContext());
            if (!decision.allowed()) {
                return persistRejected(message, decision.reason());
            }
        }

        Optional<Message> winner = idempotencyGuard.insertOrGetWinner(message);
        if (winner.isPresent()) {
            return SendResult.duplicate(winner.get());
        }

        List<String> members = relationshipPort.activeMemberIds(group.id()).stream()
                .filter(memberId -> !memberId.equals(sender.id()))
                .toList();
        if (members.isEmpty()) {
            ledger.finalizeMessage(message.getId(), MessageStatus.DELIVERED, clock.instant());
            log.info("[Routing] Group message {} to {} has no other members", message.getId(), group.id());
            return groupResult(message.getId(), MessageStatus.DELIVERED, 0, new DeliveryCounts(0, 0, 0));
        }

        // All rows exist before the first attempt so the aggregate cannot finalize early.
        List<PendingFanOut> fanOut = new ArrayList<>();
        for (String memberId : members) {
            Optional<AgentConnection> connection = connectionSelector.primary(memberId);
            MessageDelivery delivery = MessageDelivery.builder()
                    .id(UUID.randomUUID().toString())
                    .messageId(message.getId())
                    .recipientUserId(memberId)
                    .connectionId(connection.map(AgentConnection::getId).orElse(null))
                    .status(connection.isPresent() ? DeliveryStatus.PENDING : DeliveryStatus.FAILED)
                    .errorMessage(connection.isPresent() ? null : NO_ACTIVE_CONNECTION)
                    .createdAt(message.getCreatedAt())
                    .build();
            ledger.insertDelivery(delivery);
            connection.ifPresent(c -> fanOut.add(new PendingFanOut(delivery, c)));
        }

        for (PendingFanOut item : fanOut) {
            WebhookPayload payload = payloadFor(message, sender, item.connection())
                    .deliveryId(item.delivery().getId())
                    .groupId(group.id())
                    .groupName(group.name())
                    .build();
            deliveryService.deliver(DeliveryTarget.delivery(message.getId(), item.delivery().getId()),
                    item.connection(), payload);
        }

        DeliveryCounts counts = deliveryRecorder.refreshAggregate(message.getId());
        log.info("[Routing] Group message {} to {}: {} recipients, {} delivered, {} pending, {} failed",
                message.getId(), group.id(), members.size(), counts.delivered(), counts.pending(), counts.failed());
        return groupResult(message.getId(), counts.aggregateStatus(), members.size(), counts);
    }

    private boolean shouldEvaluatePolicies(Message message) {
        return properties.getMode().isTrusted() && message.isPlaintext();
    }

    private SendResult persistRejected(Message message, String reason) {
        Message rejected = message.toBuilder()
                .status(MessageStatus.REJECTED)
                .rejectionReason(reason)
                .build();
        Optional<Message> winner = idempotencyGuard.insertOrGetWinner(rejected);
        if (winner.isPresent()) {
            return SendResult.duplicate(winner.get());
        }
        log.info("[Routing] Message {} rejected by policy: {}", rejected.getId(), reason);
        return SendResult.builder()
                .messageId(rejected.getId())
                .status(MessageStatus.REJECTED)
                .rejectionReason(reason)
                .build();
    }

    private Message.MessageBuilder newMessage(UserAccount sender, SendMessageCommand command,
            RecipientType recipientType, String recipientId) {
        List<String> labels = command.effectiveRoutingHints().labels();
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .correlationId(command.getCorrelationId())
                .senderUserId(sender.id())
                .senderAgent(labels.isEmpty() ? DEFAULT_SENDER_AGENT : labels.get(0))
                .recipientType(recipientType)
                .recipientId(recipientId)
                .payload(command.getMessage())
                .payloadType(command.effectivePayloadType())
                .encryption(command.getEncryption())
                .senderSignature(command.getSenderSignature())
                .context(command.getContext())
                .idempotencyKey(command.getIdempotencyKey())
                .createdAt(clock.instant());
    }

    private WebhookPayload.WebhookPayloadBuilder payloadFor(Message message, UserAccount sender,
            AgentConnection connection) {
        Instant createdAt = message.getCreatedAt();
        return WebhookPayload.builder()
                .messageId(message.getId())
                .correlationId(message.getCorrelationId())
                .recipientConnectionId(connection.getId())
                .sender(sender.username())
                .senderAgent(message.getSenderAgent())
                .message(message.getPayload())
                .payloadType(message.getPayloadType())
                .encryption(message.getEncryption())
                .senderSignature(message.getSenderSignature())
                .context(message.getContext())
                .timestamp(createdAt.toString());
    }

    private SendResult groupResult(String messageId, MessageStatus status, int recipients, DeliveryCounts counts) {
        return SendResult.builder()
                .messageId(messageId)
                .status(status)
                .recipients(recipients)
                .delivered(counts.delivered())
                .pending(counts.pending())
                .failed(counts.failed())
                .build();
    }

    private record PendingFanOut(MessageDelivery delivery, AgentConnection connection) {
    }
}
