package me.golemcore.relay.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.adapter.inbound.web.dto.MessageDto;
import me.golemcore.relay.adapter.inbound.web.dto.MessageSummaryDto;
import me.golemcore.relay.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.relay.adapter.inbound.web.dto.SendMessageResponse;
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.MessageSummary;
import me.golemcore.relay.domain.model.MessageView;
import me.golemcore.relay.domain.model.RecipientType;
import me.golemcore.relay.domain.model.SendMessageCommand;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.service.MessageHistoryService;
import me.golemcore.relay.domain.service.MessageRoutingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Send, history and per-message status endpoints. A policy rejection answers
 * 403 with the rejection reason in the body.
 */
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
public class MessagesController {

    private final MessageRoutingService routingService;
    private final MessageHistoryService historyService;

    @PostMapping("/send")
    public Mono<ResponseEntity<SendMessageResponse>> send(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @RequestBody SendMessageRequest request) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            SendResult result = routingService.send(caller, toCommand(request));
            HttpStatus status = result.isRejected() ? HttpStatus.FORBIDDEN : HttpStatus.OK;
            return ResponseEntity.status(status).body(toResponse(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<List<MessageDto>>> history(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @RequestParam(required = false) String direction,
            @RequestParam(required = false) String since,
            @RequestParam(required = false) Integer limit) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            List<MessageDto> messages = historyService.history(caller, direction, since, limit).stream()
                    .map(MessagesController::toDto)
                    .toList();
            return ResponseEntity.ok(messages);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<MessageSummaryDto>> summary(
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String userId,
            @PathVariable String id) {
        return Mono.fromCallable(() -> {
            String caller = CallerIdentity.require(userId);
            return ResponseEntity.ok(toDto(historyService.summary(caller, id)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static SendMessageCommand toCommand(SendMessageRequest request) {
        RecipientType recipientType;
        try {
            recipientType = RecipientType.fromValue(request.getRecipientType());
        } catch (IllegalArgumentException e) {
            throw new RelayException(ErrorCode.INVALID_REQUEST, "recipient_type must be user or group");
        }
        return SendMessageCommand.builder()
                .recipient(request.getRecipient())
                .recipientType(recipientType)
                .recipientConnectionId(request.getRecipientConnectionId())
                .routingHints(request.getRoutingHints())
                .message(request.getMessage())
                .context(request.getContext())
                .payloadType(request.getPayloadType())
                .encryption(request.getEncryption())
                .senderSignature(request.getSenderSignature())
                .correlationId(request.getCorrelationId())
                .idempotencyKey(request.getIdempotencyKey())
                .build();
    }

    private static SendMessageResponse toResponse(SendResult result) {
        return SendMessageResponse.builder()
                .messageId(result.getMessageId())
                .status(result.getStatus().value())
                .deduplicated(result.isDeduplicated() ? Boolean.TRUE : null)
                .rejectionReason(result.isRejected() ? result.getRejectionReason() : null)
                .recipients(result.getRecipients())
                .delivered(result.getDelivered())
                .pending(result.getPending())
                .failed(result.getFailed())
                .build();
    }

    private static MessageDto toDto(MessageView view) {
        return new MessageDto(view.id(), view.correlationId(), view.sender(), view.senderAgent(),
                view.recipient(), view.recipientType().value(), view.message(), view.context(),
                view.status().value(), view.createdAt(), view.deliveredAt());
    }

    private static MessageSummaryDto toDto(MessageSummary summary) {
        DeliveryCounts counts = summary.deliveries();
        MessageSummaryDto.DeliveryCountsDto deliveries = counts == null ? null
                : new MessageSummaryDto.DeliveryCountsDto(counts.delivered(), counts.pending(), counts.failed(),
                        counts.total());
        return new MessageSummaryDto(summary.messageId(), summary.recipientType().value(),
                summary.status().value(), summary.rejectionReason(), summary.retryCount(), deliveries);
    }
}
