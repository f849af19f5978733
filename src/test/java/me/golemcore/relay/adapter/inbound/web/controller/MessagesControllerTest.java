package me.golemcore.relay.adapter.inbound.web.controller;

import me.golemcore.relay.adapter.inbound.web.dto.MessageDto;
import me.golemcore.relay.adapter.inbound.web.dto.MessageSummaryDto;
import me.golemcore.relay.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.relay.adapter.inbound.web.dto.SendMessageResponse;
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.DeliveryCounts;
import me.golemcore.relay.domain.model.MessageStatus;
import me.golemcore.relay.domain.model.MessageSummary;
import me.golemcore.relay.domain.model.MessageView;
import me.golemcore.relay.domain.model.RecipientType;
import me.golemcore.relay.domain.model.SendMessageCommand;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.service.MessageHistoryService;
import me.golemcore.relay.domain.service.MessageRoutingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessagesControllerTest {

    private MessageRoutingService routingService;
    private MessageHistoryService historyService;
    private MessagesController controller;

    @BeforeEach
    void setUp() {
        routingService = mock(MessageRoutingService.class);
        historyService = mock(MessageHistoryService.class);
        controller = new MessagesController(routingService, historyService);
    }

    @Test
    void shouldReturnOkForDeliveredDirectSend() {
        when(routingService.send(eq("user-a"), any(SendMessageCommand.class))).thenReturn(SendResult.builder()
                .messageId("m1")
                .status(MessageStatus.DELIVERED)
                .build());

        SendMessageRequest request = SendMessageRequest.builder()
                .recipient("bob")
                .message("hello")
                .idempotencyKey("k1")
                .build();

        StepVerifier.create(controller.send("user-a", request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SendMessageResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("m1", body.getMessageId());
                    assertEquals("delivered", body.getStatus());
                    assertNull(body.getDeduplicated());
                    assertNull(body.getRejectionReason());
                })
                .verifyComplete();

        ArgumentCaptor<SendMessageCommand> captor = ArgumentCaptor.forClass(SendMessageCommand.class);
        verify(routingService).send(eq("user-a"), captor.capture());
        assertEquals(RecipientType.USER, captor.getValue().getRecipientType());
        assertEquals("k1", captor.getValue().getIdempotencyKey());
    }

    @Test
    void shouldReturnForbiddenWhenPolicyRejects() {
        when(routingService.send(eq("user-a"), any(SendMessageCommand.class))).thenReturn(SendResult.builder()
                .messageId("m2")
                .status(MessageStatus.REJECTED)
                .rejectionReason("Message blocked by policy")
                .build());

        SendMessageRequest request = SendMessageRequest.builder().recipient("bob").message("secret").build();

        StepVerifier.create(controller.send("user-a", request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
                    assertEquals("rejected", response.getBody().getStatus());
                    assertEquals("Message blocked by policy", response.getBody().getRejectionReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldMarkDeduplicatedSends() {
        when(routingService.send(eq("user-a"), any(SendMessageCommand.class))).thenReturn(SendResult.builder()
                .messageId("m1")
                .status(MessageStatus.PENDING)
                .deduplicated(true)
                .build());

        SendMessageRequest request = SendMessageRequest.builder().recipient("bob").message("hi").build();

        StepVerifier.create(controller.send("user-a", request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(Boolean.TRUE, response.getBody().getDeduplicated());
                })
                .verifyComplete();
    }

    @Test
    void shouldPassGroupCountersThrough() {
        when(routingService.send(eq("user-a"), any(SendMessageCommand.class))).thenReturn(SendResult.builder()
                .messageId("m3")
                .status(MessageStatus.PENDING)
                .recipients(3)
                .delivered(2)
                .pending(1)
                .failed(0)
                .build());

        SendMessageRequest request = SendMessageRequest.builder()
                .recipient("g1")
                .recipientType("group")
                .message("team update")
                .build();

        StepVerifier.create(controller.send("user-a", request))
                .assertNext(response -> {
                    SendMessageResponse body = response.getBody();
                    assertEquals(3, body.getRecipients());
                    assertEquals(2, body.getDelivered());
                    assertEquals(1, body.getPending());
                    assertEquals(0, body.getFailed());
                })
                .verifyComplete();

        ArgumentCaptor<SendMessageCommand> captor = ArgumentCaptor.forClass(SendMessageCommand.class);
        verify(routingService).send(eq("user-a"), captor.capture());
        assertEquals(RecipientType.GROUP, captor.getValue().getRecipientType());
    }

    @Test
    void shouldRejectUnknownRecipientType() {
        SendMessageRequest request = SendMessageRequest.builder()
                .recipient("bob")
                .recipientType("channel")
                .message("hi")
                .build();

        StepVerifier.create(controller.send("user-a", request))
                .expectErrorSatisfies(error -> {
                    RelayException relayError = (RelayException) error;
                    assertEquals(ErrorCode.INVALID_REQUEST, relayError.getCode());
                })
                .verify();
        verify(routingService, never()).send(anyString(), any());
    }

    @Test
    void shouldRequireCallerHeader() {
        SendMessageRequest request = SendMessageRequest.builder().recipient("bob").message("hi").build();

        StepVerifier.create(controller.send(null, request))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.UNAUTHORIZED,
                        ((RelayException) error).getCode()))
                .verify();
        StepVerifier.create(controller.history("  ", null, null, null))
                .expectError(RelayException.class)
                .verify();
    }

    @Test
    void shouldMapHistoryEntries() {
        Instant created = Instant.parse("2026-01-05T10:00:00Z");
        when(historyService.history("user-a", "sent", null, 10)).thenReturn(List.of(new MessageView(
                "m1", "c1", "alice", "conn-a", "bob", RecipientType.USER, "hello", null,
                MessageStatus.DELIVERED, created, created.plusSeconds(1))));

        StepVerifier.create(controller.history("user-a", "sent", null, 10))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<MessageDto> messages = response.getBody();
                    assertEquals(1, messages.size());
                    MessageDto dto = messages.get(0);
                    assertEquals("alice", dto.sender());
                    assertEquals("bob", dto.recipient());
                    assertEquals("user", dto.recipientType());
                    assertEquals("delivered", dto.status());
                    assertEquals(created, dto.createdAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldIncludeDeliveryCountsInGroupSummary() {
        when(historyService.summary("user-a", "m3")).thenReturn(new MessageSummary("m3", RecipientType.GROUP,
                MessageStatus.PENDING, null, 0, new DeliveryCounts(2, 1, 0)));

        StepVerifier.create(controller.summary("user-a", "m3"))
                .assertNext(response -> {
                    MessageSummaryDto body = response.getBody();
                    assertEquals("group", body.recipientType());
                    assertEquals("pending", body.status());
                    assertEquals(3, body.deliveries().total());
                    assertEquals(1, body.deliveries().pending());
                })
                .verifyComplete();
    }

    @Test
    void shouldOmitDeliveryCountsForDirectSummary() {
        when(historyService.summary("user-a", "m1")).thenReturn(new MessageSummary("m1", RecipientType.USER,
                MessageStatus.FAILED, null, 6, null));

        StepVerifier.create(controller.summary("user-a", "m1"))
                .assertNext(response -> {
                    MessageSummaryDto body = response.getBody();
                    assertNull(body.deliveries());
                    assertEquals(6, body.retryCount());
                    assertEquals("failed", body.status());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateNotFoundFromSummary() {
        when(historyService.summary("user-a", "missing"))
                .thenThrow(new RelayException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found"));

        StepVerifier.create(controller.summary("user-a", "missing"))
                .expectErrorMessage("Message not found")
                .verify();
    }
}
