package me.golemcore.relay;

import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.CreatePolicyCommand;
import me.golemcore.relay.domain.model.Message;
import me.golemcore.relay.domain.model.MessageStatus;
import me.golemcore.relay.domain.model.MessageView;
import me.golemcore.relay.domain.model.SendMessageCommand;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.service.WebhookDispatcher;
import me.golemcore.relay.security.CallbackSigner;
import me.golemcore.relay.testsupport.RelayTestHarness;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Direct sends through the whole relay: storage, policies, signed webhook
 * delivery over HTTP and history.
 */
class RelayEndToEndTest {

    private RelayTestHarness relay;
    private MockWebServer bobAgent;
    private MockWebServer aliceAgent;
    private String bobSecret;

    @BeforeEach
    void setUp() throws IOException {
        relay = new RelayTestHarness();
        bobAgent = RelayTestHarness.startReceiver();
        aliceAgent = RelayTestHarness.startReceiver();

        relay.database().user("user-a", "alice");
        relay.database().user("user-b", "bob");
        relay.database().user("user-c", "carol");
        relay.database().friendship("user-a", "user-b", "accepted");

        bobSecret = relay.registerAgent("user-b", "default", RelayTestHarness.callbackUrl(bobAgent));
        relay.registerAgent("user-a", "default", RelayTestHarness.callbackUrl(aliceAgent));
    }

    @AfterEach
    void tearDown() throws IOException {
        bobAgent.shutdown();
        aliceAgent.shutdown();
        relay.close();
    }

    private static SendMessageCommand toUser(String username, String message, String idempotencyKey) {
        return SendMessageCommand.builder()
                .recipient(username)
                .message(message)
                .idempotencyKey(idempotencyKey)
                .build();
    }

    @Test
    void shouldDeliverSignedWebhookAndDeduplicateRetriedSend() throws Exception {
        bobAgent.enqueue(new MockResponse().setResponseCode(200));

        SendResult first = relay.routingService().send("user-a", toUser("bob", "hello bob", "k1"));

        assertEquals(MessageStatus.DELIVERED, first.getStatus());
        RecordedRequest request = bobAgent.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        String body = request.getBody().readUtf8();
        long timestamp = Long.parseLong(request.getHeader(WebhookDispatcher.HEADER_TIMESTAMP));
        assertTrue(CallbackSigner.verify(bobSecret, timestamp, body,
                request.getHeader(WebhookDispatcher.HEADER_SIGNATURE)));
        assertEquals(first.getMessageId(), request.getHeader(WebhookDispatcher.HEADER_MESSAGE_ID));
        assertTrue(body.contains("\"sender\":\"alice\""));
        assertTrue(body.contains("\"message\":\"hello bob\""));

        SendResult again = relay.routingService().send("user-a", toUser("bob", "hello bob", "k1"));

        assertTrue(again.isDeduplicated());
        assertEquals(first.getMessageId(), again.getMessageId());
        assertEquals(1, bobAgent.getRequestCount());

        Message stored = relay.ledger().findMessage(first.getMessageId()).orElseThrow();
        assertEquals(MessageStatus.DELIVERED, stored.getStatus());
        assertNotNull(stored.getDeliveredAt());
    }

    @Test
    void shouldScopeIdempotencyKeysToSender() throws Exception {
        bobAgent.enqueue(new MockResponse().setResponseCode(200));
        aliceAgent.enqueue(new MockResponse().setResponseCode(200));

        SendResult fromAlice = relay.routingService().send("user-a", toUser("bob", "ping", "k1"));
        SendResult fromBob = relay.routingService().send("user-b", toUser("alice", "pong", "k1"));

        assertNotEquals(fromAlice.getMessageId(), fromBob.getMessageId());
        assertEquals(MessageStatus.DELIVERED, fromBob.getStatus());
        assertEquals(1, aliceAgent.getRequestCount());
    }

    @Test
    void shouldKeepMessagePendingWhenReceiverFails() {
        bobAgent.enqueue(new MockResponse().setResponseCode(500));

        SendResult result = relay.routingService().send("user-a", toUser("bob", "are you there?", null));

        assertEquals(MessageStatus.PENDING, result.getStatus());
        assertEquals(1, relay.retryScheduler().outstanding());
        Message stored = relay.ledger().findMessage(result.getMessageId()).orElseThrow();
        assertEquals(1, stored.getRetryCount());
    }

    @Test
    void shouldRejectWithoutDeliveringWhenPolicyBlocks() {
        relay.policyService().create("user-a", CreatePolicyCommand.builder()
                .scope("global")
                .policyType("heuristic")
                .policyContent("{\"blockedPatterns\":[\"password\"]}")
                .build());

        SendResult result = relay.routingService().send("user-a", toUser("bob", "my password is hunter2", null));

        assertTrue(result.isRejected());
        assertNotNull(result.getRejectionReason());
        assertEquals(0, bobAgent.getRequestCount());

        List<MessageView> sent = relay.historyService().history("user-a", "sent", null, null);
        assertEquals(1, sent.size());
        assertEquals(MessageStatus.REJECTED, sent.get(0).status());
        assertEquals("bob", sent.get(0).recipient());
    }

    @Test
    void shouldRefuseSendsBetweenStrangers() {
        RelayException ex = assertThrows(RelayException.class,
                () -> relay.routingService().send("user-c", toUser("bob", "hi", null)));

        assertEquals(ErrorCode.NOT_FRIENDS, ex.getCode());
        assertEquals(0, bobAgent.getRequestCount());
        assertTrue(relay.historyService().history("user-c", "sent", null, null).isEmpty());
    }

    @Test
    void shouldListMessagesForBothParties() {
        bobAgent.enqueue(new MockResponse().setResponseCode(200));
        relay.routingService().send("user-a", toUser("bob", "lunch?", null));

        List<MessageView> received = relay.historyService().history("user-b", "received", null, null);

        assertEquals(1, received.size());
        assertEquals("alice", received.get(0).sender());
        assertEquals("lunch?", received.get(0).message());
    }
}
