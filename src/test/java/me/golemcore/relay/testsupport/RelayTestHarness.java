package me.golemcore.relay.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.adapter.outbound.llm.NoOpJudgeAdapter;
import me.golemcore.relay.adapter.outbound.storage.JdbcConnectionRegistryAdapter;
import me.golemcore.relay.adapter.outbound.storage.JdbcMessageLedgerAdapter;
import me.golemcore.relay.adapter.outbound.storage.JdbcPolicyStoreAdapter;
import me.golemcore.relay.adapter.outbound.storage.JdbcRelationshipAdapter;
import me.golemcore.relay.adapter.outbound.webhook.OkHttpWebhookAdapter;
import me.golemcore.relay.domain.model.RegisterConnectionCommand;
import me.golemcore.relay.domain.service.AgentConnectionService;
import me.golemcore.relay.domain.service.ConnectionSelector;
import me.golemcore.relay.domain.service.DeliveryRecorder;
import me.golemcore.relay.domain.service.DeliveryService;
import me.golemcore.relay.domain.service.HeuristicRuleParser;
import me.golemcore.relay.domain.service.IdempotencyGuard;
import me.golemcore.relay.domain.service.LlmPolicyJudge;
import me.golemcore.relay.domain.service.MessageHistoryService;
import me.golemcore.relay.domain.service.MessageRoutingService;
import me.golemcore.relay.domain.service.PayloadSizeValidator;
import me.golemcore.relay.domain.service.PolicyEvaluator;
import me.golemcore.relay.domain.service.PolicyService;
import me.golemcore.relay.domain.service.WebhookDispatcher;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.retry.InMemoryRetryQueue;
import me.golemcore.relay.retry.RetryScheduler;
import me.golemcore.relay.security.CallbackUrlValidator;
import me.golemcore.relay.testsupport.db.SqliteTestDatabase;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockWebServer;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Instant;

/**
 * The relay wired by hand over an in-memory database and a real OkHttp
 * webhook transport. The retry scheduler is constructed but never started;
 * tests drive it explicitly.
 */
public final class RelayTestHarness implements AutoCloseable {

    private final SqliteTestDatabase database = new SqliteTestDatabase();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final RelayProperties properties = new RelayProperties();
    private final JdbcMessageLedgerAdapter ledger;
    private final RetryScheduler retryScheduler;
    private final AgentConnectionService connectionService;
    private final PolicyService policyService;
    private final MessageRoutingService routingService;
    private final MessageHistoryService historyService;

    public RelayTestHarness() {
        properties.getMode().setTrusted(true);
        properties.getRetry().setEnabled(false);
        properties.getDelivery().setTimeoutMs(2000);

        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        ledger = new JdbcMessageLedgerAdapter(database.jdbcTemplate(), objectMapper);
        JdbcConnectionRegistryAdapter connections = new JdbcConnectionRegistryAdapter(database.jdbcTemplate(),
                objectMapper);
        JdbcRelationshipAdapter relationships = new JdbcRelationshipAdapter(database.jdbcTemplate());
        JdbcPolicyStoreAdapter policies = new JdbcPolicyStoreAdapter(database.jdbcTemplate());
        HeuristicRuleParser ruleParser = new HeuristicRuleParser(objectMapper);

        WebhookDispatcher dispatcher = new WebhookDispatcher(
                new OkHttpWebhookAdapter(new OkHttpClient(), properties), objectMapper, clock);
        DeliveryRecorder recorder = new DeliveryRecorder(ledger, connections, clock);
        retryScheduler = new RetryScheduler(new InMemoryRetryQueue(), dispatcher, recorder, connections,
                properties, clock);

        connectionService = new AgentConnectionService(connections, new CallbackUrlValidator(properties), clock);
        policyService = new PolicyService(policies, ruleParser, clock);
        PolicyEvaluator evaluator = new PolicyEvaluator(policies, relationships, ruleParser,
                new LlmPolicyJudge(new NoOpJudgeAdapter(), properties));
        routingService = new MessageRoutingService(relationships, relationships, ledger,
                new ConnectionSelector(connections), new IdempotencyGuard(ledger),
                new PayloadSizeValidator(properties), evaluator,
                new DeliveryService(dispatcher, recorder, retryScheduler), recorder, properties, clock);
        historyService = new MessageHistoryService(ledger, relationships, relationships, properties);
    }

    /**
     * Registers a connection and returns its callback secret.
     */
    public String registerAgent(String userId, String label, String callbackUrl) {
        return connectionService.register(userId, RegisterConnectionCommand.builder()
                .framework("clawdbot")
                .label(label)
                .callbackUrl(callbackUrl)
                .build()).callbackSecret();
    }

    /**
     * Starts a webhook receiver on the IPv4 loopback so its URL passes
     * callback validation outside production.
     */
    public static MockWebServer startReceiver() throws IOException {
        MockWebServer server = new MockWebServer();
        server.start(InetAddress.getByName("127.0.0.1"), 0);
        return server;
    }

    public static String callbackUrl(MockWebServer server) {
        return "http://127.0.0.1:" + server.getPort() + "/hook";
    }

    public SqliteTestDatabase database() {
        return database;
    }

    public MutableClock clock() {
        return clock;
    }

    public JdbcMessageLedgerAdapter ledger() {
        return ledger;
    }

    public RetryScheduler retryScheduler() {
        return retryScheduler;
    }

    public PolicyService policyService() {
        return policyService;
    }

    public MessageRoutingService routingService() {
        return routingService;
    }

    public MessageHistoryService historyService() {
        return historyService;
    }

    @Override
    public void close() {
        database.close();
    }
}
