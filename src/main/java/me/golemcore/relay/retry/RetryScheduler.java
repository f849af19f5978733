package me.golemcore.relay.retry;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.DeliveryAttempt;
import me.golemcore.relay.domain.model.DeliveryStatus;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.WebhookPayload;
import me.golemcore.relay.domain.service.DeliveryRecorder;
import me.golemcore.relay.domain.service.WebhookDispatcher;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ConnectionRegistryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redelivers failed webhook attempts with exponential backoff.
 *
 * <p>
 * Per task: {@code scheduled(n, next_at) -> attempting -> delivered |
 * scheduled(n + 1) | failed}. The n-th failure waits {@code 2^(n-1)} seconds.
 * A failure that pushes the count past {@code relay.retry.max-retries} marks
 * the record failed with {@value #MAX_RETRIES_EXCEEDED}; a connection that
 * disappeared or was deactivated marks it failed with
 * {@value #CONNECTION_NOT_FOUND}.
 *
 * <p>
 * A single background thread ticks at a fixed interval. Ticks never overlap:
 * while one is processing, the next ones are skipped.
 *
 * @since 1.0
 * @see RetryQueue
 */
@Component
@Slf4j
public class RetryScheduler {

    public static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";
    public static final String CONNECTION_NOT_FOUND = "Connection not found";

    private final RetryQueue queue;
    private final WebhookDispatcher dispatcher;
    private final DeliveryRecorder recorder;
    private final ConnectionRegistryPort connectionRegistry;
    private final RelayProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public RetryScheduler(RetryQueue queue, WebhookDispatcher dispatcher, DeliveryRecorder recorder,
            ConnectionRegistryPort connectionRegistry, RelayProperties properties, Clock clock) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.recorder = recorder;
        this.connectionRegistry = connectionRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        RelayProperties.RetryProperties retry = properties.getRetry();
        if (!retry.isEnabled()) {
            log.info("[Retry] Background retries disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-retry-scheduler");
            t.setDaemon(true);
            return t;
        });

        long interval = retry.getTickIntervalMs();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Retry] Started with tick interval: {}ms, max retries: {}", interval, retry.getMaxRetries());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (queue.size() > 0) {
            log.warn("[Retry] Shut down with {} outstanding retries", queue.size());
        } else {
            log.info("[Retry] Shut down");
        }
    }

    /**
     * Records a failed attempt and either schedules the next one or
     * finalizes the record.
     *
     * @param previousRetryCount
     *            failures recorded before this one
     * @return {@link DeliveryStatus#PENDING} when a retry was scheduled,
     *         {@link DeliveryStatus#FAILED} when the budget is exhausted
     */
    public DeliveryStatus onAttemptFailed(DeliveryTarget target, String connectionId, WebhookPayload payload,
            int previousRetryCount, String error) {
        int retryCount = previousRetryCount + 1;
        if (retryCount > properties.getRetry().getMaxRetries()) {
            queue.remove(target);
            log.warn("[Retry] {} exhausted its retries, last error: {}", target.key(), error);
            recorder.recordFailed(target, MAX_RETRIES_EXCEEDED);
            return DeliveryStatus.FAILED;
        }

        Instant nextAttemptAt = clock.instant().plus(backoffDelay(retryCount));
        queue.put(new RetryTask(target, connectionId, payload, retryCount, nextAttemptAt, error));
        recorder.recordRetryCount(target, retryCount);
        log.debug("[Retry] {} scheduled retry #{} at {}", target.key(), retryCount, nextAttemptAt);
        return DeliveryStatus.PENDING;
    }

    /**
     * Processes every due task once.
     */
    void tick() {
        if (!executing.compareAndSet(false, true)) {
            return;
        }
        try {
            for (RetryTask task : queue.due(clock.instant())) {
                try {
                    process(task);
                } catch (RuntimeException e) {
                    log.error("[Retry] Failed to process {}", task.target().key(), e);
                    countAsFailedAttempt(task, e);
                }
            }
        } finally {
            executing.set(false);
        }
    }

    private void process(RetryTask task) {
        DeliveryTarget target = task.target();
        Optional<AgentConnection> connection = connectionRegistry.findById(task.connectionId())
                .filter(AgentConnection::isActive);
        if (connection.isEmpty()) {
            queue.remove(target);
            log.warn("[Retry] Connection {} for {} is gone, last error: {}", task.connectionId(), target.key(),
                    task.lastError());
            recorder.recordFailed(target, CONNECTION_NOT_FOUND);
            return;
        }

        DeliveryAttempt attempt = dispatcher.dispatch(connection.get(), task.payload());
        if (attempt.success()) {
            queue.remove(target);
            log.info("[Retry] {} delivered after {} retries", target.key(), task.retryCount());
            recorder.recordDelivered(target, task.connectionId());
            return;
        }
        onAttemptFailed(target, task.connectionId(), task.payload(), task.retryCount(), attempt.error());
    }

    private void countAsFailedAttempt(RetryTask task, RuntimeException failure) {
        String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        try {
            onAttemptFailed(task.target(), task.connectionId(), task.payload(), task.retryCount(), error);
        } catch (RuntimeException e) {
            log.error("[Retry] Could not record failed attempt for {}", task.target().key(), e);
        }
    }

    public int outstanding() {
        return queue.size();
    }

    /**
     * Delay before the retry that follows the n-th failure.
     */
    public static Duration backoffDelay(int retryCount) {
        int exponent = Math.max(0, Math.min(retryCount - 1, 30));
        return Duration.ofSeconds(1L << exponent);
    }
}
