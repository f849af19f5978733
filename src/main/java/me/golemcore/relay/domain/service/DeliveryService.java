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

import me.golemcore.relay.domain.model.AgentConnection;
import me.golemcore.relay.domain.model.DeliveryAttempt;
import me.golemcore.relay.domain.model.DeliveryStatus;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.WebhookPayload;
import me.golemcore.relay.retry.RetryScheduler;
import org.springframework.stereotype.Service;

/**
 * First, synchronous delivery attempt of a send. A failed attempt is handed
 * to the {@link RetryScheduler}; the caller never waits for retries.
 */
@Service
public class DeliveryService {

    private final WebhookDispatcher dispatcher;
    private final DeliveryRecorder recorder;
    private final RetryScheduler retryScheduler;

    public DeliveryService(WebhookDispatcher dispatcher, DeliveryRecorder recorder, RetryScheduler retryScheduler) {
        this.dispatcher = dispatcher;
        this.recorder = recorder;
        this.retryScheduler = retryScheduler;
    }

    public DeliveryStatus deliver(DeliveryTarget target, AgentConnection connection, WebhookPayload payload) {
        DeliveryAttempt attempt = dispatcher.dispatch(connection, payload);
        if (attempt.success()) {
            recorder.recordDelivered(target, connection.getId());
            return DeliveryStatus.DELIVERED;
        }
        return retryScheduler.onAttemptFailed(target, connection.getId(), payload, 0, attempt.error());
    }
}
