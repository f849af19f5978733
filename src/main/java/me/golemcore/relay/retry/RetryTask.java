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

import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.WebhookPayload;

import java.time.Instant;

/**
 * An outstanding redelivery. {@code retryCount} is the number of failed
 * attempts so far; the task becomes due at {@code nextAttemptAt}.
 */
public record RetryTask(
        DeliveryTarget target,
        String connectionId,
        WebhookPayload payload,
        int retryCount,
        Instant nextAttemptAt,
        String lastError) {

    public boolean isDue(Instant now) {
        return !nextAttemptAt.isAfter(now);
    }
}
