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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outstanding retry tasks, at most one per {@link DeliveryTarget}. A durable
 * implementation can replace the in-memory one without changing the
 * scheduler.
 */
public interface RetryQueue {

    void put(RetryTask task);

    void remove(DeliveryTarget target);

    Optional<RetryTask> get(DeliveryTarget target);

    /**
     * Tasks whose next attempt is at or before {@code now}, earliest first.
     */
    List<RetryTask> due(Instant now);

    int size();
}
