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
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local retry queue. Contents are lost on restart; the ledger keeps
 * the last persisted retry count.
 */
@Component
public class InMemoryRetryQueue implements RetryQueue {

    private final Map<String, RetryTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void put(RetryTask task) {
        tasks.put(task.target().key(), task);
    }

    @Override
    public void remove(DeliveryTarget target) {
        tasks.remove(target.key());
    }

    @Override
    public Optional<RetryTask> get(DeliveryTarget target) {
        return Optional.ofNullable(tasks.get(target.key()));
    }

    @Override
    public List<RetryTask> due(Instant now) {
        return tasks.values().stream()
                .filter(task -> task.isDue(now))
                .sorted(Comparator.comparing(RetryTask::nextAttemptAt))
                .toList();
    }

    @Override
    public int size() {
        return tasks.size();
    }
}
