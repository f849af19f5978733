package me.golemcore.relay.domain.model;

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

import java.util.List;

/**
 * Optional hints for choosing among a recipient's connections. A label match
 * wins over a capability tag match; without a match the highest routing
 * priority wins.
 */
public record RoutingHints(List<String> labels, List<String> tags) {

    public static RoutingHints none() {
        return new RoutingHints(List.of(), List.of());
    }

    public List<String> labels() {
        return labels != null ? labels : List.of();
    }

    public List<String> tags() {
        return tags != null ? tags : List.of();
    }
}
