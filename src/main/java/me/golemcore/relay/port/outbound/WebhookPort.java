package me.golemcore.relay.port.outbound;

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

import java.io.IOException;
import java.util.Map;

/**
 * Outbound HTTP transport for agent callbacks.
 */
public interface WebhookPort {

    /**
     * POSTs {@code body} as JSON with the given headers, exactly once.
     *
     * @return the HTTP status code of the response
     * @throws IOException
     *             on timeout or any transport failure
     */
    int post(String url, Map<String, String> headers, String body) throws IOException;
}
