package me.golemcore.relay.adapter.outbound.webhook;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.WebhookPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Webhook transport over OkHttp.
 *
 * <p>
 * Uses a client derived from the shared one with the callback timeout applied
 * to the whole call. Redirects are not followed, so a validated URL cannot
 * bounce the relay to an internal address. The response body is discarded.
 */
@Component
@Slf4j
public class OkHttpWebhookAdapter implements WebhookPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String USER_AGENT = "golemcore-relay/1.0";

    private final OkHttpClient httpClient;

    public OkHttpWebhookAdapter(OkHttpClient baseHttpClient, RelayProperties properties) {
        long timeoutMs = properties.getDelivery().getTimeoutMs();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(false)
                .followSslRedirects(false)
                .build();
    }

    @Override
    public int post(String url, Map<String, String> headers, String body) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .post(RequestBody.create(body, JSON));
        headers.forEach(builder::header);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            log.trace("[Webhook] POST {} -> {}", url, response.code());
            return response.code();
        }
    }
}
