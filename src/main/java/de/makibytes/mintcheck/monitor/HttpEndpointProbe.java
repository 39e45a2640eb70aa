/*
 * Copyright (c) 2026 MakiBytes.
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
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.mintcheck.monitor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * GET probe against a fixed sub-path of the mint's base URL.
 * <p>
 * Elapsed time is taken when the response headers arrive. The whole exchange, body
 * included, is bounded by the request timeout. On timeout the underlying exchange
 * is cancelled.
 */
public abstract class HttpEndpointProbe<T> implements EndpointProbe<T> {

    private final HttpClient httpClient;
    private final String path;
    private final Duration timeout;

    protected HttpEndpointProbe(HttpClient httpClient, String path, Duration timeout) {
        this.httpClient = httpClient;
        this.path = path.startsWith("/") ? path : "/" + path;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<T> execute(String baseUrl) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(resolve(baseUrl)))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("Cache-Control", "no-store")
                    .GET()
                    .build();
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        long startNanos = System.nanoTime();
        AtomicLong headersNanos = new AtomicLong();
        // invoked once the final response's headers are in, before the body is read
        HttpResponse.BodyHandler<String> bodyHandler = info -> {
            headersNanos.set(System.nanoTime());
            return HttpResponse.BodyHandlers.ofString().apply(info);
        };
        CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(request, bodyHandler);
        CompletableFuture<TimedResponse> timed = exchange
                .thenApply(response -> new TimedResponse(response, (headersNanos.get() - startNanos) / 1_000_000))
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        timed.whenComplete((response, error) -> {
            if (error != null && !exchange.isDone()) {
                exchange.cancel(true);
            }
        });
        return timed.thenApply(result -> interpret(result.response(), result.elapsedMs()));
    }

    /**
     * Maps a received response to the probe result, {@code null} for anything unusable.
     */
    protected abstract T interpret(HttpResponse<String> response, long elapsedMs);

    protected static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    String resolve(String baseUrl) {
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + path;
    }

    private record TimedResponse(HttpResponse<String> response, long elapsedMs) {
    }
}
