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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TTL cache in front of one probe kind, with at most one probe in flight per URL.
 * <p>
 * Failed probes resolve to {@code null} and are not cached. Callers arriving while a probe
 * for the same URL is running receive that probe's future.
 */
public class ProbeCache<T> {

    private static final Logger logger = LoggerFactory.getLogger(ProbeCache.class);

    private final EndpointProbe<T> probe;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong issuedProbes = new AtomicLong();

    public ProbeCache(EndpointProbe<T> probe, Duration ttl, Clock clock) {
        this.probe = probe;
        this.ttl = ttl;
        this.clock = clock;
    }

    public CompletableFuture<T> probe(String url) {
        if (url == null || url.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        T cached = fresh(url);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        // registered before the request starts, so concurrent callers attach instead of probing
        CompletableFuture<T> promise = new CompletableFuture<>();
        CompletableFuture<T> running = inFlight.putIfAbsent(url, promise);
        if (running != null) {
            return running;
        }
        T completedMeanwhile = fresh(url);
        if (completedMeanwhile != null) {
            settle(url, promise, completedMeanwhile);
            return promise;
        }

        issuedProbes.incrementAndGet();
        CompletableFuture<T> execution;
        try {
            execution = probe.execute(url);
        } catch (RuntimeException ex) {
            execution = CompletableFuture.failedFuture(ex);
        }
        execution.handle((value, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                logger.debug("{} probe failed for {}: {}", probe.name(), url, describe(cause));
                return null;
            }
            return value;
        }).thenAccept(value -> {
            if (value != null) {
                entries.put(url, new CacheEntry<>(value, clock.instant()));
            }
            settle(url, promise, value);
        });
        return promise;
    }

    /**
     * Cached value younger than the TTL, otherwise {@code null}.
     */
    public T fresh(String url) {
        CacheEntry<T> entry = entries.get(url);
        if (entry == null) {
            return null;
        }
        Instant now = clock.instant();
        if (Duration.between(entry.timestamp(), now).compareTo(ttl) >= 0) {
            return null;
        }
        return entry.value();
    }

    public void clear() {
        entries.clear();
    }

    public void evict(Collection<String> urls) {
        urls.forEach(entries::remove);
    }

    public boolean isInFlight(String url) {
        return inFlight.containsKey(url);
    }

    public int size() {
        return entries.size();
    }

    public long getIssuedProbes() {
        return issuedProbes.get();
    }

    public String name() {
        return probe.name();
    }

    private void settle(String url, CompletableFuture<T> promise, T value) {
        inFlight.remove(url, promise);
        promise.complete(value);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private record CacheEntry<T>(T value, Instant timestamp) {
    }
}
