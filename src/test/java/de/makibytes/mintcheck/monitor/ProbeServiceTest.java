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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.mintcheck.config.MintCheckProperties;
import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.store.EndpointRecordStore;

@DisplayName("ProbeService Tests")
class ProbeServiceTest {

    private static final String A = "https://a.example";
    private static final String B = "https://b.example";
    private static final String C = "https://c.example";

    private EndpointRecordStore store;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        store = new EndpointRecordStore(new MintCheckProperties(), null);
        clock = new MutableClock();
    }

    private void load(String... urls) {
        store.replaceAll(List.of(urls).stream()
                .map(url -> EndpointRecord.builder(url).up(true).currencies(1).build())
                .toList());
    }

    @Test
    @DisplayName("measureAll writes latency and units into the store")
    void measureAllUpdatesStore() {
        load(A, B);
        StubProbe<Long> latency = new StubProbe<>(url -> CompletableFuture.completedFuture(A.equals(url) ? 120L : null));
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> A.equals(url)
                ? CompletableFuture.completedFuture(Set.of("sat", "usd"))
                : CompletableFuture.failedFuture(new IllegalStateException("boom")));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);

        Integer count = service.measureAll(false).join();

        assertEquals(2, count);
        assertEquals(120L, store.get(A).getLatencyMs());
        assertEquals(2, store.get(A).getCurrencies());
        assertEquals(EndpointRecord.UNKNOWN_LATENCY_MS, store.get(B).getLatencyMs());
        assertEquals(1, store.get(B).getCurrencies(), "failed keyset probe keeps dataset currencies");
        assertTrue(store.get(B).getUnits().isEmpty());
    }

    @Test
    @DisplayName("a throwing probe does not abort the other mints")
    void failureIsIsolated() {
        load(A, B);
        StubProbe<Long> latency = new StubProbe<>(url -> {
            if (A.equals(url)) {
                throw new IllegalStateException("exploded");
            }
            return CompletableFuture.completedFuture(45L);
        });
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of("sat")));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);

        assertEquals(2, service.measureAll(false).join());
        assertFalse(store.get(A).isLatencyKnown());
        assertEquals(45L, store.get(B).getLatencyMs());
        assertEquals(Set.of("sat"), store.get(A).getUnits());
    }

    @Test
    @DisplayName("mints with unknown latency are pending until the probe settles")
    void pendingUntilSettled() {
        load(A);
        StubProbe<Long> latency = new StubProbe<>();
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of()));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);

        CompletableFuture<Integer> cycle = service.measureAll(false);
        assertTrue(store.get(A).isPending());
        assertFalse(cycle.isDone());

        latency.complete(A, 300L);
        cycle.join();

        assertFalse(store.get(A).isPending());
        assertEquals(300L, store.get(A).getLatencyMs());
    }

    @Test
    @DisplayName("second cycle within the TTL is served from cache")
    void cachedWithinTtl() {
        load(A);
        StubProbe<Long> latency = new StubProbe<>(url -> CompletableFuture.completedFuture(80L));
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of("sat")));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);

        service.measureAll(false).join();
        clock.advance(Duration.ofSeconds(5));
        service.measureAll(false).join();

        assertEquals(1, latency.callCount());
        assertEquals(1, keysets.callCount());
    }

    @Test
    @DisplayName("staggered cycle kicks mints off one delay apart, in dataset order")
    void staggeredKickoff() {
        load(A, B, C);
        Map<String, Long> startedAt = new ConcurrentHashMap<>();
        StubProbe<Long> latency = new StubProbe<>(url -> {
            startedAt.put(url, System.nanoTime());
            return CompletableFuture.completedFuture(10L);
        });
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of()));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 60, clock);

        long begin = System.nanoTime();
        CompletableFuture<Integer> cycle = service.measureAll(true);
        assertEquals(0, latency.callCount(), "first kick-off waits one delay as well");
        cycle.join();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertEquals(List.of(A, B, C), latency.calls());
        assertTrue(startedAt.get(A) < startedAt.get(B));
        assertTrue(startedAt.get(B) < startedAt.get(C));
        assertTrue(elapsedMs >= 180, "elapsed " + elapsedMs);
    }

    @Test
    @DisplayName("clearing visible scope keeps cache entries of mints no longer shown")
    void clearVisibleScope() {
        load(A, B);
        StubProbe<Long> latency = new StubProbe<>(url -> CompletableFuture.completedFuture(50L));
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of("sat")));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);
        service.measureAll(false).join();

        load(A);
        service.clearCaches(MintCheckProperties.ClearScope.VISIBLE);

        assertNull(service.getLatencyCache().fresh(A));
        assertNull(service.getCapabilityCache().fresh(A));
        assertNotNull(service.getLatencyCache().fresh(B));

        service.clearCaches(MintCheckProperties.ClearScope.ALL);
        assertEquals(0, service.getLatencyCache().size());
        assertEquals(0, service.getCapabilityCache().size());
    }

    @Test
    @DisplayName("results for mints removed mid-flight are dropped")
    void resultsAfterRefreshDropped() {
        load(A);
        StubProbe<Long> latency = new StubProbe<>();
        StubProbe<Set<String>> keysets = new StubProbe<>(url -> CompletableFuture.completedFuture(Set.of()));
        ProbeService service = new ProbeService(store, latency, keysets, Duration.ofSeconds(10), 0, clock);

        CompletableFuture<Integer> cycle = service.measureAll(false);
        load(B);
        latency.complete(A, 70L);
        cycle.join();

        assertNull(store.get(A));
        assertFalse(store.get(B).isLatencyKnown());
        assertEquals(70L, service.getLatencyCache().fresh(A));
    }
}
