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
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.makibytes.mintcheck.config.MintCheckProperties;
import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.store.EndpointRecordStore;

/**
 * Keeps latency and keyset data of the current mints fresh.
 */
@Service
public class ProbeService {

    private static final Logger logger = LoggerFactory.getLogger(ProbeService.class);

    private final EndpointRecordStore store;
    private final ProbeCache<Long> latencyCache;
    private final ProbeCache<Set<String>> capabilityCache;
    private final long staggerDelayMs;

    @Autowired
    public ProbeService(EndpointRecordStore store,
                        LatencyProbe latencyProbe,
                        CapabilityProbe capabilityProbe,
                        MintCheckProperties properties,
                        Clock clock) {
        this(store, latencyProbe, capabilityProbe,
                Duration.ofMillis(properties.getProbe().getCacheTtlMs()),
                properties.getProbe().getStaggerDelayMs(),
                clock);
    }

    ProbeService(EndpointRecordStore store,
                 EndpointProbe<Long> latencyProbe,
                 EndpointProbe<Set<String>> capabilityProbe,
                 Duration cacheTtl,
                 long staggerDelayMs,
                 Clock clock) {
        this.store = store;
        this.latencyCache = new ProbeCache<>(latencyProbe, cacheTtl, clock);
        this.capabilityCache = new ProbeCache<>(capabilityProbe, cacheTtl, clock);
        this.staggerDelayMs = Math.max(0, staggerDelayMs);
    }

    public CompletableFuture<Long> measureLatency(String url) {
        return latencyCache.probe(url);
    }

    public CompletableFuture<Set<String>> fetchUnits(String url) {
        return capabilityCache.probe(url);
    }

    /**
     * Probes every mint of the current dataset, both kinds concurrently per mint.
     * With {@code staggered} each kick-off waits one stagger delay after the previous one.
     *
     * @return completes with the number of mints once every fired probe has settled
     */
    public CompletableFuture<Integer> measureAll(boolean staggered) {
        List<EndpointRecord> records = store.snapshot();
        List<CompletableFuture<Void>> measurements = new ArrayList<>(records.size());
        long kickoffDelayMs = 0;
        for (EndpointRecord record : records) {
            if (!record.isLatencyKnown()) {
                record.markPending();
            }
            if (staggered) {
                kickoffDelayMs += staggerDelayMs;
            }
            String url = record.getUrl();
            measurements.add(kickoff(kickoffDelayMs).thenCompose(ignored -> measureEndpoint(url)));
        }
        logger.debug("Probing {} mints ({})", records.size(), staggered ? "staggered" : "immediate");
        return CompletableFuture.allOf(measurements.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> records.size());
    }

    public void clearCaches() {
        latencyCache.clear();
        capabilityCache.clear();
    }

    public void clearCaches(MintCheckProperties.ClearScope scope) {
        if (scope == MintCheckProperties.ClearScope.VISIBLE) {
            Set<String> visible = store.urls();
            latencyCache.evict(visible);
            capabilityCache.evict(visible);
        } else {
            clearCaches();
        }
    }

    ProbeCache<Long> getLatencyCache() {
        return latencyCache;
    }

    ProbeCache<Set<String>> getCapabilityCache() {
        return capabilityCache;
    }

    private CompletableFuture<Void> measureEndpoint(String url) {
        CompletableFuture<Void> latency = latencyCache.probe(url)
                .thenAccept(latencyMs -> store.updateLatency(url, latencyMs));
        CompletableFuture<Void> units = capabilityCache.probe(url)
                .thenAccept(activeUnits -> store.updateUnits(url, activeUnits));
        return CompletableFuture.allOf(latency, units)
                .exceptionally(error -> {
                    logger.warn("Applying probe results for {} failed: {}", url, error.getMessage());
                    return null;
                });
    }

    private CompletableFuture<Void> kickoff(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS);
        return CompletableFuture.runAsync(() -> { }, delayed);
    }
}
