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
package de.makibytes.mintcheck.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.config.MintCheckProperties;
import de.makibytes.mintcheck.model.EndpointRecord;

/**
 * Current endpoint records of the managed dataset, in dataset order.
 * <p>
 * The record set is swapped as a whole on refresh. Probe results are applied to the
 * record instances of whatever set is current when they arrive; results for URLs that
 * are no longer present are dropped.
 */
@Component
public class EndpointRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(EndpointRecordStore.class);

    private final AtomicReference<Map<String, EndpointRecord>> records = new AtomicReference<>(Map.of());
    private final ApplicationEventPublisher eventPublisher;
    private final String datasetId;

    public EndpointRecordStore(MintCheckProperties properties, ApplicationEventPublisher eventPublisher) {
        this.datasetId = properties.getDatasetId();
        this.eventPublisher = eventPublisher;
    }

    public String getDatasetId() {
        return datasetId;
    }

    /**
     * Replaces the record set and announces the refresh. Later duplicates of a URL win.
     */
    public void replaceAll(Collection<EndpointRecord> replacement) {
        Map<String, EndpointRecord> next = new LinkedHashMap<>();
        for (EndpointRecord record : replacement) {
            next.put(record.getUrl(), record);
        }
        records.set(Collections.unmodifiableMap(next));
        logger.info("Dataset '{}' replaced with {} endpoints", datasetId, next.size());
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new DatasetRefreshedEvent(datasetId, next.size()));
        }
    }

    public List<EndpointRecord> snapshot() {
        return List.copyOf(records.get().values());
    }

    public Set<String> urls() {
        return records.get().keySet();
    }

    public EndpointRecord get(String url) {
        return records.get().get(url);
    }

    public int size() {
        return records.get().size();
    }

    public boolean updateLatency(String url, Long latencyMs) {
        EndpointRecord record = get(url);
        if (record == null) {
            return false;
        }
        record.applyLatency(latencyMs);
        return true;
    }

    /**
     * Applies a keyset probe result. A {@code null} result keeps the dataset's currency count.
     */
    public boolean updateUnits(String url, Set<String> units) {
        EndpointRecord record = get(url);
        if (record == null || units == null) {
            return false;
        }
        record.applyUnits(units);
        return true;
    }
}
