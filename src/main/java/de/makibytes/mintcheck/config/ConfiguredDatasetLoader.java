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
package de.makibytes.mintcheck.config;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.store.EndpointRecordStore;

/**
 * Loads the mints listed under {@code mints.endpoints} into the store once the application is up.
 */
@Component
public class ConfiguredDatasetLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredDatasetLoader.class);

    private final MintCheckProperties properties;
    private final EndpointRecordStore store;

    public ConfiguredDatasetLoader(MintCheckProperties properties, EndpointRecordStore store) {
        this.properties = properties;
        this.store = store;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void load() {
        List<EndpointRecord> records = toRecords(properties.getEndpoints());
        if (records.isEmpty()) {
            logger.info("No mints configured, waiting for dataset '{}' to be pushed", store.getDatasetId());
            return;
        }
        store.replaceAll(records);
    }

    List<EndpointRecord> toRecords(List<MintCheckProperties.EndpointProperties> endpoints) {
        List<EndpointRecord> records = new ArrayList<>();
        for (MintCheckProperties.EndpointProperties endpoint : endpoints) {
            if (endpoint.getUrl() == null || endpoint.getUrl().isBlank()) {
                logger.warn("Skipping configured mint without url (name: {})", endpoint.getName());
                continue;
            }
            records.add(EndpointRecord.builder(endpoint.getUrl().trim())
                    .name(endpoint.getName())
                    .up(endpoint.isUp())
                    .uptime(endpoint.getUptime())
                    .capacity(endpoint.getCapacity())
                    .channels(endpoint.getChannels())
                    .currencies(endpoint.getCurrencies())
                    .mints(endpoint.getMints())
                    .melts(endpoint.getMelts())
                    .errors(endpoint.getErrors())
                    .build());
        }
        return records;
    }
}
