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
package de.makibytes.mintcheck.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Sortable columns of the mint table and the raw field each one compares.
 */
public enum SortColumn {
    NAME("name", SortDirection.ASC, Comparator.comparing(EndpointRecord::getSortName)),
    URL("url", SortDirection.ASC, Comparator.comparing(record -> record.getUrl().toLowerCase(Locale.ROOT))),
    STATUS("up", SortDirection.DESC, Comparator.comparing(EndpointRecord::isUp)),
    UPTIME("uptime", SortDirection.DESC, Comparator.comparingDouble(EndpointRecord::getUptime)),
    CAPACITY("capacity", SortDirection.DESC, Comparator.comparingLong(EndpointRecord::getCapacity)),
    CHANNELS("channels", SortDirection.DESC, Comparator.comparingInt(EndpointRecord::getChannels)),
    CURRENCIES("currencies", SortDirection.DESC, Comparator.comparingInt(EndpointRecord::getCurrencies)),
    LATENCY("latency", SortDirection.ASC, Comparator.comparingLong(EndpointRecord::getLatencyMs)),
    MINTS("mints", SortDirection.DESC, Comparator.comparingInt(EndpointRecord::getMints)),
    MELTS("melts", SortDirection.DESC, Comparator.comparingInt(EndpointRecord::getMelts)),
    ERRORS("errors", SortDirection.ASC, Comparator.comparingInt(EndpointRecord::getErrors));

    private final String key;
    private final SortDirection defaultDirection;
    private final Comparator<EndpointRecord> comparator;

    SortColumn(String key, SortDirection defaultDirection, Comparator<EndpointRecord> comparator) {
        this.key = key;
        this.defaultDirection = defaultDirection;
        this.comparator = comparator;
    }

    public String getKey() {
        return key;
    }

    /**
     * Direction used when the column is activated from another sort.
     */
    public SortDirection getDefaultDirection() {
        return defaultDirection;
    }

    /**
     * Ascending comparison of the column's raw value.
     */
    public Comparator<EndpointRecord> comparator() {
        return comparator;
    }

    public static Optional<SortColumn> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.toLowerCase(Locale.ROOT).trim();
        for (SortColumn column : values()) {
            if (column.key.equals(normalized)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
