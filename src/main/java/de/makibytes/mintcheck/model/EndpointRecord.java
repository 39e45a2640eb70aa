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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Attribute snapshot of a single mint, keyed by its URL.
 * <p>
 * Dataset attributes are fixed for the lifetime of the record; a dataset refresh
 * replaces the record as a whole. Latency, currency count and the unit set are
 * written in place by the probe layer.
 */
public class EndpointRecord {

    public static final long UNKNOWN_LATENCY_MS = 99999;

    private final String url;
    private final String name;
    private final boolean up;
    private final double uptime;
    private final long capacity;
    private final int channels;
    private final int mints;
    private final int melts;
    private final int errors;

    private volatile int currencies;
    private volatile long latencyMs;
    private volatile Set<String> units = Set.of();
    private volatile boolean pending;

    private EndpointRecord(Builder builder) {
        this.url = builder.url;
        this.name = builder.name == null || builder.name.isBlank() ? null : builder.name;
        this.up = builder.up;
        this.uptime = builder.uptime;
        this.capacity = Math.max(0, builder.capacity);
        this.channels = Math.max(0, builder.channels);
        this.currencies = Math.max(0, builder.currencies);
        this.latencyMs = normalizeLatency(builder.latencyMs);
        this.mints = Math.max(0, builder.mints);
        this.melts = Math.max(0, builder.melts);
        this.errors = Math.max(0, builder.errors);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    /**
     * Builds a record from loosely typed dataset attributes. Absent or unparsable
     * numbers fall back to 0, latency to {@link #UNKNOWN_LATENCY_MS}.
     */
    public static EndpointRecord fromAttributes(Map<String, ?> attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("Endpoint attributes must not be null");
        }
        String url = text(attributes.get("url"));
        if (url == null) {
            throw new IllegalArgumentException("Endpoint attributes without url");
        }
        return builder(url)
                .name(text(attributes.get("name")))
                .up(flag(attributes.get("up")))
                .uptime(decimal(attributes.get("uptime"), 0))
                .capacity(integer(attributes.get("capacity"), 0))
                .channels(count(attributes.get("channels")))
                .currencies(count(attributes.get("currencies")))
                .latencyMs(integer(attributes.get("latency"), UNKNOWN_LATENCY_MS))
                .mints(count(attributes.get("mints")))
                .melts(count(attributes.get("melts")))
                .errors(count(attributes.get("errors")))
                .build();
    }

    public String getUrl() {
        return url;
    }

    public String getName() {
        return name;
    }

    /**
     * Name shown to users, falling back to the URL when the mint has no name.
     */
    public String getDisplayName() {
        return name != null ? name : url;
    }

    public String getSortName() {
        return getDisplayName().toLowerCase(Locale.ROOT);
    }

    public boolean isUp() {
        return up;
    }

    public double getUptime() {
        return uptime;
    }

    public long getCapacity() {
        return capacity;
    }

    public int getChannels() {
        return channels;
    }

    public int getCurrencies() {
        return currencies;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isLatencyKnown() {
        return latencyMs < UNKNOWN_LATENCY_MS;
    }

    public int getMints() {
        return mints;
    }

    public int getMelts() {
        return melts;
    }

    public int getErrors() {
        return errors;
    }

    public Set<String> getUnits() {
        return units;
    }

    public boolean isPending() {
        return pending;
    }

    public void markPending() {
        this.pending = true;
    }

    public void applyLatency(Long measuredMs) {
        this.latencyMs = measuredMs == null ? UNKNOWN_LATENCY_MS : normalizeLatency(measuredMs);
        this.pending = false;
    }

    public void applyUnits(Set<String> activeUnits) {
        Set<String> copy = Collections.unmodifiableSet(new LinkedHashSet<>(activeUnits));
        this.units = copy;
        this.currencies = copy.size();
    }

    /**
     * Detached copy with the probe fields as they are right now. Sorting works on copies
     * so probe results landing mid-sort cannot break the comparator.
     */
    public EndpointRecord snapshot() {
        EndpointRecord copy = builder(url)
                .name(name)
                .up(up)
                .uptime(uptime)
                .capacity(capacity)
                .channels(channels)
                .currencies(currencies)
                .latencyMs(latencyMs)
                .mints(mints)
                .melts(melts)
                .errors(errors)
                .build();
        copy.units = units;
        copy.pending = pending;
        return copy;
    }

    // anything at or beyond the sentinel means "no measurement"
    private static long normalizeLatency(long latencyMs) {
        return latencyMs < 0 || latencyMs >= UNKNOWN_LATENCY_MS ? UNKNOWN_LATENCY_MS : latencyMs;
    }

    private static int count(Object value) {
        long parsed = integer(value, 0);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, parsed));
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String raw = text(value);
        if (raw == null) {
            return false;
        }
        return "true".equalsIgnoreCase(raw) || integer(raw, 0) > 0;
    }

    private static long integer(Object value, long fallback) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? number.longValue() : fallback;
        }
        String raw = text(value);
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double decimal(Object value, double fallback) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else {
            String raw = text(value);
            if (raw == null) {
                return fallback;
            }
            try {
                parsed = Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
        return Double.isFinite(parsed) ? parsed : fallback;
    }

    public static final class Builder {
        private final String url;
        private String name;
        private boolean up;
        private double uptime;
        private long capacity;
        private int channels;
        private int currencies;
        private long latencyMs = UNKNOWN_LATENCY_MS;
        private int mints;
        private int melts;
        private int errors;

        private Builder(String url) {
            this.url = url;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder up(boolean up) {
            this.up = up;
            return this;
        }

        public Builder uptime(double uptime) {
            this.uptime = uptime;
            return this;
        }

        public Builder capacity(long capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder channels(int channels) {
            this.channels = channels;
            return this;
        }

        public Builder currencies(int currencies) {
            this.currencies = currencies;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder mints(int mints) {
            this.mints = mints;
            return this;
        }

        public Builder melts(int melts) {
            this.melts = melts;
            return this;
        }

        public Builder errors(int errors) {
            this.errors = errors;
            return this;
        }

        public EndpointRecord build() {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Endpoint url must not be blank");
            }
            return new EndpointRecord(this);
        }
    }
}
