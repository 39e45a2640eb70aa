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

public record Weights(boolean status,
                      double currency,
                      double capacity,
                      double channels,
                      double latency,
                      double mints,
                      double melts,
                      double errors) {

    public static final Weights DEFAULTS = new Weights(true, 50, 5000, 20, 5, 50, 50, 200);

    public Weights withStatus(boolean enabled) {
        return new Weights(enabled, currency, capacity, channels, latency, mints, melts, errors);
    }

    /**
     * Returns a copy with one numeric criterion replaced. Values are taken as given, callers bound them.
     */
    public Weights with(Criterion criterion, double value) {
        return switch (criterion) {
            case STATUS -> withStatus(value != 0);
            case CURRENCY -> new Weights(status, value, capacity, channels, latency, mints, melts, errors);
            case CAPACITY -> new Weights(status, currency, value, channels, latency, mints, melts, errors);
            case CHANNELS -> new Weights(status, currency, capacity, value, latency, mints, melts, errors);
            case LATENCY -> new Weights(status, currency, capacity, channels, value, mints, melts, errors);
            case MINTS -> new Weights(status, currency, capacity, channels, latency, value, melts, errors);
            case MELTS -> new Weights(status, currency, capacity, channels, latency, mints, value, errors);
            case ERRORS -> new Weights(status, currency, capacity, channels, latency, mints, melts, value);
        };
    }

    public double get(Criterion criterion) {
        return switch (criterion) {
            case STATUS -> status ? 1 : 0;
            case CURRENCY -> currency;
            case CAPACITY -> capacity;
            case CHANNELS -> channels;
            case LATENCY -> latency;
            case MINTS -> mints;
            case MELTS -> melts;
            case ERRORS -> errors;
        };
    }
}
