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

import java.util.Locale;
import java.util.Optional;

/**
 * Weighted ranking criteria. {@link #STATUS} is an on/off switch, all others carry a numeric weight.
 */
public enum Criterion {
    STATUS("status"),
    CURRENCY("currency"),
    CAPACITY("capacity"),
    CHANNELS("channels"),
    LATENCY("latency"),
    MINTS("mints"),
    MELTS("melts"),
    ERRORS("errors");

    private final String key;

    Criterion(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isNumeric() {
        return this != STATUS;
    }

    public static Optional<Criterion> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.toLowerCase(Locale.ROOT).trim();
        for (Criterion criterion : values()) {
            if (criterion.key.equals(normalized)) {
                return Optional.of(criterion);
            }
        }
        return Optional.empty();
    }
}
