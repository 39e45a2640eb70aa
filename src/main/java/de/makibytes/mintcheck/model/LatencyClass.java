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

public enum LatencyClass {
    NONE("none"),
    FAST("fast"),
    OK("ok"),
    SLOW("slow");

    private static final long FAST_MAX_MS = 300;
    private static final long OK_MAX_MS = 1000;

    private final String key;

    LatencyClass(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static LatencyClass of(EndpointRecord record) {
        return record.isLatencyKnown() ? of(record.getLatencyMs()) : NONE;
    }

    public static LatencyClass of(Long latencyMs) {
        if (latencyMs == null || latencyMs < 0 || latencyMs >= EndpointRecord.UNKNOWN_LATENCY_MS) {
            return NONE;
        }
        if (latencyMs <= FAST_MAX_MS) {
            return FAST;
        }
        if (latencyMs <= OK_MAX_MS) {
            return OK;
        }
        return SLOW;
    }
}
