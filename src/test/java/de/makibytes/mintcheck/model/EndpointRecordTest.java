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

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EndpointRecord Tests")
class EndpointRecordTest {

    @Test
    @DisplayName("absent attributes default to zero and unknown latency")
    void absentAttributesDefault() {
        EndpointRecord record = EndpointRecord.fromAttributes(Map.of("url", "https://mint.example"));

        assertEquals("https://mint.example", record.getUrl());
        assertNull(record.getName());
        assertFalse(record.isUp());
        assertEquals(0, record.getCapacity());
        assertEquals(0, record.getChannels());
        assertEquals(0, record.getCurrencies());
        assertEquals(0, record.getMints());
        assertEquals(0, record.getMelts());
        assertEquals(0, record.getErrors());
        assertEquals(EndpointRecord.UNKNOWN_LATENCY_MS, record.getLatencyMs());
        assertFalse(record.isLatencyKnown());
    }

    @Test
    @DisplayName("unparsable numbers fall back to defaults")
    void unparsableNumbersFallBack() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("url", "https://mint.example");
        attributes.put("capacity", "lots");
        attributes.put("channels", "");
        attributes.put("latency", "n/a");
        attributes.put("uptime", Double.NaN);
        attributes.put("errors", null);

        EndpointRecord record = EndpointRecord.fromAttributes(attributes);

        assertEquals(0, record.getCapacity());
        assertEquals(0, record.getChannels());
        assertEquals(EndpointRecord.UNKNOWN_LATENCY_MS, record.getLatencyMs());
        assertEquals(0.0, record.getUptime());
        assertEquals(0, record.getErrors());
    }

    @Test
    @DisplayName("string and numeric attributes are parsed")
    void parsesAttributes() {
        Map<String, Object> attributes = Map.of(
                "url", "https://mint.example",
                "name", "Example Mint",
                "up", "1",
                "capacity", "250000",
                "channels", 12,
                "currencies", "2",
                "latency", "180",
                "mints", 40,
                "melts", "35",
                "errors", "3");

        EndpointRecord record = EndpointRecord.fromAttributes(attributes);

        assertTrue(record.isUp());
        assertEquals(250000, record.getCapacity());
        assertEquals(12, record.getChannels());
        assertEquals(2, record.getCurrencies());
        assertEquals(180, record.getLatencyMs());
        assertEquals(40, record.getMints());
        assertEquals(35, record.getMelts());
        assertEquals(3, record.getErrors());
    }

    @Test
    @DisplayName("display name falls back to url")
    void displayNameFallsBackToUrl() {
        EndpointRecord unnamed = EndpointRecord.builder("https://Mint.Example").name("  ").build();
        EndpointRecord named = EndpointRecord.builder("https://mint.example").name("Zeta Mint").build();

        assertEquals("https://Mint.Example", unnamed.getDisplayName());
        assertEquals("https://mint.example", unnamed.getSortName());
        assertEquals("zeta mint", named.getSortName());
    }

    @Test
    @DisplayName("missing url is rejected")
    void missingUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> EndpointRecord.fromAttributes(Map.of("name", "x")));
    }

    @Test
    @DisplayName("null attributes are rejected as invalid input")
    void nullAttributesRejected() {
        assertThrows(IllegalArgumentException.class, () -> EndpointRecord.fromAttributes(null));
    }

    @Test
    @DisplayName("counts beyond int range are clamped, not wrapped")
    void oversizedCountsClamped() {
        EndpointRecord record = EndpointRecord.fromAttributes(Map.of(
                "url", "https://mint.example",
                "channels", "4294967301",
                "mints", 4_294_967_301L,
                "melts", "-4294967301",
                "errors", "99999999999999999999"));

        assertEquals(Integer.MAX_VALUE, record.getChannels());
        assertEquals(Integer.MAX_VALUE, record.getMints());
        assertEquals(0, record.getMelts());
        assertEquals(0, record.getErrors());
    }

    @Test
    @DisplayName("latency at or beyond the sentinel counts as unknown")
    void latencyBeyondSentinelUnknown() {
        EndpointRecord fromDataset = EndpointRecord.fromAttributes(Map.of("url", "https://mint.example", "latency", "150000"));
        assertFalse(fromDataset.isLatencyKnown());
        assertEquals(EndpointRecord.UNKNOWN_LATENCY_MS, fromDataset.getLatencyMs());

        EndpointRecord measured = EndpointRecord.builder("https://mint.example").latencyMs(300).build();
        measured.applyLatency(250_000L);
        assertFalse(measured.isLatencyKnown());
        assertEquals(EndpointRecord.UNKNOWN_LATENCY_MS, measured.getLatencyMs());

        assertTrue(EndpointRecord.builder("https://mint.example").latencyMs(99_998).build().isLatencyKnown());
    }

    @Test
    @DisplayName("probe results update latency, units and currency count")
    void probeResultsApplied() {
        EndpointRecord record = EndpointRecord.builder("https://mint.example").currencies(5).build();
        record.markPending();

        record.applyLatency(120L);
        record.applyUnits(new LinkedHashSet<>(List.of("sat", "usd")));

        assertEquals(120, record.getLatencyMs());
        assertFalse(record.isPending());
        assertEquals(2, record.getCurrencies());
        assertEquals(List.of("sat", "usd"), List.copyOf(record.getUnits()));

        record.applyLatency(null);
        assertFalse(record.isLatencyKnown());
    }

    @Test
    @DisplayName("snapshot is detached from later probe results")
    void snapshotIsDetached() {
        EndpointRecord record = EndpointRecord.builder("https://mint.example").latencyMs(200).build();
        EndpointRecord snapshot = record.snapshot();

        record.applyLatency(900L);

        assertEquals(200, snapshot.getLatencyMs());
        assertEquals(900, record.getLatencyMs());
    }
}
