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
package de.makibytes.mintcheck.web;

import java.util.List;
import java.util.Set;

import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.ranking.RankedEndpoint;

public record EndpointRow(int position,
                          String url,
                          String name,
                          String displayName,
                          boolean up,
                          double uptime,
                          long capacity,
                          int channels,
                          int currencies,
                          List<String> units,
                          Long latencyMs,
                          String latencyClass,
                          boolean pending,
                          int mints,
                          int melts,
                          int errors,
                          double score) {

    public static EndpointRow from(RankedEndpoint ranked) {
        EndpointRecord record = ranked.record();
        Set<String> units = record.getUnits();
        return new EndpointRow(
                ranked.position(),
                record.getUrl(),
                record.getName(),
                record.getDisplayName(),
                record.isUp(),
                record.getUptime(),
                record.getCapacity(),
                record.getChannels(),
                record.getCurrencies(),
                List.copyOf(units),
                record.isLatencyKnown() ? record.getLatencyMs() : null,
                ranked.latencyClass().getKey(),
                record.isPending(),
                record.getMints(),
                record.getMelts(),
                record.getErrors(),
                ranked.score());
    }
}
