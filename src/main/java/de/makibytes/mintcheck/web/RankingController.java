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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.monitor.ProbeScheduler;
import de.makibytes.mintcheck.ranking.RankingEvent;
import de.makibytes.mintcheck.ranking.RankingService;
import de.makibytes.mintcheck.store.EndpointRecordStore;

@Controller
public class RankingController {

    private final RankingService rankingService;
    private final EndpointRecordStore store;
    private final ProbeScheduler probeScheduler;

    public RankingController(RankingService rankingService,
                             EndpointRecordStore store,
                             ProbeScheduler probeScheduler) {
        this.rankingService = rankingService;
        this.store = store;
        this.probeScheduler = probeScheduler;
    }

    @GetMapping("/api/mints")
    @ResponseBody
    public RankingResponse mints() {
        return RankingResponse.from(rankingService.currentRanking());
    }

    @PostMapping("/api/ranking/status")
    @ResponseBody
    public ResponseEntity<?> toggleStatus(@RequestParam("enabled") boolean enabled) {
        return respond(new RankingEvent.StatusToggled(enabled));
    }

    @PostMapping("/api/ranking/weights/{criterion}")
    @ResponseBody
    public ResponseEntity<?> changeWeight(@PathVariable("criterion") String criterion,
                                          @RequestParam("value") double value) {
        return respond(new RankingEvent.WeightChanged(criterion, value));
    }

    @PostMapping("/api/ranking/columns/{key}")
    @ResponseBody
    public ResponseEntity<?> activateColumn(@PathVariable("key") String key) {
        return respond(new RankingEvent.ColumnActivated(key));
    }

    @PostMapping("/api/ranking/reset")
    @ResponseBody
    public ResponseEntity<?> reset() {
        return respond(new RankingEvent.Reset());
    }

    @PutMapping("/api/datasets/{datasetId}")
    @ResponseBody
    public ResponseEntity<?> replaceDataset(@PathVariable("datasetId") String datasetId,
                                            @RequestBody List<Map<String, Object>> entries) {
        if (!store.getDatasetId().equals(datasetId)) {
            return ResponseEntity.notFound().build();
        }
        List<EndpointRecord> records = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            try {
                records.add(EndpointRecord.fromAttributes(entry));
            } catch (IllegalArgumentException ex) {
                return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
            }
        }
        store.replaceAll(records);
        return ResponseEntity.ok(RankingResponse.from(rankingService.currentRanking()));
    }

    @PostMapping("/api/probes/refresh")
    @ResponseBody
    public ResponseEntity<?> refreshProbes() {
        probeScheduler.refreshNow();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("mints", store.size()));
    }

    private ResponseEntity<?> respond(RankingEvent event) {
        if (!rankingService.apply(event)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Rejected " + describe(event)));
        }
        return ResponseEntity.ok(RankingResponse.from(rankingService.currentRanking()));
    }

    private static String describe(RankingEvent event) {
        if (event instanceof RankingEvent.ColumnActivated activated) {
            return "unknown column '" + activated.columnKey() + "'";
        }
        if (event instanceof RankingEvent.WeightChanged changed) {
            return "weight " + changed.criterion() + "=" + changed.value();
        }
        return event.toString();
    }
}
