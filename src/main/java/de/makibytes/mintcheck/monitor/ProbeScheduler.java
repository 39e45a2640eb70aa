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
package de.makibytes.mintcheck.monitor;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.config.MintCheckProperties;
import de.makibytes.mintcheck.ranking.RankingService;
import de.makibytes.mintcheck.store.DatasetRefreshedEvent;

/**
 * Drives probe cycles: immediately after a dataset refresh and on a fixed interval.
 * The ranking is recomputed once per completed cycle.
 */
@Component
public class ProbeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ProbeScheduler.class);

    private final ProbeService probeService;
    private final RankingService rankingService;
    private final MintCheckProperties properties;

    public ProbeScheduler(ProbeService probeService, RankingService rankingService, MintCheckProperties properties) {
        this.probeService = probeService;
        this.rankingService = rankingService;
        this.properties = properties;
    }

    @EventListener
    public void onDatasetRefreshed(DatasetRefreshedEvent event) {
        if (!properties.getDatasetId().equals(event.datasetId())) {
            logger.debug("Ignoring refresh of dataset '{}'", event.datasetId());
            return;
        }
        rankingService.rerank();
        refreshNow();
    }

    @Scheduled(fixedRateString = "${mints.probe.refresh-interval-ms:15000}",
            initialDelayString = "${mints.probe.refresh-interval-ms:15000}")
    public void periodicRefresh() {
        probeService.clearCaches(properties.getProbe().getClearScope());
        runCycle(true);
    }

    public CompletableFuture<Integer> refreshNow() {
        return runCycle(false);
    }

    private CompletableFuture<Integer> runCycle(boolean staggered) {
        return probeService.measureAll(staggered)
                .whenComplete((count, error) -> {
                    if (error != null) {
                        logger.warn("Probe cycle failed: {}", error.getMessage());
                    } else {
                        logger.debug("Probe cycle finished for {} mints", count);
                    }
                    rankingService.rerank();
                });
    }
}
