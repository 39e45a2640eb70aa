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
package de.makibytes.mintcheck.ranking;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.mintcheck.config.MintCheckProperties;
import de.makibytes.mintcheck.store.EndpointRecordStore;

/**
 * Holds the latest ordering of the managed dataset and recomputes it when the
 * ranking configuration changes or a batch of probe results has landed.
 */
@Service
public class RankingService {

    private static final Logger logger = LoggerFactory.getLogger(RankingService.class);

    private final RankingEngine engine;
    private final EndpointRecordStore store;
    private final RankingSession session;
    private final Clock clock;
    private final AtomicReference<RankingView> current = new AtomicReference<>();

    public RankingService(RankingEngine engine,
                          EndpointRecordStore store,
                          MintCheckProperties properties,
                          Clock clock) {
        this.engine = engine;
        this.store = store;
        this.session = new RankingSession(properties.getRanking().toWeights());
        this.clock = clock;
    }

    /**
     * Applies a configuration event and re-ranks when it was accepted.
     */
    public boolean apply(RankingEvent event) {
        boolean accepted = session.apply(event);
        if (accepted) {
            rerank();
        }
        return accepted;
    }

    public synchronized RankingView rerank() {
        RankingSession.Settings settings = session.settings();
        List<RankedEndpoint> ranked = engine.rank(store.snapshot(), settings.weights(), settings.sortState());
        RankingView view = new RankingView(ranked, settings.weights(), settings.sortState(), clock.instant());
        current.set(view);
        logger.debug("Ranked {} mints ({})", ranked.size(), settings.sortState().mode());
        return view;
    }

    public RankingView currentRanking() {
        RankingView view = current.get();
        return view != null ? view : rerank();
    }

    public RankingSession.Settings settings() {
        return session.settings();
    }
}
