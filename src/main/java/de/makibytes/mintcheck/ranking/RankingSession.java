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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.mintcheck.model.Criterion;
import de.makibytes.mintcheck.model.SortColumn;
import de.makibytes.mintcheck.model.SortState;
import de.makibytes.mintcheck.model.Weights;

/**
 * Weights and sort state of one ranking session, changed only through {@link #apply(RankingEvent)}.
 * <p>
 * Events naming an unknown column or criterion are refused and leave the state untouched.
 */
public class RankingSession {

    private static final Logger logger = LoggerFactory.getLogger(RankingSession.class);

    private final Weights defaults;
    private volatile Settings settings;

    public RankingSession(Weights defaults) {
        this.defaults = defaults;
        this.settings = new Settings(defaults, SortState.INITIAL);
    }

    public Settings settings() {
        return settings;
    }

    public Weights getDefaults() {
        return defaults;
    }

    /**
     * @return whether the event was accepted
     */
    public synchronized boolean apply(RankingEvent event) {
        Settings current = settings;
        Settings next;
        if (event instanceof RankingEvent.StatusToggled toggled) {
            next = new Settings(current.weights().withStatus(toggled.enabled()), current.sortState().toWeighted());
        } else if (event instanceof RankingEvent.WeightChanged changed) {
            Optional<Criterion> criterion = Criterion.fromKey(changed.criterion());
            if (criterion.isEmpty() || !Double.isFinite(changed.value())) {
                logger.warn("Refusing weight change {}={}", changed.criterion(), changed.value());
                return false;
            }
            next = new Settings(current.weights().with(criterion.get(), changed.value()), current.sortState().toWeighted());
        } else if (event instanceof RankingEvent.ColumnActivated activated) {
            Optional<SortColumn> column = SortColumn.fromKey(activated.columnKey());
            if (column.isEmpty()) {
                logger.warn("Refusing sort by unknown column '{}'", activated.columnKey());
                return false;
            }
            next = new Settings(current.weights(), current.sortState().activate(column.get()));
        } else if (event instanceof RankingEvent.Reset) {
            next = new Settings(defaults, SortState.INITIAL);
        } else {
            logger.warn("Unsupported ranking event {}", event);
            return false;
        }
        settings = next;
        return true;
    }

    public record Settings(Weights weights, SortState sortState) {
    }
}
