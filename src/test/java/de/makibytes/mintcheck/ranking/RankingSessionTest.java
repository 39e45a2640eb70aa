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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.mintcheck.model.SortColumn;
import de.makibytes.mintcheck.model.SortDirection;
import de.makibytes.mintcheck.model.SortMode;
import de.makibytes.mintcheck.model.SortState;
import de.makibytes.mintcheck.model.Weights;

@DisplayName("RankingSession Tests")
class RankingSessionTest {

    private RankingSession session;

    @BeforeEach
    void setUp() {
        session = new RankingSession(Weights.DEFAULTS);
    }

    @Test
    @DisplayName("weight change updates the weight and forces weighted mode")
    void weightChangeForcesWeighted() {
        session.apply(new RankingEvent.ColumnActivated("latency"));
        assertEquals(SortMode.COLUMN, session.settings().sortState().mode());

        assertTrue(session.apply(new RankingEvent.WeightChanged("capacity", 1200)));

        assertEquals(1200, session.settings().weights().capacity());
        assertEquals(SortMode.WEIGHTED, session.settings().sortState().mode());
    }

    @Test
    @DisplayName("status toggle forces weighted mode")
    void statusToggle() {
        session.apply(new RankingEvent.ColumnActivated("mints"));
        assertTrue(session.apply(new RankingEvent.StatusToggled(false)));

        assertFalse(session.settings().weights().status());
        assertTrue(session.settings().sortState().isWeighted());
    }

    @Test
    @DisplayName("header clicks follow the toggle policy")
    void headerClicks() {
        session.apply(new RankingEvent.ColumnActivated("errors"));
        assertEquals(new SortState(SortMode.COLUMN, SortColumn.ERRORS, SortDirection.ASC), session.settings().sortState());

        session.apply(new RankingEvent.ColumnActivated("errors"));
        assertEquals(SortDirection.DESC, session.settings().sortState().direction());
    }

    @Test
    @DisplayName("unknown column is refused and the prior state kept")
    void unknownColumnRefused() {
        session.apply(new RankingEvent.ColumnActivated("capacity"));
        RankingSession.Settings before = session.settings();

        assertFalse(session.apply(new RankingEvent.ColumnActivated("ln_name")));
        assertFalse(session.apply(new RankingEvent.ColumnActivated(null)));
        assertSame(before, session.settings());
    }

    @Test
    @DisplayName("unknown criterion and non-finite values are refused")
    void invalidWeightRefused() {
        RankingSession.Settings before = session.settings();

        assertFalse(session.apply(new RankingEvent.WeightChanged("uptime", 5)));
        assertFalse(session.apply(new RankingEvent.WeightChanged("latency", Double.NaN)));
        assertSame(before, session.settings());
    }

    @Test
    @DisplayName("weights are not clamped")
    void weightsNotClamped() {
        assertTrue(session.apply(new RankingEvent.WeightChanged("errors", 100_000)));
        assertEquals(100_000, session.settings().weights().errors());
    }

    @Test
    @DisplayName("reset restores default weights and weighted descending")
    void reset() {
        session.apply(new RankingEvent.WeightChanged("channels", 1));
        session.apply(new RankingEvent.StatusToggled(false));
        session.apply(new RankingEvent.ColumnActivated("url"));

        assertTrue(session.apply(new RankingEvent.Reset()));

        assertEquals(Weights.DEFAULTS, session.settings().weights());
        assertEquals(SortState.INITIAL, session.settings().sortState());
    }
}
