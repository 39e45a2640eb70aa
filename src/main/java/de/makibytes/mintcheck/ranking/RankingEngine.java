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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.model.SortColumn;
import de.makibytes.mintcheck.model.SortState;
import de.makibytes.mintcheck.model.Weights;

/**
 * Orders mints either by weighted score or by a single column.
 * Ties are broken by lower-cased display name, then URL, so every ordering is total.
 */
@Component
public class RankingEngine {

    private final ScoreCalculator scoreCalculator;

    public RankingEngine(ScoreCalculator scoreCalculator) {
        this.scoreCalculator = scoreCalculator;
    }

    public List<RankedEndpoint> rank(Collection<EndpointRecord> records, Weights weights, SortState sortState) {
        List<Scored> scored = new ArrayList<>(records.size());
        for (EndpointRecord record : records) {
            EndpointRecord snapshot = record.snapshot();
            scored.add(new Scored(snapshot, scoreCalculator.computeScore(snapshot, weights)));
        }
        scored.sort(comparator(sortState));

        List<RankedEndpoint> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored entry = scored.get(i);
            ranked.add(new RankedEndpoint(i + 1, entry.record(), entry.score()));
        }
        return List.copyOf(ranked);
    }

    Comparator<Scored> comparator(SortState sortState) {
        Comparator<Scored> primary;
        if (sortState.isWeighted() || sortState.column() == null) {
            primary = Comparator.comparingDouble(Scored::score).reversed();
        } else {
            SortColumn column = sortState.column();
            primary = (a, b) -> sortState.direction().apply(column.comparator().compare(a.record(), b.record()));
        }
        return primary
                .thenComparing(entry -> entry.record().getSortName())
                .thenComparing(entry -> entry.record().getUrl());
    }

    record Scored(EndpointRecord record, double score) {
    }
}
