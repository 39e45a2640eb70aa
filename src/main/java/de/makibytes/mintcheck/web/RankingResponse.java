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

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import de.makibytes.mintcheck.model.SortState;
import de.makibytes.mintcheck.model.Weights;
import de.makibytes.mintcheck.ranking.RankingView;

public record RankingResponse(String mode,
                              String column,
                              String direction,
                              Weights weights,
                              Instant generatedAt,
                              List<EndpointRow> mints) {

    public static RankingResponse from(RankingView view) {
        SortState sortState = view.sortState();
        return new RankingResponse(
                sortState.mode().name().toLowerCase(Locale.ROOT),
                sortState.column() == null ? null : sortState.column().getKey(),
                sortState.direction().name().toLowerCase(Locale.ROOT),
                view.weights(),
                view.generatedAt(),
                view.endpoints().stream().map(EndpointRow::from).toList());
    }
}
