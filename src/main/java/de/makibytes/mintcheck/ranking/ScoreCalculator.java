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

import org.springframework.stereotype.Component;

import de.makibytes.mintcheck.model.EndpointRecord;
import de.makibytes.mintcheck.model.Weights;

/**
 * Composite desirability score of a mint under a set of weights. Higher ranks first.
 * <p>
 * Score composition:
 * - Status: fixed bias for mints that are up, large enough to dominate every other term
 * - Activity: mints and melts, discounted by the share of failed operations
 * - Capacity: logarithmic
 * - Channels and currencies: linear
 * - Latency: linear penalty, a fixed penalty when latency is unknown
 */
@Component
public class ScoreCalculator {

    static final double STATUS_BIAS = 1_000_000_000d;
    static final double UNKNOWN_LATENCY_PENALTY = 1000d;

    public double computeScore(EndpointRecord record, Weights weights) {
        double score = 0;

        if (weights.status() && record.isUp()) {
            score += STATUS_BIAS;
        }

        score += activityScore(record, weights);

        if (record.getCapacity() > 0) {
            score += Math.log10(record.getCapacity()) * weights.capacity();
        }

        score += record.getChannels() * weights.channels();

        if (record.isLatencyKnown()) {
            score -= record.getLatencyMs() * weights.latency();
        } else {
            score -= UNKNOWN_LATENCY_PENALTY * weights.latency();
        }

        score += record.getCurrencies() * weights.currency();
        return score;
    }

    /**
     * Errors only discount activity. A mint without activity is never penalized for errors.
     */
    double activityScore(EndpointRecord record, Weights weights) {
        double activity = record.getMints() * weights.mints() + record.getMelts() * weights.melts();
        if (activity <= 0) {
            return 0;
        }
        long totalOps = (long) record.getMints() + record.getMelts() + record.getErrors();
        double errorRate = totalOps > 0 ? (double) record.getErrors() / totalOps : 0;
        double penalty = errorRate * weights.errors() / 100.0;
        double modulation = Math.max(0, 1 - penalty);
        return activity * modulation;
    }
}
