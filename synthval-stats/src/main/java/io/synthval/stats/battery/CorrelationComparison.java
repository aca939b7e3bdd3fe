package io.synthval.stats.battery;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.synthval.stats.math.Ranks;

/// Pearson and Spearman correlation of two paired sequences.
///
/// Observations are paired by position, so both sequences must have the same
/// length and at least the configured number of pairs. Spearman's ρ is the
/// Pearson coefficient of the average ranks.
///
/// ```text
///   average = (r + ρ) / 2
///   match score = (average + 1) / 2
/// ```
public final class CorrelationComparison implements StatisticalComparison {

    public static final String NAME = "correlation";

    private final int minPairs;

    /// @param minPairs smallest number of pairs for which correlation is computed
    public CorrelationComparison(int minPairs) {
        if (minPairs < 2) {
            throw new IllegalArgumentException("minPairs must be at least 2, got " + minPairs);
        }
        this.minPairs = minPairs;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        if (synthetic.length != real.length) {
            throw new ComputationException(String.format(
                "paired sequences differ in length: %d synthetic vs %d real", synthetic.length, real.length));
        }
        if (synthetic.length < minPairs) {
            throw new ComputationException(String.format(
                "at least %d pairs are required, got %d", minPairs, synthetic.length));
        }
        double pearson = pearson(synthetic, real);
        double spearman = pearson(Ranks.averageRanks(synthetic), Ranks.averageRanks(real));
        double average = (pearson + spearman) / 2.0;
        return Measurement.builder()
            .stat("pearson_r", pearson)
            .stat("spearman_r", spearman)
            .stat("average_correlation", average)
            .score((average + 1.0) / 2.0)
            .build();
    }

    static double pearson(double[] x, double[] y) throws ComputationException {
        int n = x.length;
        double mx = 0;
        double my = 0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0 || syy == 0) {
            throw new ComputationException("correlation is undefined for a constant sequence");
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
