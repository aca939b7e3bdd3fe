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

import io.synthval.stats.math.Distributions;
import io.synthval.stats.math.Ranks;

/// Two-sided Mann-Whitney U test using the normal approximation.
///
/// ```text
///   U1 = R1 - n1(n1 + 1)/2                 (R1: rank sum of the synthetic side)
///   U  = max(U1, n1·n2 - U1)
///   σ  = √(n1·n2/12 · ((N + 1) - Σ(t³ - t)/(N(N - 1))))
///   z  = (U - n1·n2/2 - 0.5) / σ
///   p  = min(1, 2·P(Z > z))
/// ```
///
/// Ties receive average ranks and enter σ through the tie correction term. When
/// every pooled value is tied σ is zero and the samples are indistinguishable,
/// so p is 1. The reported `statistic` is U1, the synthetic side's U.
public final class MannWhitneyComparison implements StatisticalComparison {

    public static final String NAME = "mann_whitney";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        int n1 = synthetic.length;
        int n2 = real.length;
        if (n1 == 0 || n2 == 0) {
            throw new ComputationException("both samples must be non-empty");
        }
        double[] pooled = Ranks.concat(synthetic, real);
        double[] ranks = Ranks.averageRanks(pooled);
        double rankSum = 0;
        for (int i = 0; i < n1; i++) {
            rankSum += ranks[i];
        }
        double u1 = rankSum - (double) n1 * (n1 + 1) / 2.0;
        double product = (double) n1 * n2;
        double u = Math.max(u1, product - u1);

        double n = n1 + n2;
        double ties = Ranks.tieCorrectionSum(pooled);
        double variance = product / 12.0 * ((n + 1) - ties / (n * (n - 1)));
        double pValue;
        if (variance <= 0) {
            pValue = 1.0;
        } else {
            double z = (u - product / 2.0 - 0.5) / Math.sqrt(variance);
            pValue = Math.min(1.0, 2.0 * Distributions.normalSurvival(z));
        }

        return Measurement.builder()
            .stat("statistic", u1)
            .stat("p_value", pValue)
            .score(pValue)
            .build();
    }
}
