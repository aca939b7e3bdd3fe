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

import java.util.Arrays;

/// Two-sample Cramér-von Mises test (Anderson, 1962).
///
/// ```text
///   U = n·Σ(r_i - i)² + m·Σ(s_j - j)²     (r, s: pooled average ranks of each sorted sample)
///   T = U / (n·m·N) - (4·n·m - 1) / (6·N)
/// ```
///
/// The match score is `1 - clamp(T / scale, 0, 1)`.
public final class CramerVonMisesComparison implements StatisticalComparison {

    public static final String NAME = "cramer_von_mises";

    private final double scale;

    /// @param scale statistic value at which the match score reaches 0
    public CramerVonMisesComparison(double scale) {
        if (!(scale > 0)) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
        this.scale = scale;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        if (synthetic.length < 2 || real.length < 2) {
            throw new ComputationException(String.format(
                "at least 2 observations per sample are required, got %d synthetic and %d real",
                synthetic.length, real.length));
        }
        double t = statistic(synthetic, real);
        return Measurement.builder()
            .stat("statistic", t)
            .score(1.0 - Math.max(0.0, Math.min(1.0, t / scale)))
            .build();
    }

    static double statistic(double[] synthetic, double[] real) {
        double[] x = synthetic.clone();
        double[] y = real.clone();
        Arrays.sort(x);
        Arrays.sort(y);
        int nx = x.length;
        int ny = y.length;
        double[] ranks = Ranks.averageRanks(Ranks.concat(x, y));

        double sx = 0.0;
        for (int i = 0; i < nx; i++) {
            double diff = ranks[i] - (i + 1);
            sx += diff * diff;
        }
        double sy = 0.0;
        for (int j = 0; j < ny; j++) {
            double diff = ranks[nx + j] - (j + 1);
            sy += diff * diff;
        }
        double u = nx * sx + ny * sy;
        double k = (double) nx * ny;
        double n = nx + ny;
        return u / (k * n) - (4 * k - 1) / (6 * n);
    }
}
