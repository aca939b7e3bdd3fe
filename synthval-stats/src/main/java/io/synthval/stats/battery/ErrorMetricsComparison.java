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

/// Mean absolute and root mean squared error between paired observations.
///
/// Observations are paired by position up to the shorter length. Errors are
/// normalized by the range of the paired values, or by the largest absolute
/// value when the range is zero.
///
/// The match score is `1 - min(normalized MAE, 1)`.
public final class ErrorMetricsComparison implements StatisticalComparison {

    public static final String NAME = "error_metrics";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        int pairs = Math.min(synthetic.length, real.length);
        if (pairs == 0) {
            throw new ComputationException("no paired observations");
        }
        double absSum = 0;
        double sqSum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double maxAbs = 0;
        for (int i = 0; i < pairs; i++) {
            double diff = synthetic[i] - real[i];
            absSum += Math.abs(diff);
            sqSum += diff * diff;
            for (double v : new double[] {synthetic[i], real[i]}) {
                min = Math.min(min, v);
                max = Math.max(max, v);
                maxAbs = Math.max(maxAbs, Math.abs(v));
            }
        }
        double mae = absSum / pairs;
        double rmse = Math.sqrt(sqSum / pairs);
        double denominator = max > min ? max - min : maxAbs;
        if (denominator == 0) {
            throw new ComputationException("all paired observations are zero; errors cannot be normalized");
        }
        double normalizedMae = mae / denominator;
        return Measurement.builder()
            .stat("mae", mae)
            .stat("rmse", rmse)
            .stat("normalized_mae", normalizedMae)
            .stat("normalized_rmse", rmse / denominator)
            .stat("pairs", pairs)
            .score(1.0 - Math.min(normalizedMae, 1.0))
            .build();
    }
}
