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

/// Jensen-Shannon divergence between two count vectors.
///
/// ```text
///   P = s / Σs,  Q = r / Σr,  M = (P + Q) / 2
///   JS = ½·KL(P‖M) + ½·KL(Q‖M)      (log base 2, so 0 ≤ JS ≤ 1)
///   match score = 1 - JS
/// ```
///
/// Vectors of different length are padded with zero-probability categories.
/// The divergence is symmetric in its arguments.
public final class JensenShannonComparison implements StatisticalComparison {

    public static final String NAME = "jensen_shannon";

    private static final double LN2 = Math.log(2.0);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        int length = Math.max(synthetic.length, real.length);
        double[] p = Probabilities.normalize(synthetic, length, 0.0, "synthetic");
        double[] q = Probabilities.normalize(real, length, 0.0, "real");

        double divergence = 0;
        for (int i = 0; i < length; i++) {
            double m = (p[i] + q[i]) / 2.0;
            if (p[i] > 0) {
                divergence += 0.5 * p[i] * Math.log(p[i] / m);
            }
            if (q[i] > 0) {
                divergence += 0.5 * q[i] * Math.log(q[i] / m);
            }
        }
        divergence = Math.max(0.0, Math.min(1.0, divergence / LN2));

        return Measurement.builder()
            .stat("divergence", divergence)
            .stat("distance", Math.sqrt(divergence))
            .score(1.0 - divergence)
            .build();
    }
}
