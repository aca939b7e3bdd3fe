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

/// Kullback-Leibler divergence of the synthetic distribution from the real one.
///
/// ```text
///   P = s / Σs   (synthetic),   Q = r / Σr   (real)
///   KL(P‖Q) = Σ P_i · ln(P_i / Q_i)       with P_i, Q_i clipped to ≥ ε
///   match score = 1 / (1 + KL)
/// ```
///
/// The direction is always synthetic relative to real: the information lost
/// when the real distribution is used to approximate the synthetic one.
/// KL is asymmetric, so swapping the sides generally changes the score.
/// Categories missing from the shorter vector are padded with ε.
public final class KullbackLeiblerComparison implements StatisticalComparison {

    public static final String NAME = "kullback_leibler";

    private final double epsilon;

    /// @param epsilon floor applied to every probability before taking logs
    public KullbackLeiblerComparison(double epsilon) {
        if (!(epsilon > 0)) {
            throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
        }
        this.epsilon = epsilon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean symmetric() {
        return false;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        int length = Math.max(synthetic.length, real.length);
        double[] p = Probabilities.normalize(synthetic, length, epsilon, "synthetic");
        double[] q = Probabilities.normalize(real, length, epsilon, "real");

        double divergence = 0;
        for (int i = 0; i < length; i++) {
            double pi = Math.max(p[i], epsilon);
            double qi = Math.max(q[i], epsilon);
            divergence += pi * Math.log(pi / qi);
        }
        divergence = Math.max(0.0, divergence);

        return Measurement.builder()
            .stat("divergence", divergence)
            .score(1.0 / (1.0 + divergence))
            .build();
    }
}
