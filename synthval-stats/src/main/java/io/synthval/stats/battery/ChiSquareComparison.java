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

/// Chi-square test of homogeneity on a 2×K table of category counts.
///
/// ```text
///   row totals  S = Σ s_i,  R = Σ r_i,  N = S + R
///   expected    e_si = S·(s_i + r_i)/N,  e_ri = R·(s_i + r_i)/N
///   χ²          Σ (o - e)² / e  over both rows
///   dof         K - 1
///   p           P(X² ≥ χ² | dof)
/// ```
///
/// With a single degree of freedom the Yates continuity correction is applied
/// to every cell, shrinking |o - e| by at most 0.5.
///
/// The match score is the p-value: a high p-value means the two count vectors
/// are consistent with one underlying distribution.
public final class ChiSquareComparison implements StatisticalComparison {

    public static final String NAME = "chi_square";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        if (synthetic.length != real.length) {
            throw new ComputationException(String.format(
                "category count mismatch: %d synthetic vs %d real", synthetic.length, real.length));
        }
        int k = synthetic.length;
        if (k < 2) {
            throw new ComputationException("at least 2 categories are required, got " + k);
        }

        double synTotal = 0;
        double realTotal = 0;
        for (int i = 0; i < k; i++) {
            if (synthetic[i] < 0 || real[i] < 0) {
                throw new ComputationException("negative count in category " + (i + 1));
            }
            synTotal += synthetic[i];
            realTotal += real[i];
        }
        if (synTotal <= 0 || realTotal <= 0) {
            throw new ComputationException("expected counts are zero: one side has no responses");
        }

        double total = synTotal + realTotal;
        int dof = k - 1;
        boolean yates = dof == 1;
        double chi2 = 0;
        for (int i = 0; i < k; i++) {
            double column = synthetic[i] + real[i];
            if (column <= 0) {
                throw new ComputationException("expected count is zero for category " + (i + 1));
            }
            chi2 += cell(synthetic[i], synTotal * column / total, yates);
            chi2 += cell(real[i], realTotal * column / total, yates);
        }

        double pValue = Distributions.chiSquareSurvival(chi2, dof);
        return Measurement.builder()
            .stat("chi2", chi2)
            .stat("p_value", pValue)
            .stat("dof", dof)
            .score(pValue)
            .build();
    }

    private static double cell(double observed, double expected, boolean yates) {
        double diff = Math.abs(observed - expected);
        if (yates) {
            diff = Math.max(0.0, diff - Math.min(0.5, diff));
        }
        return diff * diff / expected;
    }
}
