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

import java.util.Arrays;

/// Two-sample Kolmogorov-Smirnov test.
///
/// D is the largest vertical gap between the two empirical CDFs, evaluated
/// after every run of tied values so that ties never create a spurious step.
/// The p-value uses the asymptotic Kolmogorov distribution with the
/// small-sample correction `√n_e + 0.12 + 0.11/√n_e`.
///
/// The match score is `1 - D`.
public final class KolmogorovSmirnovComparison implements StatisticalComparison {

    public static final String NAME = "ks_test";

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
        double d = statistic(synthetic, real);
        double pValue = Distributions.kolmogorovSmirnovPValue(d, synthetic.length, real.length);
        return Measurement.builder()
            .stat("ks_statistic", d)
            .stat("p_value", pValue)
            .score(1.0 - d)
            .build();
    }

    /// Computes the two-sample D statistic.
    ///
    /// @param first first sample, not modified
    /// @param second second sample, not modified
    /// @return sup |F1 - F2| over the pooled observations
    public static double statistic(double[] first, double[] second) {
        double[] a = first.clone();
        double[] b = second.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        int n1 = a.length;
        int n2 = b.length;
        int i = 0;
        int j = 0;
        double d = 0.0;
        while (i < n1 && j < n2) {
            double x = Math.min(a[i], b[j]);
            while (i < n1 && a[i] <= x) {
                i++;
            }
            while (j < n2 && b[j] <= x) {
                j++;
            }
            d = Math.max(d, Math.abs((double) i / n1 - (double) j / n2));
        }
        return d;
    }
}
