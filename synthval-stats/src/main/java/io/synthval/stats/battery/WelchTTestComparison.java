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
import io.synthval.stats.math.SampleStatistics;

/// Welch's unequal-variance two-sample t-test.
///
/// ```text
///   t  = (m1 - m2) / √(v1/n1 + v2/n2)
///   df = (v1/n1 + v2/n2)² / ((v1/n1)²/(n1 - 1) + (v2/n2)²/(n2 - 1))
///   p  = 2·P(T_df > |t|)
/// ```
///
/// Variances are the unbiased sample variances. Two constant samples are
/// compared by their means alone: equal means give t = 0 and p = 1, different
/// means give p = 0. A constant sample against a varying one has no defined
/// statistic and is reported as an error.
public final class WelchTTestComparison implements StatisticalComparison {

    public static final String NAME = "t_test";

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
        SampleStatistics s = SampleStatistics.compute(synthetic);
        SampleStatistics r = SampleStatistics.compute(real);
        boolean synConstant = s.min() == s.max();
        boolean realConstant = r.min() == r.max();

        if (synConstant && realConstant) {
            if (s.min() == r.min()) {
                return Measurement.builder().stat("statistic", 0.0).stat("p_value", 1.0).score(1.0).build();
            }
            return Measurement.builder().stat("p_value", 0.0).score(0.0).build();
        }
        if (synConstant || realConstant) {
            throw new ComputationException("zero variance in the "
                + (synConstant ? "synthetic" : "real") + " sample only");
        }

        double a = s.sampleVariance() / s.count();
        double b = r.sampleVariance() / r.count();
        double t = (s.mean() - r.mean()) / Math.sqrt(a + b);
        double df = (a + b) * (a + b) / (a * a / (s.count() - 1) + b * b / (r.count() - 1));
        double pValue = Distributions.studentTTwoSided(t, df);

        return Measurement.builder()
            .stat("statistic", t)
            .stat("df", df)
            .stat("p_value", pValue)
            .score(pValue)
            .build();
    }
}
