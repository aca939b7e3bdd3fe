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

import java.util.Arrays;

/// Two-sample Anderson-Darling test (Scholz and Stephens, 1987), midrank form.
///
/// The midrank statistic `A²akN` accounts for ties by placing each tied run at
/// its average position. It is standardized against its null mean (k - 1) and
/// variance σ²_N to give
///
/// ```text
///   T = (A²akN - (k - 1)) / σ_N
/// ```
///
/// The p-value is interpolated from the published critical values by a
/// quadratic fit of ln(α) and is capped to [0.001, 0.25], the range the table
/// covers. The match score is a monotone transform of T:
/// `1 - clamp(T / scale, 0, 1)`, so T ≤ 0 (samples at least as close as
/// expected under the null) scores 1.
public final class AndersonDarlingComparison implements StatisticalComparison {

    public static final String NAME = "anderson_darling";

    private static final int SAMPLES = 2;
    private static final double[] SIGNIFICANCE = {0.25, 0.1, 0.05, 0.025, 0.01, 0.005, 0.001};
    private static final double[] B0 = {0.675, 1.281, 1.645, 1.96, 2.326, 2.573, 3.085};
    private static final double[] B1 = {-0.245, 0.25, 0.678, 1.149, 1.822, 2.364, 3.615};
    private static final double[] B2 = {-0.105, -0.305, -0.362, -0.396, -0.432, -0.452, -0.48};

    private static final double[] CRITICAL = new double[SIGNIFICANCE.length];
    private static final double[] LOG_FIT;

    static {
        double m = SAMPLES - 1;
        for (int i = 0; i < CRITICAL.length; i++) {
            CRITICAL[i] = B0[i] + B1[i] / Math.sqrt(m) + B2[i] / m;
        }
        double[] logSig = new double[SIGNIFICANCE.length];
        for (int i = 0; i < logSig.length; i++) {
            logSig[i] = Math.log(SIGNIFICANCE[i]);
        }
        LOG_FIT = quadraticFit(CRITICAL, logSig);
    }

    private final double scale;

    /// @param scale statistic value at which the match score reaches 0
    public AndersonDarlingComparison(double scale) {
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
        double t = standardizedStatistic(synthetic, real);
        double pValue = pValue(t);
        double score = 1.0 - Math.max(0.0, Math.min(1.0, t / scale));
        return Measurement.builder()
            .stat("statistic", t)
            .stat("p_value", pValue)
            .score(score)
            .build();
    }

    /// Computes the standardized statistic T.
    ///
    /// @throws ComputationException if every pooled observation is identical
    static double standardizedStatistic(double[] synthetic, double[] real) throws ComputationException {
        double[][] samples = {synthetic.clone(), real.clone()};
        int n = synthetic.length + real.length;
        double[] pooled = new double[n];
        System.arraycopy(synthetic, 0, pooled, 0, synthetic.length);
        System.arraycopy(real, 0, pooled, synthetic.length, real.length);
        Arrays.sort(pooled);
        double[] distinct = Arrays.stream(pooled).distinct().toArray();
        if (distinct.length < 2) {
            throw new ComputationException("all observations are identical");
        }

        double a2 = 0.0;
        for (double[] sample : samples) {
            Arrays.sort(sample);
            double inner = 0.0;
            for (double z : distinct) {
                int left = lowerBound(pooled, z);
                double lj = upperBound(pooled, z) - left;
                double bj = left + lj / 2.0;
                int sRight = upperBound(sample, z);
                double fij = sRight - lowerBound(sample, z);
                double mij = sRight - fij / 2.0;
                double diff = n * mij - bj * sample.length;
                inner += lj / n * diff * diff / (bj * (n - bj) - n * lj / 4.0);
            }
            a2 += inner / sample.length;
        }
        a2 *= (n - 1.0) / n;

        double hCap = 1.0 / synthetic.length + 1.0 / real.length;
        double cumulative = 0.0;
        double g = 0.0;
        for (int i = n - 1, j = 2; i >= 2; i--, j++) {
            cumulative += 1.0 / i;
            g += cumulative / j;
        }
        double h = cumulative + 1.0;
        int k = SAMPLES;
        double a = (4 * g - 6) * (k - 1) + (10 - 6 * g) * hCap;
        double b = (2 * g - 4) * k * k + 8 * h * k + (2 * g - 14 * h - 4) * hCap - 8 * h + 4 * g - 6;
        double c = (6 * h + 2 * g - 2) * k * k + (4 * h - 4 * g + 6) * k + (2 * h - 6) * hCap + 4 * h;
        double d = (2 * h + 6) * k * k - 4 * h * k;
        double sigmaSq = (a * n * n * n + b * n * n + c * n + d) / ((n - 1.0) * (n - 2.0) * (n - 3.0));
        if (!(sigmaSq > 0)) {
            throw new ComputationException("null variance of the statistic is not positive");
        }
        return (a2 - (k - 1)) / Math.sqrt(sigmaSq);
    }

    /// Interpolates the p-value for a standardized statistic.
    static double pValue(double t) {
        if (t < CRITICAL[0]) {
            return SIGNIFICANCE[0];
        }
        if (t > CRITICAL[CRITICAL.length - 1]) {
            return SIGNIFICANCE[SIGNIFICANCE.length - 1];
        }
        return Math.exp(LOG_FIT[0] * t * t + LOG_FIT[1] * t + LOG_FIT[2]);
    }

    /// Least-squares fit of y = c0·x² + c1·x + c2.
    private static double[] quadraticFit(double[] x, double[] y) {
        double[][] m = new double[3][4];
        for (int i = 0; i < x.length; i++) {
            double[] row = {x[i] * x[i], x[i], 1.0};
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 3; c++) {
                    m[r][c] += row[r] * row[c];
                }
                m[r][3] += row[r] * y[i];
            }
        }
        for (int p = 0; p < 3; p++) {
            int pivot = p;
            for (int r = p + 1; r < 3; r++) {
                if (Math.abs(m[r][p]) > Math.abs(m[pivot][p])) {
                    pivot = r;
                }
            }
            double[] tmp = m[p];
            m[p] = m[pivot];
            m[pivot] = tmp;
            for (int r = 0; r < 3; r++) {
                if (r != p) {
                    double f = m[r][p] / m[p][p];
                    for (int c = p; c < 4; c++) {
                        m[r][c] -= f * m[p][c];
                    }
                }
            }
        }
        return new double[] {m[0][3] / m[0][0], m[1][3] / m[1][1], m[2][3] / m[2][2]};
    }

    private static int lowerBound(double[] sorted, double key) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static int upperBound(double[] sorted, double key) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
