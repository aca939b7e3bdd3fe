package io.synthval.stats.math;

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
import java.util.Objects;

/**
 * Descriptive statistics for one sample of survey responses.
 *
 * <p>Variance is reported both ways: the population form (divide by n), which is
 * what the distribution summary compares, and the unbiased sample form (divide
 * by n-1), which the Welch t-test needs.
 *
 * @param count number of observations
 * @param min smallest observation
 * @param max largest observation
 * @param mean arithmetic mean
 * @param median middle value, mean of the two middle values for even counts
 * @param populationVariance sum of squared deviations divided by n
 * @param sampleVariance sum of squared deviations divided by n-1, 0 for a single value
 */
public record SampleStatistics(
    int count,
    double min,
    double max,
    double mean,
    double median,
    double populationVariance,
    double sampleVariance
) {

    /**
     * Computes statistics over a non-empty sample.
     *
     * @param values the observations
     * @return computed statistics
     * @throws IllegalArgumentException if the sample is empty
     */
    public static SampleStatistics compute(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        int n = values.length;
        double min = values[0];
        double max = values[0];
        double sum = 0;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double mean = sum / n;

        double m2 = 0;
        for (double v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double median = (n % 2 == 1)
            ? sorted[n / 2]
            : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;

        return new SampleStatistics(n, min, max, mean, median, m2 / n, n > 1 ? m2 / (n - 1) : 0.0);
    }

    /**
     * Population standard deviation.
     */
    public double populationStdDev() {
        return Math.sqrt(populationVariance);
    }
}
