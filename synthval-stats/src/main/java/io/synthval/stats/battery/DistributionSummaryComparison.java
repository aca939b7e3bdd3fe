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

import io.synthval.stats.math.SampleStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Compares the mean, median and standard deviation of the two sides.
///
/// For each statistic the relative difference is
/// `|a - b| / max(|a|, |b|)`, defined as 0 when both are 0 and capped at 1.
/// The match score is one minus the average relative difference.
///
/// An empty side contributes zeros for every statistic, so this comparison
/// always produces a value. Two empty sides are a perfect match.
public final class DistributionSummaryComparison implements StatisticalComparison {

    public static final String NAME = "distribution_summary";

    /// Compared statistics, in report order.
    public static final List<String> STATISTICS = List.of("mean", "median", "std");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) {
        return compare(summarize(synthetic), summarize(real));
    }

    /// Compares precomputed summaries keyed by the names in {@link #STATISTICS}.
    ///
    /// A statistic present on only one side is compared against 0; a statistic
    /// absent from both sides is skipped. With nothing to compare the score is 1.
    ///
    /// @param synthetic synthetic summary values
    /// @param real real summary values
    /// @return statistics and score
    public static Measurement compare(Map<String, Double> synthetic, Map<String, Double> real) {
        Measurement.Builder builder = Measurement.builder();
        double total = 0.0;
        int compared = 0;
        for (String stat : STATISTICS) {
            if (!synthetic.containsKey(stat) && !real.containsKey(stat)) {
                continue;
            }
            double a = synthetic.getOrDefault(stat, 0.0);
            double b = real.getOrDefault(stat, 0.0);
            builder.stat("synthetic_" + stat, a)
                .stat("real_" + stat, b)
                .stat(stat + "_difference", Math.abs(a - b));
            total += relativeDifference(a, b);
            compared++;
        }
        double average = compared == 0 ? 0.0 : total / compared;
        return builder
            .stat("average_relative_difference", average)
            .score(1.0 - average)
            .build();
    }

    static double relativeDifference(double a, double b) {
        double scale = Math.max(Math.abs(a), Math.abs(b));
        if (scale == 0.0) {
            return 0.0;
        }
        return Math.min(1.0, Math.abs(a - b) / scale);
    }

    private static Map<String, Double> summarize(double[] values) {
        Map<String, Double> summary = new LinkedHashMap<>();
        if (values.length == 0) {
            for (String stat : STATISTICS) {
                summary.put(stat, 0.0);
            }
            return summary;
        }
        SampleStatistics stats = SampleStatistics.compute(values);
        summary.put("mean", stats.mean());
        summary.put("median", stats.median());
        summary.put("std", stats.populationStdDev());
        return summary;
    }
}
