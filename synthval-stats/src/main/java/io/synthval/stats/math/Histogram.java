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

/// Histograms of two samples on one shared grid.
///
/// Count-based comparisons (chi-square, Jensen-Shannon, Kullback-Leibler) need
/// aligned category vectors. Raw numeric samples are reduced to them here:
///
/// ```text
///   range  = [min(a ∪ b), max(a ∪ b)]
///   bins   = max(2, min(maxBins, distinct(a ∪ b)))
///   width  = range / bins, right edge folded into the last bin
/// ```
///
/// Bins that are empty in both samples carry no information and are dropped,
/// so the returned vectors never contain a zero column.
///
/// @param synthetic counts of the first sample per occupied bin
/// @param real counts of the second sample per occupied bin
public record Histogram(double[] synthetic, double[] real) {

    /// Bins both samples on their combined range.
    ///
    /// @param synthetic first sample
    /// @param real second sample
    /// @param maxBins upper bound on the number of bins
    /// @return aligned bin counts
    /// @throws IllegalArgumentException if both samples are empty or maxBins < 2
    public static Histogram shared(double[] synthetic, double[] real, int maxBins) {
        if (maxBins < 2) {
            throw new IllegalArgumentException("maxBins must be at least 2, got " + maxBins);
        }
        double[] all = Ranks.concat(synthetic, real);
        if (all.length == 0) {
            throw new IllegalArgumentException("cannot bin two empty samples");
        }
        Arrays.sort(all);
        double min = all[0];
        double max = all[all.length - 1];

        if (min == max) {
            return new Histogram(new double[]{synthetic.length}, new double[]{real.length});
        }

        int distinct = 1;
        for (int i = 1; i < all.length && distinct <= maxBins; i++) {
            if (all[i] != all[i - 1]) {
                distinct++;
            }
        }
        int bins = Math.max(2, Math.min(maxBins, distinct));
        double width = (max - min) / bins;

        double[] a = count(synthetic, min, width, bins);
        double[] b = count(real, min, width, bins);

        int occupied = 0;
        for (int i = 0; i < bins; i++) {
            if (a[i] > 0 || b[i] > 0) {
                occupied++;
            }
        }
        double[] keptA = new double[occupied];
        double[] keptB = new double[occupied];
        int k = 0;
        for (int i = 0; i < bins; i++) {
            if (a[i] > 0 || b[i] > 0) {
                keptA[k] = a[i];
                keptB[k] = b[i];
                k++;
            }
        }
        return new Histogram(keptA, keptB);
    }

    private static double[] count(double[] values, double min, double width, int bins) {
        double[] counts = new double[bins];
        for (double v : values) {
            int index = (int) ((v - min) / width);
            if (index >= bins) index = bins - 1;
            if (index < 0) index = 0;
            counts[index]++;
        }
        return counts;
    }

    /// Number of bins kept.
    public int size() {
        return synthetic.length;
    }
}
