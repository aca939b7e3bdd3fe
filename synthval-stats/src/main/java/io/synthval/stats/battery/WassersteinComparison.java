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

/// First Wasserstein (earth mover's) distance between two empirical distributions.
///
/// The distance is the area between the two empirical CDFs, integrated over
/// the pooled sorted observations. It is normalized by the range of the pooled
/// observations; when that range is zero both samples sit on the same single
/// value and the distance is 0.
///
/// The match score is `1 - min(normalized distance, 1)`.
public final class WassersteinComparison implements StatisticalComparison {

    public static final String NAME = "wasserstein_distance";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        if (synthetic.length == 0 || real.length == 0) {
            throw new ComputationException("both samples must be non-empty");
        }
        double[] a = synthetic.clone();
        double[] b = real.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        double min = Math.min(a[0], b[0]);
        double max = Math.max(a[a.length - 1], b[b.length - 1]);
        double range = max - min;

        double distance = distance(a, b);
        double normalized = range > 0 ? distance / range : 0.0;
        return Measurement.builder()
            .stat("distance", distance)
            .stat("normalized_distance", normalized)
            .score(1.0 - Math.min(normalized, 1.0))
            .build();
    }

    /// Integrates |F_a - F_b| over sorted, non-empty samples.
    static double distance(double[] a, double[] b) {
        int i = 0;
        int j = 0;
        double area = 0.0;
        double previous = Math.min(a[0], b[0]);
        while (i < a.length || j < b.length) {
            double x;
            if (j >= b.length || (i < a.length && a[i] <= b[j])) {
                x = a[i];
            } else {
                x = b[j];
            }
            area += Math.abs((double) i / a.length - (double) j / b.length) * (x - previous);
            while (i < a.length && a[i] <= x) {
                i++;
            }
            while (j < b.length && b[j] <= x) {
                j++;
            }
            previous = x;
        }
        return area;
    }
}
