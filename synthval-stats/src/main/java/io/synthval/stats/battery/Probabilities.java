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

/// Turns count vectors into probability vectors for the divergence tests.
final class Probabilities {

    private Probabilities() {
    }

    /// Normalizes a count vector to sum to 1, padding with `padValue` up to `length`.
    ///
    /// @throws ComputationException on negative counts or a zero sum
    static double[] normalize(double[] counts, int length, double padValue, String side)
        throws ComputationException {
        double sum = 0;
        for (double c : counts) {
            if (c < 0) {
                throw new ComputationException("negative count on the " + side + " side");
            }
            sum += c;
        }
        if (sum <= 0) {
            throw new ComputationException("cannot normalize: " + side + " counts sum to zero");
        }
        double[] p = Arrays.copyOf(counts, length);
        for (int i = 0; i < counts.length; i++) {
            p[i] = counts[i] / sum;
        }
        for (int i = counts.length; i < length; i++) {
            p[i] = padValue;
        }
        return p;
    }
}
