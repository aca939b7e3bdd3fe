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

/// One independent test of the comparison battery.
///
/// A comparison receives the synthetic and real sides as plain vectors. What
/// the vectors mean depends on the comparison: count-based comparisons expect
/// aligned category counts, sample-based ones expect raw observations, and
/// paired ones expect equal-length sequences matched by position.
///
/// Implementations are stateless and thread-safe. They may reorder their own
/// copies of the input but must not rely on the caller's arrays afterwards.
public interface StatisticalComparison {

    /// @return the test identifier carried in results, e.g. `ks_test`
    String name();

    /// Runs the comparison.
    ///
    /// @param synthetic synthetic side
    /// @param real real side
    /// @return native statistics and an unclamped match score
    /// @throws ComputationException if the input is degenerate for this test
    Measurement measure(double[] synthetic, double[] real) throws ComputationException;

    /// @return true if swapping the two sides leaves the match score unchanged
    default boolean symmetric() {
        return true;
    }
}
