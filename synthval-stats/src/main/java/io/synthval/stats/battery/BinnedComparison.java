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

import io.synthval.stats.math.Histogram;

/// Runs a count-based comparison over raw samples by first binning both
/// samples on one shared grid.
///
/// The reported statistics gain a `bins` entry with the number of non-empty
/// bins the delegate saw.
///
/// An optional pseudo-count is added to every kept bin on both sides before
/// the delegate runs. It is applied only when both samples are non-empty, so an
/// empty side still reaches the delegate as an all-zero vector.
public final class BinnedComparison implements StatisticalComparison {

    private final StatisticalComparison delegate;
    private final int maxBins;
    private final double pseudoCount;

    /// @param delegate count-based comparison to run on the histograms
    /// @param maxBins upper bound on the number of bins
    public BinnedComparison(StatisticalComparison delegate, int maxBins) {
        this(delegate, maxBins, 0.0);
    }

    /// @param delegate count-based comparison to run on the histograms
    /// @param maxBins upper bound on the number of bins
    /// @param pseudoCount count added to each bin of both histograms
    public BinnedComparison(StatisticalComparison delegate, int maxBins, double pseudoCount) {
        if (maxBins < 2) {
            throw new IllegalArgumentException("maxBins must be at least 2, got " + maxBins);
        }
        if (!(pseudoCount >= 0) || Double.isInfinite(pseudoCount)) {
            throw new IllegalArgumentException("pseudoCount must be finite and non-negative, got " + pseudoCount);
        }
        this.delegate = delegate;
        this.maxBins = maxBins;
        this.pseudoCount = pseudoCount;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public boolean symmetric() {
        return delegate.symmetric();
    }

    @Override
    public Measurement measure(double[] synthetic, double[] real) throws ComputationException {
        if (synthetic.length == 0 && real.length == 0) {
            throw new ComputationException("both samples are empty");
        }
        Histogram histogram = Histogram.shared(synthetic, real, maxBins);
        double[] a = histogram.synthetic();
        double[] b = histogram.real();
        if (pseudoCount > 0 && synthetic.length > 0 && real.length > 0) {
            for (int i = 0; i < a.length; i++) {
                a[i] += pseudoCount;
                b[i] += pseudoCount;
            }
        }
        Measurement measured = delegate.measure(a, b);
        return Measurement.builder()
            .stats(measured.statistics())
            .stat("bins", histogram.size())
            .score(measured.matchScore())
            .build();
    }
}
