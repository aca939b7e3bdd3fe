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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Jensen-Shannon and Kullback-Leibler comparisons over count vectors.
 */
class DivergenceComparisonTest {

    private static final double[] SURVEY_SYNTHETIC = {42, 33, 18, 7};
    private static final double[] SURVEY_REAL = {40, 35, 20, 5};
    private static final double[] SKEWED = {80, 10, 5, 5};

    private final JensenShannonComparison js = new JensenShannonComparison();
    private final KullbackLeiblerComparison kl = new KullbackLeiblerComparison(1e-10);

    @Test
    void jensenShannonOfCloseDistributions() throws ComputationException {
        Measurement m = js.measure(SURVEY_SYNTHETIC, SURVEY_REAL);
        assertThat(m.statistics().get("divergence")).isCloseTo(0.0019758541671902725, within(1e-12));
        assertThat(m.matchScore()).isCloseTo(0.9980241458328097, within(1e-12));
    }

    @Test
    void jensenShannonIsBoundedAndSymmetric() throws ComputationException {
        assertThat(js.measure(new double[]{1, 0}, new double[]{0, 1}).statistics().get("divergence"))
            .isCloseTo(1.0, within(1e-12));
        assertThat(js.measure(SURVEY_SYNTHETIC, SURVEY_SYNTHETIC).matchScore()).isEqualTo(1.0);
        assertThat(js.measure(SKEWED, SURVEY_REAL).matchScore())
            .isCloseTo(js.measure(SURVEY_REAL, SKEWED).matchScore(), within(1e-12));
    }

    @Test
    void jensenShannonPadsShorterVectors() throws ComputationException {
        Measurement padded = js.measure(new double[]{5, 5}, new double[]{5, 5, 0});
        assertThat(padded.matchScore()).isEqualTo(1.0);
    }

    @Test
    void jensenShannonRejectsZeroTotals() {
        assertThatThrownBy(() -> js.measure(new double[]{0, 0}, new double[]{1, 1}))
            .isInstanceOf(ComputationException.class)
            .hasMessageContaining("synthetic");
    }

    @Test
    void kullbackLeiblerOfCloseDistributions() throws ComputationException {
        Measurement m = kl.measure(SURVEY_SYNTHETIC, SURVEY_REAL);
        assertThat(m.statistics().get("divergence")).isCloseTo(0.005662667688669527, within(1e-12));
        assertThat(m.matchScore()).isCloseTo(1.0 / (1.0 + 0.005662667688669527), within(1e-12));
    }

    @Test
    void kullbackLeiblerIsAsymmetric() throws ComputationException {
        double forward = kl.measure(SKEWED, SURVEY_REAL).statistics().get("divergence");
        double reverse = kl.measure(SURVEY_REAL, SKEWED).statistics().get("divergence");
        assertThat(forward).isCloseTo(0.3599267295424249, within(1e-12));
        assertThat(reverse).isCloseTo(0.4384670389733787, within(1e-12));
        assertThat(kl.symmetric()).isFalse();
    }

    @Test
    void kullbackLeiblerStaysFiniteWhenRealMissesACategory() throws ComputationException {
        Measurement m = kl.measure(new double[]{5, 5}, new double[]{10, 0});
        assertThat(m.statistics().get("divergence")).isFinite().isPositive();
        assertThat(m.matchScore()).isBetween(0.0, 1.0);
    }

    @Test
    void binnedKullbackLeiblerSmoothsBinsHeldByOneSide() throws ComputationException {
        double[] a = {1.2, 3.4, 2.2, 5.6, 4.1, 3.3, 2.8, 4.9};
        double[] b = {2.1, 3.9, 4.4, 6.2, 5.0, 3.7, 4.8, 5.5};

        Measurement raw = new BinnedComparison(kl, 10).measure(a, b);
        Measurement smoothed = new BinnedComparison(kl, 10, 0.5).measure(a, b);

        assertThat(raw.matchScore()).isCloseTo(0.0709647364758036, within(1e-9));
        assertThat(smoothed.matchScore()).isCloseTo(0.6919695158233664, within(1e-9));
        assertThat(smoothed.statistics().get("bins")).isEqualTo(10.0);
    }

    @Test
    void binnedSmoothingDoesNotHideAnEmptySide() {
        assertThatThrownBy(() -> new BinnedComparison(kl, 10, 0.5).measure(new double[0], new double[]{1, 2, 3}))
            .isInstanceOf(ComputationException.class);
    }

    @Test
    void kullbackLeiblerRejectsNonPositiveEpsilon() {
        assertThatThrownBy(() -> new KullbackLeiblerComparison(0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
