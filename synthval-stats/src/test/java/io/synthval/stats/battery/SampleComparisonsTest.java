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

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Comparisons over raw numeric samples.
 *
 * <p>The two fixed samples below have no ties, so the Commons Math oracles
 * agree with the tie-aware implementations.
 */
class SampleComparisonsTest {

    private static final double[] A = {1.2, 3.4, 2.2, 5.6, 4.1, 3.3, 2.8, 4.9};
    private static final double[] B = {2.1, 3.9, 4.4, 6.2, 5.0, 3.7, 4.8, 5.5};

    private static double[] shifted(double[] values, double delta) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] + delta;
        }
        return out;
    }

    @Nested
    class KolmogorovSmirnov {
        private final KolmogorovSmirnovComparison ks = new KolmogorovSmirnovComparison();

        @Test
        void statisticMatchesCommonsMath() throws ComputationException {
            Measurement m = ks.measure(A, B);
            double expected = new KolmogorovSmirnovTest().kolmogorovSmirnovStatistic(A, B);
            assertThat(m.statistics().get("ks_statistic")).isCloseTo(expected, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(1.0 - expected, within(1e-12));
            assertThat(m.statistics().get("p_value")).isBetween(0.0, 1.0);
        }

        @Test
        void tiesDoNotCreateSpuriousSteps() {
            assertThat(KolmogorovSmirnovComparison.statistic(new double[]{1, 2, 2, 3}, new double[]{2, 2, 3, 3}))
                .isEqualTo(0.25);
            assertThat(KolmogorovSmirnovComparison.statistic(A, A)).isEqualTo(0.0);
        }

        @Test
        void isSymmetric() throws ComputationException {
            assertThat(ks.measure(A, B).matchScore()).isEqualTo(ks.measure(B, A).matchScore());
        }

        @Test
        void needsTwoPointsPerSample() {
            assertThatThrownBy(() -> ks.measure(new double[]{1.0}, B)).isInstanceOf(ComputationException.class);
            assertThatThrownBy(() -> ks.measure(A, new double[0])).isInstanceOf(ComputationException.class);
        }
    }

    @Nested
    class MannWhitney {
        private final MannWhitneyComparison mw = new MannWhitneyComparison();

        @Test
        void normalApproximationWithContinuityCorrection() throws ComputationException {
            Measurement m = mw.measure(new double[]{19, 22, 16, 29, 24}, new double[]{20, 11, 17, 12});
            assertThat(m.statistics().get("statistic")).isEqualTo(17.0);
            assertThat(m.statistics().get("p_value")).isCloseTo(0.11134688653314048, within(1e-9));
            assertThat(m.matchScore()).isEqualTo(m.statistics().get("p_value"));
        }

        @Test
        void fixedSamples() throws ComputationException {
            Measurement m = mw.measure(A, B);
            assertThat(m.statistics().get("statistic")).isEqualTo(19.0);
            assertThat(m.matchScore()).isCloseTo(0.18926296331502537, within(1e-9));
        }

        @Test
        void allTiedValuesAreIndistinguishable() throws ComputationException {
            assertThat(mw.measure(new double[]{3, 3, 3}, new double[]{3, 3}).matchScore()).isEqualTo(1.0);
        }

        @Test
        void rejectsAnEmptySample() {
            assertThatThrownBy(() -> mw.measure(new double[0], B)).isInstanceOf(ComputationException.class);
        }

        @Test
        void largeIdenticalSamplesStayIndistinguishable() throws ComputationException {
            int n = 46341;
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                values[i] = i;
            }
            Measurement m = mw.measure(values, values);
            assertThat(m.statistics().get("statistic")).isEqualTo((double) n * n / 2.0);
            assertThat(m.statistics().get("p_value")).isEqualTo(1.0);
            assertThat(m.matchScore()).isEqualTo(1.0);
        }
    }

    @Nested
    class WelchTTest {
        private final WelchTTestComparison t = new WelchTTestComparison();

        @Test
        void matchesCommonsMath() throws ComputationException {
            Measurement m = t.measure(A, B);
            TTest oracle = new TTest();
            assertThat(m.statistics().get("statistic")).isCloseTo(oracle.t(A, B), within(1e-10));
            assertThat(m.statistics().get("p_value")).isCloseTo(oracle.tTest(A, B), within(1e-8));
            assertThat(m.statistics()).containsKey("df");
        }

        @Test
        void constantSamplesAreComparedByTheirMeans() throws ComputationException {
            Measurement equal = t.measure(new double[]{4, 4, 4}, new double[]{4, 4});
            assertThat(equal.matchScore()).isEqualTo(1.0);
            assertThat(equal.statistics().get("statistic")).isEqualTo(0.0);

            Measurement different = t.measure(new double[]{4, 4, 4}, new double[]{5, 5});
            assertThat(different.matchScore()).isEqualTo(0.0);
            assertThat(different.statistics()).doesNotContainKey("statistic");
        }

        @Test
        void oneConstantSampleIsAnError() {
            assertThatThrownBy(() -> t.measure(new double[]{4, 4, 4}, B))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("synthetic");
        }

        @Test
        void needsTwoObservationsPerSample() {
            assertThatThrownBy(() -> t.measure(new double[]{1}, B)).isInstanceOf(ComputationException.class);
        }
    }

    @Nested
    class AndersonDarling {
        private final AndersonDarlingComparison ad = new AndersonDarlingComparison(5.0);

        @Test
        void standardizedMidrankStatistic() throws ComputationException {
            Measurement m = ad.measure(A, B);
            assertThat(m.statistics().get("statistic")).isCloseTo(0.27823474557540134, within(1e-9));
            assertThat(m.statistics().get("p_value")).isEqualTo(0.25);
            assertThat(m.matchScore()).isCloseTo(1.0 - 0.27823474557540134 / 5.0, within(1e-9));
        }

        @Test
        void identicalSamplesScoreOne() throws ComputationException {
            Measurement m = ad.measure(A, A);
            assertThat(m.statistics().get("statistic")).isNegative();
            assertThat(m.matchScore()).isEqualTo(1.0);
        }

        @Test
        void separatedSamplesScoreZero() throws ComputationException {
            Measurement m = ad.measure(A, shifted(A, 100.0));
            assertThat(m.statistics().get("statistic")).isCloseTo(7.811887009792712, within(1e-9));
            assertThat(m.statistics().get("p_value")).isEqualTo(0.001);
            assertThat(m.matchScore()).isEqualTo(0.0);
        }

        @Test
        void handlesTies() throws ComputationException {
            Measurement m = ad.measure(new double[]{1, 2, 2, 3, 3, 3}, new double[]{2, 3, 3, 4, 4, 5});
            assertThat(m.statistics().get("statistic")).isCloseTo(2.2689681712873573, within(1e-9));
        }

        @Test
        void pValueFollowsTheCriticalValueTable() {
            // critical values of the two-sample statistic at 5% and 1%
            assertThat(AndersonDarlingComparison.pValue(1.961)).isCloseTo(0.05, within(0.002));
            assertThat(AndersonDarlingComparison.pValue(3.716)).isCloseTo(0.01, within(0.0005));
            assertThat(AndersonDarlingComparison.pValue(-1.0)).isEqualTo(0.25);
            assertThat(AndersonDarlingComparison.pValue(10.0)).isEqualTo(0.001);
        }

        @Test
        void allIdenticalObservationsAreAnError() {
            assertThatThrownBy(() -> ad.measure(new double[]{2, 2}, new double[]{2, 2, 2}))
                .isInstanceOf(ComputationException.class)
                .hasMessageContaining("identical");
        }
    }

    @Nested
    class CramerVonMises {
        private final CramerVonMisesComparison cvm = new CramerVonMisesComparison(2.0);

        @Test
        void statisticOfFixedSamples() throws ComputationException {
            Measurement m = cvm.measure(A, B);
            assertThat(m.statistics().get("statistic")).isCloseTo(0.25, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(0.875, within(1e-12));
        }

        @Test
        void statisticUsesAverageRanksForTies() {
            assertThat(CramerVonMisesComparison.statistic(new double[]{1, 2, 2, 3, 3, 3}, new double[]{2, 3, 3, 4, 4, 5}))
                .isCloseTo(0.3541666666666665, within(1e-12));
        }

        @Test
        void separatedSamplesScoreLow() throws ComputationException {
            Measurement m = cvm.measure(A, shifted(A, 100.0));
            assertThat(m.statistics().get("statistic")).isCloseTo(1.34375, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(1.0 - 1.34375 / 2.0, within(1e-12));
        }
    }

    @Nested
    class Wasserstein {
        private final WassersteinComparison w = new WassersteinComparison();

        @Test
        void shiftedSamples() throws ComputationException {
            Measurement m = w.measure(new double[]{0, 1, 3}, new double[]{5, 6, 8});
            assertThat(m.statistics().get("distance")).isCloseTo(5.0, within(1e-12));
            assertThat(m.statistics().get("normalized_distance")).isCloseTo(5.0 / 8.0, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(0.375, within(1e-12));
        }

        @Test
        void unequalSizes() throws ComputationException {
            assertThat(w.measure(new double[]{3.4, 3.9, 7.5, 7.8}, new double[]{4.5, 1.4}).statistics().get("distance"))
                .isCloseTo(2.7, within(1e-12));
        }

        @Test
        void sameSingleValueIsAPerfectMatch() throws ComputationException {
            Measurement m = w.measure(new double[]{4}, new double[]{4, 4});
            assertThat(m.statistics().get("distance")).isEqualTo(0.0);
            assertThat(m.matchScore()).isEqualTo(1.0);
        }

        @Test
        void rejectsAnEmptySample() {
            assertThatThrownBy(() -> w.measure(A, new double[0])).isInstanceOf(ComputationException.class);
        }
    }

    @Nested
    class Correlation {
        private final CorrelationComparison corr = new CorrelationComparison(3);

        @Test
        void matchesCommonsMath() throws ComputationException {
            Measurement m = corr.measure(A, B);
            double pearson = new PearsonsCorrelation().correlation(A, B);
            double spearman = new SpearmansCorrelation().correlation(A, B);
            assertThat(m.statistics().get("pearson_r")).isCloseTo(pearson, within(1e-12));
            assertThat(m.statistics().get("spearman_r")).isCloseTo(spearman, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(((pearson + spearman) / 2 + 1) / 2, within(1e-12));
        }

        @Test
        void perfectAgreementAndPerfectInversion() throws ComputationException {
            double[] up = {1, 2, 3, 4};
            double[] down = {4, 3, 2, 1};
            assertThat(corr.measure(up, up).matchScore()).isCloseTo(1.0, within(1e-12));
            assertThat(corr.measure(up, down).matchScore()).isCloseTo(0.0, within(1e-12));
        }

        @Test
        void isSymmetric() throws ComputationException {
            assertThat(corr.measure(A, B).matchScore()).isCloseTo(corr.measure(B, A).matchScore(), within(1e-12));
        }

        @Test
        void rejectsUnpairableInput() {
            assertThatThrownBy(() -> corr.measure(A, new double[]{1, 2, 3}))
                .isInstanceOf(ComputationException.class).hasMessageContaining("length");
            assertThatThrownBy(() -> corr.measure(new double[]{1, 2}, new double[]{2, 1}))
                .isInstanceOf(ComputationException.class).hasMessageContaining("pairs");
            assertThatThrownBy(() -> corr.measure(new double[]{1, 1, 1}, new double[]{1, 2, 3}))
                .isInstanceOf(ComputationException.class).hasMessageContaining("constant");
        }
    }

    @Nested
    class ErrorMetrics {
        private final ErrorMetricsComparison errors = new ErrorMetricsComparison();

        @Test
        void pairedErrorsNormalizedByRange() throws ComputationException {
            Measurement m = errors.measure(new double[]{1, 2, 3}, new double[]{2, 2, 5});
            assertThat(m.statistics().get("mae")).isCloseTo(1.0, within(1e-12));
            assertThat(m.statistics().get("rmse")).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
            assertThat(m.statistics().get("normalized_mae")).isCloseTo(0.25, within(1e-12));
            assertThat(m.matchScore()).isCloseTo(0.75, within(1e-12));
        }

        @Test
        void pairsUpToTheShorterLength() throws ComputationException {
            Measurement m = errors.measure(new double[]{1, 2, 3, 100}, new double[]{1, 2, 3});
            assertThat(m.statistics().get("pairs")).isEqualTo(3.0);
            assertThat(m.matchScore()).isEqualTo(1.0);
        }

        @Test
        void allZeroResponsesCannotBeNormalized() {
            assertThatThrownBy(() -> errors.measure(new double[]{0, 0}, new double[]{0, 0}))
                .isInstanceOf(ComputationException.class);
            assertThatThrownBy(() -> errors.measure(new double[0], B))
                .isInstanceOf(ComputationException.class);
        }
    }

    @Nested
    class DistributionSummary {
        private final DistributionSummaryComparison summary = new DistributionSummaryComparison();

        @Test
        void identicalSamplesMatchPerfectly() {
            Measurement m = summary.measure(A, A);
            assertThat(m.matchScore()).isEqualTo(1.0);
            assertThat(m.statistics()).containsKeys("synthetic_mean", "real_median", "std_difference");
        }

        @Test
        void averagesRelativeDifferences() {
            // means 2 vs 4, medians 2 vs 4, population std 0.8165 vs 1.633
            Measurement m = summary.measure(new double[]{1, 2, 3}, new double[]{2, 4, 6});
            assertThat(m.matchScore()).isCloseTo(0.5, within(1e-12));
        }

        @Test
        void emptySidesDegradeToZeros() {
            assertThat(summary.measure(new double[0], new double[0]).matchScore()).isEqualTo(1.0);
            Measurement oneSided = summary.measure(new double[0], new double[]{1, 2, 3});
            assertThat(oneSided.matchScore()).isEqualTo(0.0);
            assertThat(oneSided.statistics().get("synthetic_mean")).isEqualTo(0.0);
        }

        @Test
        void comparesOnlyTheSuppliedSummaryValues() {
            Measurement m = DistributionSummaryComparison.compare(
                Map.of("mean", 4.0), Map.of("mean", 5.0));
            assertThat(m.statistics()).containsOnlyKeys(
                "synthetic_mean", "real_mean", "mean_difference", "average_relative_difference");
            assertThat(m.matchScore()).isCloseTo(0.8, within(1e-12));
        }
    }
}
