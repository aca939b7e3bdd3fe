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

import io.synthval.stats.config.ValidationConfig;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.tier.TierClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a fixed list of independent statistical comparisons over one pair of
 * inputs and turns each outcome into a {@link TestResult}.
 *
 * <h2>Isolation</h2>
 *
 * <p>Every comparison runs on its own copy of the input. A failure in one
 * comparison (a {@link ComputationException}, an arithmetic failure, or a
 * non-finite statistic or score) becomes a failed result for that comparison
 * only; the rest of the battery still runs. Scores are clamped to [0, 1] and
 * tiered with the configured thresholds.
 *
 * <h2>Batteries</h2>
 *
 * <ul>
 *   <li>{@link #forCounts} - chi-square, Jensen-Shannon and Kullback-Leibler over
 *       aligned category counts</li>
 *   <li>{@link #forQuestionCounts} - chi-square and Jensen-Shannon over one
 *       question's option counts</li>
 *   <li>{@link #forSamples} - the full battery over raw numeric samples; the
 *       count-based tests run on a shared histogram</li>
 *   <li>{@link #forQuestionSamples} - the unpaired subset of the full battery,
 *       used for a numeric survey question</li>
 * </ul>
 */
public final class TestBattery {

    private static final Logger logger = LogManager.getLogger(TestBattery.class);

    private final List<StatisticalComparison> comparisons;
    private final TierClassifier classifier;

    public TestBattery(List<StatisticalComparison> comparisons, TierClassifier classifier) {
        this.comparisons = List.copyOf(comparisons);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public static TestBattery forCounts(ValidationConfig config) {
        return new TestBattery(List.of(
            new ChiSquareComparison(),
            new JensenShannonComparison(),
            new KullbackLeiblerComparison(config.klEpsilon())
        ), new TierClassifier(config.tierThresholds()));
    }

    public static TestBattery forQuestionCounts(ValidationConfig config) {
        return new TestBattery(List.of(
            new ChiSquareComparison(),
            new JensenShannonComparison()
        ), new TierClassifier(config.tierThresholds()));
    }

    public static TestBattery forSamples(ValidationConfig config) {
        int bins = config.maxHistogramBins();
        return new TestBattery(List.of(
            new BinnedComparison(new ChiSquareComparison(), bins),
            new KolmogorovSmirnovComparison(),
            new BinnedComparison(new JensenShannonComparison(), bins),
            new MannWhitneyComparison(),
            new WelchTTestComparison(),
            new AndersonDarlingComparison(config.andersonDarlingScale()),
            new WassersteinComparison(),
            new CorrelationComparison(config.minCorrelationPairs()),
            new ErrorMetricsComparison(),
            new DistributionSummaryComparison(),
            new BinnedComparison(new KullbackLeiblerComparison(config.klEpsilon()), bins, config.klBinPseudoCount()),
            new CramerVonMisesComparison(config.cramerVonMisesScale())
        ), new TierClassifier(config.tierThresholds()));
    }

    public static TestBattery forQuestionSamples(ValidationConfig config) {
        int bins = config.maxHistogramBins();
        return new TestBattery(List.of(
            new KolmogorovSmirnovComparison(),
            new BinnedComparison(new JensenShannonComparison(), bins),
            new MannWhitneyComparison(),
            new WelchTTestComparison(),
            new AndersonDarlingComparison(config.andersonDarlingScale()),
            new WassersteinComparison(),
            new DistributionSummaryComparison(),
            new CramerVonMisesComparison(config.cramerVonMisesScale())
        ), new TierClassifier(config.tierThresholds()));
    }

    /**
     * Runs every comparison in battery order.
     *
     * @param synthetic synthetic side, not modified
     * @param real real side, not modified
     * @return one result per comparison, in battery order
     */
    public List<TestResult> run(double[] synthetic, double[] real) {
        Objects.requireNonNull(synthetic, "synthetic");
        Objects.requireNonNull(real, "real");
        List<TestResult> results = new ArrayList<>(comparisons.size());
        for (StatisticalComparison comparison : comparisons) {
            results.add(runOne(comparison, synthetic, real));
        }
        return results;
    }

    /**
     * Runs one comparison and converts its outcome, failures included, into a result.
     */
    public TestResult runOne(StatisticalComparison comparison, double[] synthetic, double[] real) {
        String name = comparison.name();
        Measurement measured;
        try {
            measured = comparison.measure(synthetic.clone(), real.clone());
        } catch (ComputationException | ArithmeticException | IllegalArgumentException e) {
            logger.debug("{} failed: {}", name, e.getMessage());
            return TestResult.failed(name, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return evaluate(name, measured);
    }

    /**
     * Validates a measurement, clamps its score and assigns the tier.
     *
     * @param name test identifier
     * @param measured raw measurement
     * @return a scored result, or a failed one when any value is not finite
     */
    public TestResult evaluate(String name, Measurement measured) {
        for (Map.Entry<String, Double> stat : measured.statistics().entrySet()) {
            if (stat.getValue() == null || !Double.isFinite(stat.getValue())) {
                logger.debug("{} produced a non-finite {}", name, stat.getKey());
                return TestResult.failed(name, "non-finite statistic: " + stat.getKey());
            }
        }
        double score = measured.matchScore();
        if (!Double.isFinite(score)) {
            logger.debug("{} produced a non-finite match score", name);
            return TestResult.failed(name, "non-finite match score");
        }
        score = Math.max(0.0, Math.min(1.0, score));
        Tier tier = classifier.classify(score);
        logger.debug("{}: score={} tier={}", name, score, tier);
        return TestResult.scored(name, measured.statistics(), score, tier);
    }
}
