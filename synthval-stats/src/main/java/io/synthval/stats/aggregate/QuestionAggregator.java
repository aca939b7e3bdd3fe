package io.synthval.stats.aggregate;

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

import io.synthval.stats.battery.DistributionSummaryComparison;
import io.synthval.stats.battery.TestBattery;
import io.synthval.stats.config.ValidationConfig;
import io.synthval.stats.model.NumericResponses;
import io.synthval.stats.model.OptionComparison;
import io.synthval.stats.model.OptionCounts;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.QuestionResponses;
import io.synthval.stats.model.QuestionStatus;
import io.synthval.stats.model.QuestionType;
import io.synthval.stats.model.ResponseSet;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.tier.TierClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compares the synthetic and real responses of one survey question.
 *
 * <h2>Question types</h2>
 *
 * <ul>
 *   <li><b>Rating Scale</b> - every option label is an integer from 1 to 10</li>
 *   <li><b>Categorical</b> - any other set of option labels</li>
 *   <li><b>Statistical Summary</b> - the options carry only the reserved
 *       summary labels {@code MEAN}, {@code MEDIAN}, {@code STD} and
 *       {@code TOTAL_RESPONSES}</li>
 *   <li><b>Numeric</b> - raw numeric observations instead of option counts</li>
 * </ul>
 *
 * <p>Option-count questions drop the reserved summary labels and run
 * chi-square and Jensen-Shannon over the union of both sides' options.
 * Options with no responses on either side are listed in the option
 * comparisons but left out of the test vectors. Summary-only questions compare
 * the supplied mean, median and standard deviation. Numeric questions run the
 * unpaired sample battery.
 *
 * <p>The question's match score is the average of its scored tests. When no
 * test produces a score, or when one side holds no responses at all, the
 * question is marked {@link QuestionStatus#INSUFFICIENT_DATA} and carries no
 * score or tier. Its test results are still listed.
 */
public final class QuestionAggregator {

    private static final Logger logger = LogManager.getLogger(QuestionAggregator.class);

    /** Option labels that carry summary statistics rather than answer counts. */
    public static final Set<String> RESERVED_LABELS = Set.of("MEAN", "MEDIAN", "STD", "TOTAL_RESPONSES");

    private static final List<String> SUMMARY_LABELS = List.of("MEAN", "MEDIAN", "STD");

    private final TestBattery countBattery;
    private final TestBattery sampleBattery;
    private final TierClassifier classifier;

    public QuestionAggregator(ValidationConfig config) {
        this.countBattery = TestBattery.forQuestionCounts(config);
        this.sampleBattery = TestBattery.forQuestionSamples(config);
        this.classifier = new TierClassifier(config.tierThresholds());
    }

    /**
     * Compares one question. At least one side must hold responses and both
     * sides must be of the same kind; callers check that first.
     *
     * @param question paired responses
     * @return the question comparison
     */
    public QuestionComparison compare(QuestionResponses question) {
        ResponseSet synthetic = question.synthetic();
        ResponseSet real = question.real();
        if (synthetic instanceof OptionCounts s && real instanceof OptionCounts r) {
            return compareCounts(question, s, r);
        }
        if (synthetic instanceof NumericResponses s && real instanceof NumericResponses r) {
            return conclude(question, QuestionType.NUMERIC, List.of(), sampleBattery.run(s.values(), r.values()));
        }
        throw new IllegalArgumentException("question " + question.questionId() + " mixes "
            + synthetic.kind() + " and " + real.kind() + " responses");
    }

    /**
     * Builds the excluded comparison for a question whose input cannot be used.
     *
     * @param question paired responses
     * @return an insufficient-data comparison with no tests
     */
    public QuestionComparison excluded(QuestionResponses question) {
        return new QuestionComparison(question.questionId(), question.questionName(),
            detectType(question.synthetic(), question.real()), List.of(), List.of(),
            null, null, QuestionStatus.INSUFFICIENT_DATA);
    }

    /**
     * Detects the question type from the responses on both sides.
     */
    public static QuestionType detectType(ResponseSet synthetic, ResponseSet real) {
        if (!(synthetic instanceof OptionCounts s) || !(real instanceof OptionCounts r)) {
            return QuestionType.NUMERIC;
        }
        OptionCounts syn = s.without(RESERVED_LABELS);
        OptionCounts rea = r.without(RESERVED_LABELS);
        if (syn.isEmpty() && rea.isEmpty()) {
            return s.isEmpty() && r.isEmpty() ? QuestionType.CATEGORICAL : QuestionType.STATISTICAL_SUMMARY;
        }
        List<String> labels = syn.unionLabels(rea);
        return labels.stream().allMatch(QuestionAggregator::isRating)
            ? QuestionType.RATING_SCALE
            : QuestionType.CATEGORICAL;
    }

    private QuestionComparison compareCounts(QuestionResponses question, OptionCounts synthetic, OptionCounts real) {
        QuestionType type = detectType(synthetic, real);
        if (type == QuestionType.STATISTICAL_SUMMARY) {
            return compareSummary(question, synthetic, real);
        }

        OptionCounts syn = synthetic.without(RESERVED_LABELS);
        OptionCounts rea = real.without(RESERVED_LABELS);
        List<String> labels = syn.unionLabels(rea);
        if (type == QuestionType.RATING_SCALE) {
            labels.sort(Comparator.comparingInt(Integer::parseInt));
        } else {
            labels.sort(Comparator.naturalOrder());
        }

        List<OptionComparison> options = new ArrayList<>(labels.size());
        List<String> answered = new ArrayList<>(labels.size());
        for (String label : labels) {
            options.add(new OptionComparison(label, syn.count(label), rea.count(label)));
            if (syn.count(label) > 0 || rea.count(label) > 0) {
                answered.add(label);
            }
        }
        List<TestResult> tests = countBattery.run(syn.vector(answered), rea.vector(answered));
        return conclude(question, type, options, tests);
    }

    private QuestionComparison compareSummary(QuestionResponses question, OptionCounts synthetic, OptionCounts real) {
        Map<String, Double> syn = summaryValues(synthetic);
        Map<String, Double> rea = summaryValues(real);
        List<OptionComparison> options = new ArrayList<>();
        for (String label : SUMMARY_LABELS) {
            String key = label.toLowerCase(Locale.ROOT);
            if (syn.containsKey(key) || rea.containsKey(key)) {
                options.add(new OptionComparison(label, syn.getOrDefault(key, 0.0), rea.getOrDefault(key, 0.0)));
            }
        }
        TestResult result = countBattery.evaluate(DistributionSummaryComparison.NAME,
            DistributionSummaryComparison.compare(syn, rea));
        return conclude(question, QuestionType.STATISTICAL_SUMMARY, options, List.of(result));
    }

    private QuestionComparison conclude(QuestionResponses question, QuestionType type,
                                        List<OptionComparison> options, List<TestResult> tests) {
        if (question.synthetic().isEmpty() || question.real().isEmpty()) {
            logger.warn("Question {} has responses on one side only; excluded from the overall score",
                question.questionId());
            return new QuestionComparison(question.questionId(), question.questionName(), type,
                options, tests, null, null, QuestionStatus.INSUFFICIENT_DATA);
        }
        double sum = 0.0;
        int scored = 0;
        for (TestResult test : tests) {
            if (test.isScored()) {
                sum += test.matchScore();
                scored++;
            }
        }
        if (scored == 0) {
            logger.warn("Question {} has no usable test result; excluded from the overall score",
                question.questionId());
            return new QuestionComparison(question.questionId(), question.questionName(), type,
                options, tests, null, null, QuestionStatus.INSUFFICIENT_DATA);
        }
        double score = Math.max(0.0, Math.min(1.0, sum / scored));
        Tier tier = classifier.classify(score);
        logger.debug("Question {} ({}): {} of {} tests scored, score={} tier={}",
            question.questionId(), type.label(), scored, tests.size(), score, tier);
        return new QuestionComparison(question.questionId(), question.questionName(), type,
            options, tests, score, tier, QuestionStatus.COMPARED);
    }

    private static Map<String, Double> summaryValues(OptionCounts counts) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : counts.counts().entrySet()) {
            String label = e.getKey().toUpperCase(Locale.ROOT);
            if (SUMMARY_LABELS.contains(label)) {
                values.put(label.toLowerCase(Locale.ROOT), e.getValue());
            }
        }
        return values;
    }

    private static boolean isRating(String label) {
        if (label.isEmpty() || label.length() > 2) {
            return false;
        }
        for (int i = 0; i < label.length(); i++) {
            if (!Character.isDigit(label.charAt(i))) {
                return false;
            }
        }
        int value = Integer.parseInt(label);
        return value >= 1 && value <= 10;
    }
}
