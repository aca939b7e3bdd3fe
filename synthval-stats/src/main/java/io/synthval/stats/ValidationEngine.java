package io.synthval.stats;

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

import io.synthval.stats.aggregate.QuestionAggregator;
import io.synthval.stats.aggregate.ReportAggregator;
import io.synthval.stats.battery.TestBattery;
import io.synthval.stats.config.ValidationConfig;
import io.synthval.stats.model.InputIssue;
import io.synthval.stats.model.NumericResponses;
import io.synthval.stats.model.OptionCounts;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.QuestionResponses;
import io.synthval.stats.model.ResponseSet;
import io.synthval.stats.model.SurveyQuestion;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.ValidationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for comparing synthetic survey responses against real ones.
 *
 * <p>The engine holds only the batteries and aggregators built from its
 * configuration, so one instance can serve concurrent callers. Every call works on
 * its own copies of the input and returns a fresh {@link ValidationReport}.
 *
 * <h2>Modes</h2>
 *
 * <ul>
 *   <li>Flat: two raw numeric samples ({@link #compareSamples}) or two option
 *       count maps ({@link #compareCounts}) compared as a whole. The overall
 *       score averages the scored tests.</li>
 *   <li>Questions: one response pair per survey question
 *       ({@link #compareQuestions}, {@link #compareSurvey}). The overall score
 *       averages the compared questions.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 *
 * <p>Null arguments are programming errors and throw. Everything else is
 * reported as data: a failing test becomes a failed {@link TestResult}; an
 * unusable pair (both sides empty, or numeric against categorical) becomes an
 * {@link InputIssue} and is left out; no usable score at all sets the report's
 * insufficient-data flag.
 */
public final class ValidationEngine {

    private static final Logger logger = LogManager.getLogger(ValidationEngine.class);

    /** Scope used for input issues of a flat comparison. */
    public static final String FLAT_SCOPE = "input";

    private final TestBattery sampleBattery;
    private final TestBattery countBattery;
    private final QuestionAggregator questionAggregator;
    private final ReportAggregator reportAggregator;

    /**
     * Creates an engine with the default configuration.
     */
    public ValidationEngine() {
        this(ValidationConfig.defaults());
    }

    /**
     * Creates an engine with the given configuration.
     *
     * @param config configuration, as returned by {@link ValidationConfig#defaults()} or loaded from JSON
     */
    public ValidationEngine(ValidationConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.sampleBattery = TestBattery.forSamples(config);
        this.countBattery = TestBattery.forCounts(config);
        this.questionAggregator = new QuestionAggregator(config);
        this.reportAggregator = new ReportAggregator(config);
    }

    /**
     * Compares two raw numeric samples with the full test battery.
     *
     * @param synthetic synthetic observations
     * @param real real observations
     * @return a flat report
     */
    public ValidationReport compareSamples(NumericResponses synthetic, NumericResponses real) {
        Objects.requireNonNull(synthetic, "synthetic responses cannot be null");
        Objects.requireNonNull(real, "real responses cannot be null");
        Optional<String> problem = inputProblem(synthetic, real);
        if (problem.isPresent()) {
            return flatInputError(problem.get(), (long) synthetic.size(), (long) real.size());
        }
        logger.debug("Comparing {} synthetic against {} real observations", synthetic.size(), real.size());
        List<TestResult> tests = sampleBattery.run(synthetic.values(), real.values());
        return reportAggregator.fromTests(tests, List.of(), (long) synthetic.size(), (long) real.size());
    }

    /**
     * Compares two raw numeric samples with the full test battery.
     */
    public ValidationReport compareSamples(double[] synthetic, double[] real) {
        return compareSamples(NumericResponses.of(synthetic), NumericResponses.of(real));
    }

    /**
     * Compares two option-count maps as a whole with chi-square,
     * Jensen-Shannon and Kullback-Leibler.
     *
     * <p>Options are aligned on the union of both sides' labels, synthetic
     * labels first; an option missing on one side counts as 0 there.
     *
     * @param synthetic synthetic counts
     * @param real real counts
     * @return a flat report
     */
    public ValidationReport compareCounts(OptionCounts synthetic, OptionCounts real) {
        Objects.requireNonNull(synthetic, "synthetic responses cannot be null");
        Objects.requireNonNull(real, "real responses cannot be null");
        long syntheticSize = Math.round(synthetic.total());
        long realSize = Math.round(real.total());
        Optional<String> problem = inputProblem(synthetic, real);
        if (problem.isPresent()) {
            return flatInputError(problem.get(), syntheticSize, realSize);
        }
        List<String> labels = synthetic.unionLabels(real);
        logger.debug("Comparing counts over {} options", labels.size());
        List<TestResult> tests = countBattery.run(synthetic.vector(labels), real.vector(labels));
        return reportAggregator.fromTests(tests, List.of(), syntheticSize, realSize);
    }

    /**
     * Compares two response sets of any kind as a whole.
     *
     * @param synthetic synthetic responses
     * @param real real responses
     * @return a flat report; an input issue when the kinds differ
     */
    public ValidationReport compare(ResponseSet synthetic, ResponseSet real) {
        Objects.requireNonNull(synthetic, "synthetic responses cannot be null");
        Objects.requireNonNull(real, "real responses cannot be null");
        if (synthetic instanceof NumericResponses s && real instanceof NumericResponses r) {
            return compareSamples(s, r);
        }
        if (synthetic instanceof OptionCounts s && real instanceof OptionCounts r) {
            return compareCounts(s, r);
        }
        return flatInputError(inputProblem(synthetic, real).orElseThrow(), null, null);
    }

    /**
     * Compares already paired questions.
     *
     * @param questions one response pair per question
     * @return a question-structured report
     */
    public ValidationReport compareQuestions(List<QuestionResponses> questions) {
        Objects.requireNonNull(questions, "questions cannot be null");
        List<QuestionComparison> comparisons = new ArrayList<>(questions.size());
        List<InputIssue> issues = new ArrayList<>();
        for (QuestionResponses question : questions) {
            Objects.requireNonNull(question, "question cannot be null");
            Optional<String> problem = inputProblem(question.synthetic(), question.real());
            if (problem.isPresent()) {
                logger.warn("Skipping question {}: {}", question.questionId(), problem.get());
                issues.add(new InputIssue(question.questionId(), problem.get()));
                comparisons.add(questionAggregator.excluded(question));
            } else {
                comparisons.add(questionAggregator.compare(question));
            }
        }
        return reportAggregator.fromQuestions(comparisons, issues);
    }

    /**
     * Pairs synthetic and real questions by id and compares each pair.
     *
     * @param synthetic questions from the synthetic source
     * @param real questions from the real source
     * @return a question-structured report
     * @throws IllegalArgumentException if a question id repeats within one side
     */
    public ValidationReport compareSurvey(List<SurveyQuestion> synthetic, List<SurveyQuestion> real) {
        Objects.requireNonNull(synthetic, "synthetic questions cannot be null");
        Objects.requireNonNull(real, "real questions cannot be null");
        return compareQuestions(SurveyQuestion.pairById(synthetic, real));
    }

    /**
     * Describes why a pair cannot be compared at all.
     *
     * @return the problem, or empty when the pair is usable
     */
    static Optional<String> inputProblem(ResponseSet synthetic, ResponseSet real) {
        if (!synthetic.kind().equals(real.kind())) {
            return Optional.of("cannot compare " + synthetic.kind() + " responses against " + real.kind() + " responses");
        }
        if (synthetic.isEmpty() && real.isEmpty()) {
            return Optional.of("both synthetic and real responses are empty");
        }
        return Optional.empty();
    }

    private ValidationReport flatInputError(String problem, Long syntheticSize, Long realSize) {
        logger.warn("Skipping comparison: {}", problem);
        return reportAggregator.fromTests(List.of(), List.of(new InputIssue(FLAT_SCOPE, problem)),
            syntheticSize, realSize);
    }
}
