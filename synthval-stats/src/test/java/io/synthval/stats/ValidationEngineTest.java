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

import io.synthval.stats.model.InputIssue;
import io.synthval.stats.model.NumericResponses;
import io.synthval.stats.model.OptionCounts;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.QuestionResponses;
import io.synthval.stats.model.QuestionStatus;
import io.synthval.stats.model.ReportMode;
import io.synthval.stats.model.SurveyQuestion;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValidationEngineTest {

    private static final OptionCounts REAL = OptionCounts.ofVector(40, 35, 20, 5);
    private static final OptionCounts CLOSE = OptionCounts.ofVector(42, 33, 18, 7);
    private static final OptionCounts SKEWED = OptionCounts.ofVector(80, 10, 5, 5);

    private final ValidationEngine engine = new ValidationEngine();

    @Test
    void identicalCountsMatchPerfectly() {
        ValidationReport report = engine.compareCounts(REAL, REAL);
        assertThat(report.mode()).isEqualTo(ReportMode.FLAT);
        assertThat(report.overallAccuracy()).isCloseTo(1.0, within(1e-9));
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
        assertThat(report.tierDistribution()).containsEntry(Tier.TIER_1, 3);
        assertThat(report.syntheticSize()).isEqualTo(100L);
    }

    @Test
    void countTotalsBeyondIntRangeAreReportedExactly() {
        OptionCounts large = OptionCounts.ofVector(3_000_000_000.0, 1_000_000_000.0);
        ValidationReport report = engine.compareCounts(large, large);
        assertThat(report.syntheticSize()).isEqualTo(4_000_000_000L);
        assertThat(report.realSize()).isEqualTo(4_000_000_000L);
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
    }

    @Test
    void closeCountsAreTierOne() {
        ValidationReport report = engine.compareCounts(CLOSE, REAL);
        assertThat(report.tests()).extracting(TestResult::test)
            .containsExactly("chi_square", "jensen_shannon", "kullback_leibler");
        assertThat(report.overallAccuracy()).isCloseTo(0.967, within(1e-3));
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
    }

    @Test
    void skewedCountsScoreLow() {
        ValidationReport report = engine.compareCounts(SKEWED, REAL);
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_3);
        assertThat(report.overallAccuracy()).isLessThan(0.6);
        assertThat(report.tests().get(0).tier()).isEqualTo(Tier.TIER_4);
    }

    @Test
    void symmetricTestsIgnoreArgumentOrder() {
        ValidationReport forward = engine.compareCounts(SKEWED, REAL);
        ValidationReport reverse = engine.compareCounts(REAL, SKEWED);
        for (int i = 0; i < 2; i++) {
            assertThat(forward.tests().get(i).matchScore())
                .isCloseTo(reverse.tests().get(i).matchScore(), within(1e-12));
        }
        assertThat(forward.tests().get(2).statistic("divergence"))
            .isNotCloseTo(reverse.tests().get(2).statistic("divergence"), within(1e-3));
    }

    @Test
    void repeatedCallsGiveEqualReports() {
        assertThat(engine.compareCounts(CLOSE, REAL)).isEqualTo(engine.compareCounts(CLOSE, REAL));
        double[] a = {1.2, 3.4, 2.2, 5.6, 4.1, 3.3, 2.8, 4.9};
        double[] b = {2.1, 3.9, 4.4, 6.2, 5.0, 3.7, 4.8, 5.5};
        assertThat(engine.compareSamples(a, b)).isEqualTo(engine.compareSamples(a, b));
    }

    @Test
    void identicalSamplesMatchPerfectly() {
        double[] a = {1.2, 3.4, 2.2, 5.6, 4.1, 3.3, 2.8, 4.9};
        ValidationReport report = engine.compareSamples(a, a);
        assertThat(report.tests()).hasSize(12);
        assertThat(report.summary().scoredItems()).isEqualTo(12);
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
        assertThat(report.overallAccuracy()).isGreaterThan(0.999);
    }

    @Test
    void emptyInputIsInsufficientData() {
        ValidationReport report = engine.compareSamples(new double[0], new double[0]);
        assertThat(report.insufficientData()).isTrue();
        assertThat(report.overallAccuracy()).isZero();
        assertThat(report.overallTierLabel()).isEqualTo("N/A");
        assertThat(report.tests()).isEmpty();
        assertThat(report.inputIssues()).containsExactly(
            new InputIssue(ValidationEngine.FLAT_SCOPE, "both synthetic and real responses are empty"));
    }

    @Test
    void mismatchedKindsAreAnInputIssue() {
        ValidationReport report = engine.compare(NumericResponses.of(1, 2, 3), REAL);
        assertThat(report.insufficientData()).isTrue();
        assertThat(report.inputIssues()).singleElement()
            .satisfies(issue -> assertThat(issue.message()).contains("numeric").contains("categorical"));
    }

    @Test
    void unusableQuestionsAreExcludedWithAnIssue() {
        ValidationReport report = engine.compareQuestions(List.of(
            new QuestionResponses("q1", "Satisfaction", CLOSE, REAL),
            new QuestionResponses("q2", "Empty", OptionCounts.empty(), OptionCounts.empty()),
            new QuestionResponses("q3", "Mixed", NumericResponses.of(1, 2), REAL)));

        assertThat(report.mode()).isEqualTo(ReportMode.QUESTIONS);
        assertThat(report.questionComparisons()).extracting(QuestionComparison::status)
            .containsExactly(QuestionStatus.COMPARED, QuestionStatus.INSUFFICIENT_DATA, QuestionStatus.INSUFFICIENT_DATA);
        assertThat(report.inputIssues()).extracting(InputIssue::scope).containsExactly("q2", "q3");
        assertThat(report.overallAccuracy()).isCloseTo(0.9533, within(1e-3));
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
        assertThat(report.summary().excludedItems()).isEqualTo(2);
    }

    @Test
    void oneSidedNumericQuestionDoesNotLowerTheOverallScore() {
        double[] sample = {1.2, 3.4, 2.2, 5.6, 4.1, 3.3, 2.8, 4.9};
        ValidationReport report = engine.compareSurvey(
            List.of(new SurveyQuestion("q1", "Age", NumericResponses.of(31, 45, 27, 52, 38)),
                new SurveyQuestion("q2", "Income", NumericResponses.of(sample))),
            List.of(new SurveyQuestion("q2", "Income", NumericResponses.of(sample))));

        assertThat(report.questionComparisons().get(0).status()).isEqualTo(QuestionStatus.INSUFFICIENT_DATA);
        assertThat(report.summary().scoredItems()).isEqualTo(1);
        assertThat(report.overallAccuracy()).isGreaterThan(0.999);
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
    }

    @Test
    void nearIdenticalRawArraysAreTierOne() {
        ValidationReport report = engine.compareSamples(new double[]{42, 33, 18, 7}, new double[]{40, 35, 20, 5});
        assertThat(report.mode()).isEqualTo(ReportMode.FLAT);
        assertThat(report.overallTier()).isEqualTo(Tier.TIER_1);
    }

    @Test
    void markedlyDifferentRawArraysScoreLow() {
        ValidationReport report = engine.compareSamples(new double[]{80, 10, 5, 5}, new double[]{40, 35, 20, 5});
        assertThat(report.overallTier()).isIn(Tier.TIER_3, Tier.TIER_4);
    }

    @Test
    void surveyQuestionsArePairedById() {
        List<SurveyQuestion> synthetic = List.of(
            new SurveyQuestion("q2", "Recommend", OptionCounts.of(Map.of("Yes", 30, "No", 20))),
            new SurveyQuestion("q1", "Satisfaction", CLOSE),
            new SurveyQuestion("q3", "Synthetic only", OptionCounts.of(Map.of("Yes", 5))));
        List<SurveyQuestion> real = List.of(
            new SurveyQuestion("q1", null, REAL),
            new SurveyQuestion("q2", null, OptionCounts.of(Map.of("Yes", 28, "No", 22))));

        ValidationReport report = engine.compareSurvey(synthetic, real);

        assertThat(report.questionComparisons()).extracting(QuestionComparison::questionId)
            .containsExactly("q1", "q2", "q3");
        assertThat(report.questionComparisons().get(1).questionName()).isEqualTo("Recommend");
        assertThat(report.questionComparisons().get(2).status()).isEqualTo(QuestionStatus.INSUFFICIENT_DATA);
        assertThat(report.summary().scoredItems()).isEqualTo(2);
    }
}
