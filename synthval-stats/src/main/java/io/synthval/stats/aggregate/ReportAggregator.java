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

import io.synthval.stats.config.ValidationConfig;
import io.synthval.stats.model.InputIssue;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.ReportMode;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.model.ValidationReport;
import io.synthval.stats.tier.OverallTierRule;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Combines question-level or test-level results into one report.
///
/// Only qualifying items count: compared questions in question mode, scored
/// tests in flat mode. The overall accuracy is their mean match score and the
/// overall tier comes from their tier distribution via {@link OverallTierRule}.
/// With no qualifying item the report is flagged as insufficient data, with
/// accuracy 0 and no overall tier.
public final class ReportAggregator {

    private static final Logger logger = LogManager.getLogger(ReportAggregator.class);

    private final OverallTierRule overallTierRule;

    public ReportAggregator(ValidationConfig config) {
        this.overallTierRule = new OverallTierRule(config.overallTierShares());
    }

    /// Builds a question-structured report.
    ///
    /// @param questions every question, excluded ones included
    /// @param issues input problems found while pairing or checking questions
    /// @return the report
    public ValidationReport fromQuestions(List<QuestionComparison> questions, List<InputIssue> issues) {
        Map<Tier, Integer> distribution = new EnumMap<>(Tier.class);
        double sum = 0.0;
        int scored = 0;
        for (QuestionComparison question : questions) {
            if (question.isScored()) {
                sum += question.matchScore();
                distribution.merge(question.tier(), 1, Integer::sum);
                scored++;
            }
        }
        return build(ReportMode.QUESTIONS, sum, scored, questions.size(), distribution,
            List.of(), questions, issues, null, null);
    }

    /// Builds a flat report over one battery run.
    ///
    /// @param tests battery results, failed ones included
    /// @param issues input problems that prevented the battery from running
    /// @param syntheticSize number of synthetic responses, or null if unknown
    /// @param realSize number of real responses, or null if unknown
    /// @return the report
    public ValidationReport fromTests(List<TestResult> tests, List<InputIssue> issues,
                                      Long syntheticSize, Long realSize) {
        Map<Tier, Integer> distribution = new EnumMap<>(Tier.class);
        double sum = 0.0;
        int scored = 0;
        for (TestResult test : tests) {
            if (test.isScored()) {
                sum += test.matchScore();
                distribution.merge(test.tier(), 1, Integer::sum);
                scored++;
            }
        }
        return build(ReportMode.FLAT, sum, scored, tests.size(), distribution,
            tests, List.of(), issues, syntheticSize, realSize);
    }

    private ValidationReport build(ReportMode mode, double sum, int scored, int total,
                                   Map<Tier, Integer> distribution, List<TestResult> tests,
                                   List<QuestionComparison> questions, List<InputIssue> issues,
                                   Long syntheticSize, Long realSize) {
        Optional<Tier> overall = overallTierRule.overallTier(distribution);
        double accuracy = scored == 0 ? 0.0 : sum / scored;
        if (overall.isEmpty()) {
            logger.warn("No {} produced a usable score; report marked as insufficient data",
                mode == ReportMode.QUESTIONS ? "question" : "test");
        }
        ValidationReport report = new ValidationReport(mode, accuracy, overall.orElse(null), overall.isEmpty(),
            distribution, tests, questions, issues,
            new ValidationReport.Summary(total, scored, total - scored), syntheticSize, realSize);
        logger.info("Validation report ({}): accuracy={} tier={} scored={}/{}",
            mode.label(), String.format("%.4f", accuracy), report.overallTierLabel(), scored, total);
        return report;
    }
}
