package io.synthval.command.compare;

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
import io.synthval.stats.model.OptionComparison;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.model.ValidationReport;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Renders a {@link ValidationReport} as a plain-text summary for the console.
public final class TextReportFormatter {

    private static final String RULE = "─".repeat(72);

    private TextReportFormatter() {
    }

    public static String format(ValidationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("SYNTHETIC VS REAL COMPARISON (").append(report.mode().label()).append(" mode)\n");
        sb.append(RULE).append('\n');
        sb.append(String.format(Locale.ROOT, "Overall accuracy: %.4f\n", report.overallAccuracy()));
        sb.append("Overall tier:     ").append(report.overallTierLabel()).append('\n');
        if (report.insufficientData()) {
            sb.append("Insufficient data: no item produced a usable score\n");
        }
        if (report.syntheticSize() != null && report.realSize() != null) {
            sb.append(String.format(Locale.ROOT, "Responses:        %d synthetic, %d real\n",
                report.syntheticSize(), report.realSize()));
        }
        ValidationReport.Summary summary = report.summary();
        sb.append(String.format(Locale.ROOT, "Items:            %d total, %d scored, %d excluded\n",
            summary.totalItems(), summary.scoredItems(), summary.excludedItems()));
        sb.append("Tier distribution:");
        for (Map.Entry<Tier, Integer> e : report.tierDistribution().entrySet()) {
            sb.append(' ').append(e.getKey().name()).append('=').append(e.getValue());
        }
        sb.append('\n');

        if (!report.tests().isEmpty()) {
            sb.append('\n');
            appendTests(sb, report.tests(), "");
        }

        for (QuestionComparison question : report.questionComparisons()) {
            sb.append('\n');
            sb.append(question.questionId()).append("  ").append(question.questionName()).append('\n');
            sb.append("  type: ").append(question.type().label())
                .append("  status: ").append(question.status().label());
            if (question.isScored()) {
                sb.append(String.format(Locale.ROOT, "  score: %.4f  tier: %s",
                    question.matchScore(), question.tier().name()));
            }
            sb.append('\n');
            for (OptionComparison option : question.optionComparisons()) {
                sb.append(String.format(Locale.ROOT, "    %-20s %10.2f %10.2f\n",
                    option.option(), option.syntheticCount(), option.realCount()));
            }
            appendTests(sb, question.tests(), "  ");
        }

        List<InputIssue> issues = report.inputIssues();
        if (!issues.isEmpty()) {
            sb.append('\n').append("Input issues:\n");
            for (InputIssue issue : issues) {
                sb.append("  ").append(issue.scope()).append(": ").append(issue.message()).append('\n');
            }
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static void appendTests(StringBuilder sb, List<TestResult> tests, String indent) {
        for (TestResult test : tests) {
            if (test.isScored()) {
                sb.append(String.format(Locale.ROOT, "%s  %-22s %8.4f  %s\n",
                    indent, test.test(), test.matchScore(), test.tier().name()));
            } else {
                sb.append(String.format(Locale.ROOT, "%s  %-22s %8s  error: %s\n",
                    indent, test.test(), "-", test.error()));
            }
        }
    }
}
