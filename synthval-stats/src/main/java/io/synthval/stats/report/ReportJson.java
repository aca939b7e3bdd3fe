package io.synthval.stats.report;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import io.synthval.stats.model.InputIssue;
import io.synthval.stats.model.OptionComparison;
import io.synthval.stats.model.QuestionComparison;
import io.synthval.stats.model.QuestionType;
import io.synthval.stats.model.TestResult;
import io.synthval.stats.model.Tier;
import io.synthval.stats.model.ValidationReport;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * JSON form of a {@link ValidationReport}.
 *
 * <h2>Shape</h2>
 *
 * <pre>{@code
 * {
 *   "mode": "questions",
 *   "overall_accuracy": 0.953,
 *   "overall_tier": "TIER_1",            // "N/A" when insufficient_data
 *   "insufficient_data": false,
 *   "tier_distribution": { "TIER_1": 1, "TIER_2": 0, "TIER_3": 0, "TIER_4": 0 },
 *   "summary": { "total_items": 1, "scored_items": 1, "excluded_items": 0 },
 *   "tests": [ { "test": "chi_square", "tier": "TIER_1", "match_score": 0.9, "chi2": 0.5, "p_value": 0.9 } ],
 *   "question_comparisons": [
 *     { "question_id": "Q1", "question_name": "...", "type": "Rating Scale", "status": "Compared",
 *       "match_score": 0.95, "tier": "TIER_1", "synthetic_total": 100.0, "real_total": 100.0,
 *       "option_comparisons": [ { "option": "1", "synthetic_count": 42.0, "real_count": 40.0 } ],
 *       "tests": [ ... ] }
 *   ],
 *   "input_issues": [ { "scope": "Q7", "message": "..." } ],
 *   "synthetic_size": 100,
 *   "real_size": 100
 * }
 * }</pre>
 *
 * <p>A test's native statistics sit next to its {@code test}, {@code tier} and
 * {@code match_score} keys. A failed test carries only {@code test} and
 * {@code error}. Sizes are omitted when unknown.
 */
public final class ReportJson {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .registerTypeAdapter(ValidationReport.class, new ReportSerializer())
        .create();

    private ReportJson() {
    }

    /**
     * @param report the report
     * @return pretty-printed JSON
     */
    public static String toJson(ValidationReport report) {
        return GSON.toJson(report);
    }

    /**
     * @param report the report
     * @return the JSON tree
     */
    public static JsonElement toJsonTree(ValidationReport report) {
        return GSON.toJsonTree(report);
    }

    private static final class ReportSerializer implements JsonSerializer<ValidationReport> {

        @Override
        public JsonElement serialize(ValidationReport report, Type type, JsonSerializationContext context) {
            JsonObject json = new JsonObject();
            json.addProperty("mode", report.mode().label());
            json.addProperty("overall_accuracy", report.overallAccuracy());
            json.addProperty("overall_tier", report.overallTierLabel());
            json.addProperty("insufficient_data", report.insufficientData());

            JsonObject distribution = new JsonObject();
            for (Map.Entry<Tier, Integer> e : report.tierDistribution().entrySet()) {
                distribution.addProperty(e.getKey().name(), e.getValue());
            }
            json.add("tier_distribution", distribution);

            JsonObject summary = new JsonObject();
            summary.addProperty("total_items", report.summary().totalItems());
            summary.addProperty("scored_items", report.summary().scoredItems());
            summary.addProperty("excluded_items", report.summary().excludedItems());
            json.add("summary", summary);

            json.add("tests", tests(report.tests()));

            JsonArray questions = new JsonArray();
            for (QuestionComparison question : report.questionComparisons()) {
                questions.add(question(question));
            }
            json.add("question_comparisons", questions);

            JsonArray issues = new JsonArray();
            for (InputIssue issue : report.inputIssues()) {
                JsonObject item = new JsonObject();
                item.addProperty("scope", issue.scope());
                item.addProperty("message", issue.message());
                issues.add(item);
            }
            json.add("input_issues", issues);

            if (report.syntheticSize() != null) {
                json.addProperty("synthetic_size", report.syntheticSize());
            }
            if (report.realSize() != null) {
                json.addProperty("real_size", report.realSize());
            }
            return json;
        }

        private static JsonObject question(QuestionComparison question) {
            JsonObject json = new JsonObject();
            json.addProperty("question_id", question.questionId());
            json.addProperty("question_name", question.questionName());
            json.addProperty("type", question.type().label());
            json.addProperty("status", question.status().label());
            if (question.isScored()) {
                json.addProperty("match_score", question.matchScore());
                json.addProperty("tier", question.tier().name());
            } else {
                json.addProperty("tier", Tier.NOT_AVAILABLE);
            }
            if (question.type() == QuestionType.RATING_SCALE || question.type() == QuestionType.CATEGORICAL) {
                double syntheticTotal = 0;
                double realTotal = 0;
                for (OptionComparison option : question.optionComparisons()) {
                    syntheticTotal += option.syntheticCount();
                    realTotal += option.realCount();
                }
                json.addProperty("synthetic_total", syntheticTotal);
                json.addProperty("real_total", realTotal);
            }
            JsonArray options = new JsonArray();
            for (OptionComparison option : question.optionComparisons()) {
                JsonObject item = new JsonObject();
                item.addProperty("option", option.option());
                item.addProperty("synthetic_count", option.syntheticCount());
                item.addProperty("real_count", option.realCount());
                options.add(item);
            }
            json.add("option_comparisons", options);
            json.add("tests", tests(question.tests()));
            return json;
        }

        private static JsonArray tests(Iterable<TestResult> results) {
            JsonArray array = new JsonArray();
            for (TestResult result : results) {
                JsonObject json = new JsonObject();
                json.addProperty("test", result.test());
                if (result.isScored()) {
                    json.addProperty("tier", result.tier().name());
                    json.addProperty("match_score", result.matchScore());
                    for (Map.Entry<String, Double> stat : result.statistics().entrySet()) {
                        json.addProperty(stat.getKey(), stat.getValue());
                    }
                } else {
                    json.addProperty("error", result.error());
                }
                array.add(json);
            }
            return array;
        }
    }
}
