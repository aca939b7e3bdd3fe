package io.synthval.stats.model;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one validation run.
 *
 * <p>When no item qualified ({@link #insufficientData()}), the overall tier is
 * absent, reported as {@value Tier#NOT_AVAILABLE}, and the overall accuracy is
 * 0. That 0 is not a poor score; callers must check the flag.
 *
 * @param mode question-structured or flat aggregation
 * @param overallAccuracy mean match score over qualifying items, 0 when none qualify
 * @param overallTier tier from the tier distribution, null when none qualify
 * @param insufficientData true when no item produced a usable score
 * @param tierDistribution count of qualifying items per tier, every tier present
 * @param tests test results, flat mode only
 * @param questionComparisons per-question results, question mode only
 * @param inputIssues comparison units skipped for unusable input
 * @param summary item counts
 * @param syntheticSize synthetic observations or options, flat mode only
 * @param realSize real observations or options, flat mode only
 */
public record ValidationReport(
    ReportMode mode,
    double overallAccuracy,
    Tier overallTier,
    boolean insufficientData,
    Map<Tier, Integer> tierDistribution,
    List<TestResult> tests,
    List<QuestionComparison> questionComparisons,
    List<InputIssue> inputIssues,
    Summary summary,
    Long syntheticSize,
    Long realSize
) {

    public ValidationReport {
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(summary, "summary cannot be null");
        EnumMap<Tier, Integer> distribution = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            distribution.put(tier, tierDistribution == null ? 0 : tierDistribution.getOrDefault(tier, 0));
        }
        tierDistribution = Collections.unmodifiableMap(distribution);
        tests = List.copyOf(tests);
        questionComparisons = List.copyOf(questionComparisons);
        inputIssues = List.copyOf(inputIssues);
        if (insufficientData != (overallTier == null)) {
            throw new IllegalArgumentException("overall tier must be absent exactly when data is insufficient");
        }
    }

    /**
     * Item counts behind the overall figures.
     *
     * @param totalItems tests (flat) or questions (question mode) considered
     * @param scoredItems items that produced a usable score
     * @param excludedItems items left out because they errored or lacked data
     */
    public record Summary(int totalItems, int scoredItems, int excludedItems) {
    }

    /**
     * @return the overall tier name, or {@value Tier#NOT_AVAILABLE}
     */
    public String overallTierLabel() {
        return overallTier == null ? Tier.NOT_AVAILABLE : overallTier.name();
    }
}
