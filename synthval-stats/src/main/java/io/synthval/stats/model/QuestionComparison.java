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

import java.util.List;
import java.util.Objects;

/**
 * Comparison result for one survey question.
 *
 * <p>A question with status {@link QuestionStatus#COMPARED} carries a match
 * score and tier; one with {@link QuestionStatus#INSUFFICIENT_DATA} carries
 * neither and is left out of the overall accuracy.
 *
 * @param questionId question identifier
 * @param questionName display name
 * @param type response shape
 * @param optionComparisons per-option counts, empty for numeric questions
 * @param tests the individual test results that produced the score
 * @param matchScore mean match score of the scored tests, null when excluded
 * @param tier tier of the match score, null when excluded
 * @param status compared or insufficient data
 */
public record QuestionComparison(
    String questionId,
    String questionName,
    QuestionType type,
    List<OptionComparison> optionComparisons,
    List<TestResult> tests,
    Double matchScore,
    Tier tier,
    QuestionStatus status
) {

    public QuestionComparison {
        Objects.requireNonNull(questionId, "questionId cannot be null");
        Objects.requireNonNull(questionName, "questionName cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        optionComparisons = List.copyOf(optionComparisons);
        tests = List.copyOf(tests);
        if (status == QuestionStatus.COMPARED && (matchScore == null || tier == null)) {
            throw new IllegalArgumentException("compared question " + questionId + " needs a score and tier");
        }
        if (status == QuestionStatus.INSUFFICIENT_DATA && (matchScore != null || tier != null)) {
            throw new IllegalArgumentException("excluded question " + questionId + " carries no score or tier");
        }
    }

    /**
     * @return true if this question counts toward the overall accuracy
     */
    public boolean isScored() {
        return status == QuestionStatus.COMPARED;
    }
}
