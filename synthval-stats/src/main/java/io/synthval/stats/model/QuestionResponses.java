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

import java.util.Objects;

/**
 * Synthetic and real responses for one question, already extracted.
 *
 * @param questionId question identifier
 * @param questionName display name, defaults to the id
 * @param synthetic synthetic responses
 * @param real real responses
 */
public record QuestionResponses(String questionId, String questionName, ResponseSet synthetic, ResponseSet real) {

    public QuestionResponses {
        Objects.requireNonNull(questionId, "questionId cannot be null");
        Objects.requireNonNull(synthetic, "synthetic responses cannot be null");
        Objects.requireNonNull(real, "real responses cannot be null");
        if (questionName == null || questionName.isBlank()) {
            questionName = questionId;
        }
    }
}
