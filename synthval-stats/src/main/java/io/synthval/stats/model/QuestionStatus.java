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

/// Whether a question contributed to the overall accuracy.
public enum QuestionStatus {
    COMPARED("Compared"),
    INSUFFICIENT_DATA("Insufficient data");

    private final String label;

    QuestionStatus(String label) {
        this.label = label;
    }

    /// @return the display label carried in serialized reports
    public String label() {
        return label;
    }
}
