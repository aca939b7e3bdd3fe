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

/// How a report's overall figures were aggregated.
public enum ReportMode {
    /// Over question comparisons.
    QUESTIONS("questions"),
    /// Over the test results of a single response pair.
    FLAT("flat");

    private final String label;

    ReportMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
