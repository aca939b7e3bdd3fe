package io.synthval.stats.battery;

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

/// Raised inside a single statistical comparison when its input is degenerate
/// for that comparison (too few observations, zero variance, mismatched
/// categories, a normalization by zero).
///
/// It never leaves {@link TestBattery}; the battery turns it into a failed
/// {@link io.synthval.stats.model.TestResult}.
public class ComputationException extends Exception {

    public ComputationException(String message) {
        super(message);
    }
}
