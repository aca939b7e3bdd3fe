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

/**
 * A comparison unit that was not run because its inputs were unusable
 * (both sides empty, or numeric responses paired with option counts).
 *
 * @param scope the question id, or {@code flat} for a whole-survey comparison
 * @param message what was wrong
 */
public record InputIssue(String scope, String message) {
}
