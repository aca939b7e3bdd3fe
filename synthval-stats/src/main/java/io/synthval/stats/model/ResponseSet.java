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

/// One side (synthetic or real) of a comparison unit.
///
/// A response set is either a sequence of numeric observations or a map of
/// answer options to non-negative counts. Two response sets are only ever
/// compared when they are of the same kind.
public sealed interface ResponseSet permits NumericResponses, OptionCounts {

    /// @return number of observations, or number of options for counts
    int size();

    /// @return true if there is nothing to compare on this side
    boolean isEmpty();

    /// @return a short name of the kind, used in diagnostics
    String kind();

    /// An empty response set of the same kind as this one.
    ///
    /// @return an empty instance
    ResponseSet emptyOfSameKind();
}
