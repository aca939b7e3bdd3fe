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

/// Ordered confidence tiers, best first.
///
/// A tier is always derived from a normalized match score; see
/// {@link io.synthval.stats.tier.TierClassifier}.
public enum Tier {
    TIER_1,
    TIER_2,
    TIER_3,
    TIER_4;

    /// Label used when no item qualified for an overall tier.
    public static final String NOT_AVAILABLE = "N/A";

    /// @param other tier to compare against
    /// @return true if this tier is the same as or better than `other`
    public boolean isAtLeast(Tier other) {
        return ordinal() <= other.ordinal();
    }
}
