package io.synthval.stats.tier;

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

import io.synthval.stats.config.TierThresholds;
import io.synthval.stats.model.Tier;

import java.util.Objects;

/// Maps a normalized match score to a confidence tier.
///
/// ```text
///   score > 0.85  → TIER_1
///   score > 0.75  → TIER_2
///   score > 0.50  → TIER_3
///   otherwise     → TIER_4
/// ```
///
/// The cut points come from {@link TierThresholds}; the comparisons are
/// strict, so a score sitting exactly on a cut point falls to the lower tier.
/// The classifier is immutable and may be shared across threads.
public final class TierClassifier {

    private final TierThresholds thresholds;

    /// Creates a classifier with the default cut points.
    public TierClassifier() {
        this(new TierThresholds());
    }

    /// @param thresholds the cut points to apply
    public TierClassifier(TierThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds cannot be null").validate();
    }

    /// Classifies a match score.
    ///
    /// @param matchScore a score in [0, 1]
    /// @return the tier for the score
    /// @throws IllegalArgumentException if the score is NaN
    public Tier classify(double matchScore) {
        if (Double.isNaN(matchScore)) {
            throw new IllegalArgumentException("cannot classify a NaN match score");
        }
        if (matchScore > thresholds.tier1()) {
            return Tier.TIER_1;
        }
        if (matchScore > thresholds.tier2()) {
            return Tier.TIER_2;
        }
        if (matchScore > thresholds.tier3()) {
            return Tier.TIER_3;
        }
        return Tier.TIER_4;
    }

    public TierThresholds thresholds() {
        return thresholds;
    }
}
