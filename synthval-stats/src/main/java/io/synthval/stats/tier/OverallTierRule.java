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

import io.synthval.stats.config.OverallTierShares;
import io.synthval.stats.model.Tier;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Derives one overall tier from the tier distribution of qualifying items.
///
/// Tiers are walked best to worst, each step widening the set of accepted
/// tiers:
///
/// ```text
///   share(TIER_1)             ≥ 0.60  → TIER_1
///   share(TIER_1..TIER_2)     ≥ 0.40  → TIER_2
///   share(TIER_1..TIER_3)     ≥ 0.40  → TIER_3
///   otherwise                         → TIER_4
/// ```
///
/// With no qualifying items there is no overall tier.
public final class OverallTierRule {

    private final OverallTierShares shares;

    public OverallTierRule() {
        this(new OverallTierShares());
    }

    public OverallTierRule(OverallTierShares shares) {
        this.shares = Objects.requireNonNull(shares, "shares cannot be null").validate();
    }

    /// @param distribution number of qualifying items per tier; missing tiers count as 0
    /// @return the overall tier, or empty when the distribution holds no items
    public Optional<Tier> overallTier(Map<Tier, Integer> distribution) {
        int t1 = distribution.getOrDefault(Tier.TIER_1, 0);
        int t2 = distribution.getOrDefault(Tier.TIER_2, 0);
        int t3 = distribution.getOrDefault(Tier.TIER_3, 0);
        int t4 = distribution.getOrDefault(Tier.TIER_4, 0);
        int total = t1 + t2 + t3 + t4;
        if (total == 0) {
            return Optional.empty();
        }

        double n = total;
        if (t1 / n >= shares.tier1()) {
            return Optional.of(Tier.TIER_1);
        }
        if ((t1 + t2) / n >= shares.tier1To2()) {
            return Optional.of(Tier.TIER_2);
        }
        if ((t1 + t2 + t3) / n >= shares.tier1To3()) {
            return Optional.of(Tier.TIER_3);
        }
        return Optional.of(Tier.TIER_4);
    }
}
