package io.synthval.stats.config;

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

import com.google.gson.annotations.SerializedName;

/**
 * Match-score cut points of the tier classifier.
 *
 * <p>A score strictly above {@code tier_1} is TIER_1, strictly above
 * {@code tier_2} is TIER_2, strictly above {@code tier_3} is TIER_3, and
 * anything else is TIER_4.
 *
 * <pre>{@code
 * { "tier_1": 0.85, "tier_2": 0.75, "tier_3": 0.50 }
 * }</pre>
 */
public final class TierThresholds {

    public static final double DEFAULT_TIER_1 = 0.85;
    public static final double DEFAULT_TIER_2 = 0.75;
    public static final double DEFAULT_TIER_3 = 0.50;

    @SerializedName("tier_1")
    private double tier1 = DEFAULT_TIER_1;

    @SerializedName("tier_2")
    private double tier2 = DEFAULT_TIER_2;

    @SerializedName("tier_3")
    private double tier3 = DEFAULT_TIER_3;

    /**
     * Creates thresholds with the default cut points.
     */
    public TierThresholds() {
    }

    /**
     * Creates thresholds with custom cut points.
     *
     * @throws IllegalArgumentException if the cut points are not strictly decreasing within [0,1]
     */
    public TierThresholds(double tier1, double tier2, double tier3) {
        this.tier1 = tier1;
        this.tier2 = tier2;
        this.tier3 = tier3;
        validate();
    }

    /**
     * Checks that 1 ≥ tier_1 > tier_2 > tier_3 ≥ 0.
     *
     * @return this instance
     */
    public TierThresholds validate() {
        if (!(tier1 <= 1.0 && tier1 > tier2 && tier2 > tier3 && tier3 >= 0.0)) {
            throw new IllegalArgumentException(String.format(
                "tier thresholds must satisfy 1 >= tier_1 > tier_2 > tier_3 >= 0, got %s/%s/%s",
                tier1, tier2, tier3));
        }
        return this;
    }

    public double tier1() {
        return tier1;
    }

    public double tier2() {
        return tier2;
    }

    public double tier3() {
        return tier3;
    }

    @Override
    public String toString() {
        return "TierThresholds{" + tier1 + "/" + tier2 + "/" + tier3 + "}";
    }
}
