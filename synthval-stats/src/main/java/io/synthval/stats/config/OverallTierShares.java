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
 * Minimum shares of qualifying items that decide the overall tier.
 *
 * <pre>{@code
 * { "tier_1": 0.60, "tier_1_2": 0.40, "tier_1_3": 0.40 }
 * }</pre>
 *
 * <p>Shares are compared inclusively: TIER_1 when at least {@code tier_1} of
 * the items are TIER_1, else TIER_2 when at least {@code tier_1_2} are TIER_1
 * or TIER_2, else TIER_3 when at least {@code tier_1_3} are TIER_1..TIER_3,
 * else TIER_4.
 */
public final class OverallTierShares {

    public static final double DEFAULT_TIER_1 = 0.60;
    public static final double DEFAULT_TIER_1_2 = 0.40;
    public static final double DEFAULT_TIER_1_3 = 0.40;

    @SerializedName("tier_1")
    private double tier1 = DEFAULT_TIER_1;

    @SerializedName("tier_1_2")
    private double tier1To2 = DEFAULT_TIER_1_2;

    @SerializedName("tier_1_3")
    private double tier1To3 = DEFAULT_TIER_1_3;

    public OverallTierShares() {
    }

    public OverallTierShares(double tier1, double tier1To2, double tier1To3) {
        this.tier1 = tier1;
        this.tier1To2 = tier1To2;
        this.tier1To3 = tier1To3;
        validate();
    }

    /**
     * Checks that every share lies in (0, 1].
     *
     * @return this instance
     */
    public OverallTierShares validate() {
        for (double share : new double[]{tier1, tier1To2, tier1To3}) {
            if (!(share > 0.0 && share <= 1.0)) {
                throw new IllegalArgumentException("overall tier shares must lie in (0, 1], got " + share);
            }
        }
        return this;
    }

    public double tier1() {
        return tier1;
    }

    public double tier1To2() {
        return tier1To2;
    }

    public double tier1To3() {
        return tier1To3;
    }
}
