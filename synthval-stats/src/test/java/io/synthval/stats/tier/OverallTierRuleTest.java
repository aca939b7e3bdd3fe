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
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OverallTierRuleTest {

    private final OverallTierRule rule = new OverallTierRule();

    private static Map<Tier, Integer> counts(int t1, int t2, int t3, int t4) {
        Map<Tier, Integer> map = new EnumMap<>(Tier.class);
        map.put(Tier.TIER_1, t1);
        map.put(Tier.TIER_2, t2);
        map.put(Tier.TIER_3, t3);
        map.put(Tier.TIER_4, t4);
        return map;
    }

    @Test
    void sixtyPercentTierOneIsTierOne() {
        assertThat(rule.overallTier(counts(3, 0, 0, 2))).contains(Tier.TIER_1);
        assertThat(rule.overallTier(counts(1, 0, 0, 0))).contains(Tier.TIER_1);
    }

    @Test
    void fortyPercentTierOneOrTwoIsTierTwo() {
        assertThat(rule.overallTier(counts(1, 1, 0, 3))).contains(Tier.TIER_2);
        assertThat(rule.overallTier(counts(2, 0, 0, 3))).contains(Tier.TIER_2);
    }

    @Test
    void fortyPercentUpToTierThreeIsTierThree() {
        assertThat(rule.overallTier(counts(1, 0, 1, 1))).contains(Tier.TIER_3);
        assertThat(rule.overallTier(counts(0, 0, 2, 3))).contains(Tier.TIER_3);
    }

    @Test
    void otherwiseTierFour() {
        assertThat(rule.overallTier(counts(0, 1, 0, 2))).contains(Tier.TIER_4);
        assertThat(rule.overallTier(counts(0, 0, 0, 4))).contains(Tier.TIER_4);
    }

    @Test
    void noItemsMeansNoTier() {
        assertThat(rule.overallTier(counts(0, 0, 0, 0))).isEmpty();
        assertThat(rule.overallTier(Map.of())).isEmpty();
    }

    @Test
    void customShares() {
        OverallTierRule lenient = new OverallTierRule(new OverallTierShares(0.3, 0.4, 0.4));
        assertThat(lenient.overallTier(counts(1, 0, 1, 1))).contains(Tier.TIER_1);
    }
}
