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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierClassifierTest {

    private final TierClassifier classifier = new TierClassifier();

    @ParameterizedTest
    @CsvSource({
        "1.0, TIER_1", "0.8500001, TIER_1", "0.85, TIER_2", "0.76, TIER_2",
        "0.75, TIER_3", "0.5000001, TIER_3", "0.5, TIER_4", "0.0, TIER_4"
    })
    void cutPointsAreStrict(double score, Tier expected) {
        assertThat(classifier.classify(score)).isEqualTo(expected);
    }

    @Test
    void customThresholds() {
        TierClassifier strict = new TierClassifier(new TierThresholds(0.95, 0.9, 0.8));
        assertThat(strict.classify(0.92)).isEqualTo(Tier.TIER_2);
        assertThat(strict.classify(0.85)).isEqualTo(Tier.TIER_3);
    }

    @Test
    void rejectsNaN() {
        assertThatThrownBy(() -> classifier.classify(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnorderedThresholds() {
        assertThatThrownBy(() -> new TierThresholds(0.7, 0.8, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tiersAreOrdered() {
        assertThat(Tier.TIER_1.isAtLeast(Tier.TIER_2)).isTrue();
        assertThat(Tier.TIER_3.isAtLeast(Tier.TIER_2)).isFalse();
    }
}
