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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationConfigTest {

    @Test
    void defaults() {
        ValidationConfig config = ValidationConfig.defaults();
        assertThat(config.tierThresholds().tier1()).isEqualTo(0.85);
        assertThat(config.tierThresholds().tier2()).isEqualTo(0.75);
        assertThat(config.tierThresholds().tier3()).isEqualTo(0.50);
        assertThat(config.overallTierShares().tier1()).isEqualTo(0.60);
        assertThat(config.maxHistogramBins()).isEqualTo(10);
        assertThat(config.klEpsilon()).isEqualTo(1e-10);
        assertThat(config.klBinPseudoCount()).isEqualTo(0.5);
        assertThat(config.minCorrelationPairs()).isEqualTo(3);
    }

    @Test
    void partialDocumentKeepsDefaults() {
        ValidationConfig config = ValidationConfig.fromJson(
            "{\"tier_thresholds\": {\"tier_1\": 0.9}, \"max_histogram_bins\": 20}");
        assertThat(config.tierThresholds().tier1()).isEqualTo(0.9);
        assertThat(config.tierThresholds().tier2()).isEqualTo(0.75);
        assertThat(config.maxHistogramBins()).isEqualTo(20);
        assertThat(config.andersonDarlingScale()).isEqualTo(5.0);
    }

    @Test
    void emptyDocumentIsDefaults() {
        assertThat(ValidationConfig.fromJson("{}").toJson()).isEqualTo(ValidationConfig.defaults().toJson());
    }

    @Test
    void rejectsUnorderedThresholds() {
        assertThatThrownBy(() -> ValidationConfig.fromJson("{\"tier_thresholds\": {\"tier_2\": 0.9}}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tier_1 > tier_2");
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> ValidationConfig.fromJson("{\"max_histogram_bins\": 1}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValidationConfig.fromJson("{\"kl_epsilon\": 0}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValidationConfig.fromJson("{\"kl_bin_pseudo_count\": -1}"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> ValidationConfig.fromJson("{\"kl_epsilon\": "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("invalid validation config");
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"overall_tier_shares\": {\"tier_1\": 0.7}}", StandardCharsets.UTF_8);
        ValidationConfig config = ValidationConfig.load(file);
        assertThat(config.overallTierShares().tier1()).isEqualTo(0.7);
        assertThat(config.overallTierShares().tier1To2()).isEqualTo(0.40);
    }

    @Test
    void withTierThresholdsLeavesOriginalUntouched() {
        ValidationConfig base = ValidationConfig.defaults();
        ValidationConfig strict = base.withTierThresholds(new TierThresholds(0.95, 0.9, 0.8));
        assertThat(strict.tierThresholds().tier1()).isEqualTo(0.95);
        assertThat(base.tierThresholds().tier1()).isEqualTo(0.85);
    }

    @Test
    void jsonRoundTrip() {
        ValidationConfig config = ValidationConfig.fromJson("{\"cramer_von_mises_scale\": 3.5}");
        ValidationConfig reread = ValidationConfig.fromJson(config.toJson());
        assertThat(reread.cramerVonMisesScale()).isEqualTo(3.5);
        assertThat(reread.toJson()).isEqualTo(config.toJson());
    }
}
