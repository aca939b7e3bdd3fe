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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable tuning constants of the comparison engine.
 *
 * <h2>Purpose</h2>
 *
 * <p>The tier cut points and the transforms that turn unbounded statistics
 * into match scores are calibration choices, not fixed behavior. This class
 * gathers them so they can be loaded from a file and handed to
 * {@link io.synthval.stats.ValidationEngine}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "tier_thresholds": { "tier_1": 0.85, "tier_2": 0.75, "tier_3": 0.50 },
 *   "overall_tier_shares": { "tier_1": 0.60, "tier_1_2": 0.40, "tier_1_3": 0.40 },
 *   "max_histogram_bins": 10,
 *   "kl_epsilon": 1e-10,
 *   "kl_bin_pseudo_count": 0.5,
 *   "anderson_darling_scale": 5.0,
 *   "cramer_von_mises_scale": 2.0,
 *   "min_correlation_pairs": 3
 * }
 * }</pre>
 *
 * <p>Every key is optional; absent keys keep their defaults.
 *
 * <p>{@code kl_epsilon} floors empty categories of option counts. On raw
 * samples a bin occupied by one side only would be floored the same way and
 * dominate the divergence, so binned samples are smoothed first by adding
 * {@code kl_bin_pseudo_count} to every bin of both histograms.
 */
public final class ValidationConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("tier_thresholds")
    private TierThresholds tierThresholds = new TierThresholds();

    @SerializedName("overall_tier_shares")
    private OverallTierShares overallTierShares = new OverallTierShares();

    @SerializedName("max_histogram_bins")
    private int maxHistogramBins = 10;

    @SerializedName("kl_epsilon")
    private double klEpsilon = 1e-10;

    @SerializedName("kl_bin_pseudo_count")
    private double klBinPseudoCount = 0.5;

    @SerializedName("anderson_darling_scale")
    private double andersonDarlingScale = 5.0;

    @SerializedName("cramer_von_mises_scale")
    private double cramerVonMisesScale = 2.0;

    @SerializedName("min_correlation_pairs")
    private int minCorrelationPairs = 3;

    private ValidationConfig() {
    }

    /**
     * @return a configuration with every default
     */
    public static ValidationConfig defaults() {
        return new ValidationConfig();
    }

    /**
     * Parses a configuration from JSON text.
     *
     * @param json the JSON document
     * @return the validated configuration
     * @throws IllegalArgumentException if the document is malformed or a value is out of range
     */
    public static ValidationConfig fromJson(String json) {
        try {
            ValidationConfig config = GSON.fromJson(json, ValidationConfig.class);
            return (config == null ? defaults() : config).validate();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid validation config: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static ValidationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ValidationConfig config = GSON.fromJson(reader, ValidationConfig.class);
            return (config == null ? defaults() : config).validate();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid validation config " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * A copy with different tier thresholds.
     *
     * @param thresholds the new cut points
     * @return a new configuration
     */
    public ValidationConfig withTierThresholds(TierThresholds thresholds) {
        ValidationConfig copy = copy();
        copy.tierThresholds = thresholds.validate();
        return copy;
    }

    /**
     * @return this configuration as pretty-printed JSON
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    private ValidationConfig copy() {
        return GSON.fromJson(GSON.toJson(this), ValidationConfig.class);
    }

    private ValidationConfig validate() {
        if (tierThresholds == null) tierThresholds = new TierThresholds();
        if (overallTierShares == null) overallTierShares = new OverallTierShares();
        tierThresholds.validate();
        overallTierShares.validate();
        if (maxHistogramBins < 2) {
            throw new IllegalArgumentException("max_histogram_bins must be at least 2, got " + maxHistogramBins);
        }
        if (!(klEpsilon > 0 && klEpsilon < 1e-3)) {
            throw new IllegalArgumentException("kl_epsilon must lie in (0, 1e-3), got " + klEpsilon);
        }
        if (!(klBinPseudoCount >= 0) || Double.isInfinite(klBinPseudoCount)) {
            throw new IllegalArgumentException("kl_bin_pseudo_count must be finite and non-negative, got "
                + klBinPseudoCount);
        }
        if (!(andersonDarlingScale > 0) || !(cramerVonMisesScale > 0)) {
            throw new IllegalArgumentException("statistic scales must be positive");
        }
        if (minCorrelationPairs < 2) {
            throw new IllegalArgumentException("min_correlation_pairs must be at least 2, got " + minCorrelationPairs);
        }
        return this;
    }

    public TierThresholds tierThresholds() {
        return tierThresholds;
    }

    public OverallTierShares overallTierShares() {
        return overallTierShares;
    }

    public int maxHistogramBins() {
        return maxHistogramBins;
    }

    public double klEpsilon() {
        return klEpsilon;
    }

    public double klBinPseudoCount() {
        return klBinPseudoCount;
    }

    public double andersonDarlingScale() {
        return andersonDarlingScale;
    }

    public double cramerVonMisesScale() {
        return cramerVonMisesScale;
    }

    public int minCorrelationPairs() {
        return minCorrelationPairs;
    }
}
