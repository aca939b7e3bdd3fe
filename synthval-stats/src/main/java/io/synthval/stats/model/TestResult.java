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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one statistical comparison.
 *
 * <p>A result is either <em>scored</em> (native statistics, a match score in
 * [0,1] and its tier) or <em>failed</em> (an error message and nothing else).
 * The two shapes are mutually exclusive; use {@link #isScored()} to tell them
 * apart.
 *
 * @param test test identifier, e.g. {@code chi_square}
 * @param statistics native statistics in insertion order, empty for a failed result
 * @param matchScore normalized similarity, null for a failed result
 * @param tier tier of the match score, null for a failed result
 * @param error failure description, null for a scored result
 */
public record TestResult(
    String test,
    Map<String, Double> statistics,
    Double matchScore,
    Tier tier,
    String error
) {

    public TestResult {
        Objects.requireNonNull(test, "test cannot be null");
        statistics = statistics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        if (error != null) {
            if (matchScore != null || tier != null) {
                throw new IllegalArgumentException("a failed result carries no score or tier: " + test);
            }
        } else {
            if (matchScore == null || tier == null) {
                throw new IllegalArgumentException("a scored result needs both score and tier: " + test);
            }
            if (matchScore < 0.0 || matchScore > 1.0) {
                throw new IllegalArgumentException("match score out of [0,1] for " + test + ": " + matchScore);
            }
        }
    }

    /**
     * Creates a scored result.
     */
    public static TestResult scored(String test, Map<String, Double> statistics, double matchScore, Tier tier) {
        return new TestResult(test, statistics, matchScore, Objects.requireNonNull(tier, "tier"), null);
    }

    /**
     * Creates a failed result.
     */
    public static TestResult failed(String test, String error) {
        return new TestResult(test, Map.of(), null, null, Objects.requireNonNull(error, "error"));
    }

    /**
     * @return true if this result carries a match score
     */
    public boolean isScored() {
        return error == null;
    }

    /**
     * @param name statistic key
     * @return the statistic, or null when this result does not report it
     */
    public Double statistic(String name) {
        return statistics.get(name);
    }
}
