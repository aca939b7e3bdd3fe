package io.synthval.stats.battery;

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

/**
 * Raw output of a statistical comparison before tiering.
 *
 * @param statistics native statistics in report order
 * @param matchScore similarity normalized to [0, 1], before clamping
 */
public record Measurement(Map<String, Double> statistics, double matchScore) {

    public Measurement {
        statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    /**
     * Creates a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder collecting statistics in the order they are added.
     */
    public static final class Builder {
        private final Map<String, Double> statistics = new LinkedHashMap<>();
        private double matchScore = Double.NaN;

        private Builder() {
        }

        public Builder stat(String name, double value) {
            statistics.put(name, value);
            return this;
        }

        public Builder stats(Map<String, Double> values) {
            statistics.putAll(values);
            return this;
        }

        public Builder score(double matchScore) {
            this.matchScore = matchScore;
            return this;
        }

        public Measurement build() {
            return new Measurement(statistics, matchScore);
        }
    }
}
