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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Response counts per answer option for one question.
 *
 * <p>Option order is the insertion order of the source map. Counts must be
 * finite and non-negative; fractional counts (weighted responses) are allowed.
 */
public final class OptionCounts implements ResponseSet {

    private static final OptionCounts EMPTY = new OptionCounts(Collections.emptyMap());

    private final Map<String, Double> counts;

    private OptionCounts(Map<String, Double> counts) {
        this.counts = counts;
    }

    /**
     * Creates option counts from a label to count map.
     *
     * @param counts option label to count
     * @return an immutable copy
     * @throws IllegalArgumentException if a count is negative or not finite
     */
    public static OptionCounts of(Map<String, ? extends Number> counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> e : counts.entrySet()) {
            String label = Objects.requireNonNull(e.getKey(), "option label cannot be null");
            double value = Objects.requireNonNull(e.getValue(), "count for option '" + label + "' cannot be null")
                .doubleValue();
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(
                    "count for option '" + label + "' must be finite and non-negative, got " + value);
            }
            copy.put(label, value);
        }
        return new OptionCounts(Collections.unmodifiableMap(copy));
    }

    /**
     * Creates option counts labelled "1".."n" from a plain count vector.
     *
     * @param counts counts in option order
     * @return option counts keyed by 1-based position
     */
    public static OptionCounts ofVector(double... counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            map.put(String.valueOf(i + 1), counts[i]);
        }
        return of(map);
    }

    /**
     * Empty option counts.
     */
    public static OptionCounts empty() {
        return EMPTY;
    }

    /**
     * @return the counts, in option order
     */
    public Map<String, Double> counts() {
        return counts;
    }

    /**
     * @param label option label
     * @return the count for the label, 0 if absent
     */
    public double count(String label) {
        return counts.getOrDefault(label, 0.0);
    }

    /**
     * @return sum of all counts
     */
    public double total() {
        double total = 0;
        for (double v : counts.values()) {
            total += v;
        }
        return total;
    }

    /**
     * Union of option labels, this set's labels first, then labels only the
     * other set has, each in its own insertion order.
     *
     * @param other the opposite side of the comparison
     * @return ordered label union
     */
    public List<String> unionLabels(OptionCounts other) {
        Set<String> labels = new LinkedHashSet<>(counts.keySet());
        labels.addAll(other.counts.keySet());
        return new ArrayList<>(labels);
    }

    /**
     * Counts for the given labels, 0 for labels this set lacks.
     *
     * @param labels labels in the desired order
     * @return aligned count vector
     */
    public double[] vector(List<String> labels) {
        double[] v = new double[labels.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = count(labels.get(i));
        }
        return v;
    }

    /**
     * A copy without the given labels.
     *
     * @param labels upper-case labels to drop, matched case-insensitively
     * @return filtered option counts
     */
    public OptionCounts without(Set<String> labels) {
        Map<String, Double> kept = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : counts.entrySet()) {
            if (!labels.contains(e.getKey().toUpperCase(Locale.ROOT))) {
                kept.put(e.getKey(), e.getValue());
            }
        }
        return new OptionCounts(Collections.unmodifiableMap(kept));
    }

    @Override
    public int size() {
        return counts.size();
    }

    @Override
    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @Override
    public String kind() {
        return "categorical";
    }

    @Override
    public ResponseSet emptyOfSameKind() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionCounts that)) return false;
        return counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "OptionCounts" + counts;
    }
}
