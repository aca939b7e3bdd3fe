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

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * An ordered sequence of numeric observations (ratings, totals, scores).
 *
 * <p>Values are copied on the way in and on the way out, so an instance can be
 * shared between concurrent validation runs.
 */
public final class NumericResponses implements ResponseSet {

    private static final NumericResponses EMPTY = new NumericResponses(new double[0]);

    private final double[] values;

    private NumericResponses(double[] values) {
        this.values = values;
    }

    /**
     * Creates a response set from the given observations.
     *
     * @param values observations; any real number is allowed
     * @return a response set holding a copy of the values
     * @throws IllegalArgumentException if a value is NaN or infinite
     */
    public static NumericResponses of(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("numeric responses must be finite, got " + v);
            }
        }
        return new NumericResponses(values.clone());
    }

    /**
     * Creates a response set from boxed observations.
     *
     * @param values observations, none null
     * @return a response set holding the values in iteration order
     */
    public static NumericResponses of(Collection<? extends Number> values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[] copy = new double[values.size()];
        int i = 0;
        for (Number n : values) {
            copy[i++] = Objects.requireNonNull(n, "numeric response cannot be null").doubleValue();
        }
        return of(copy);
    }

    /**
     * An empty numeric response set.
     */
    public static NumericResponses empty() {
        return EMPTY;
    }

    /**
     * @return a copy of the observations
     */
    public double[] values() {
        return values.clone();
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isEmpty() {
        return values.length == 0;
    }

    @Override
    public String kind() {
        return "numeric";
    }

    @Override
    public ResponseSet emptyOfSameKind() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericResponses that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "NumericResponses" + Arrays.toString(values);
    }
}
