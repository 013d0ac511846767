package io.nosqlbench.glm.special;

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
import java.util.Objects;

/// Elementwise array helpers shared by the family, link and variance code.
///
/// All methods allocate fresh result arrays; inputs are never modified.
public final class FamilyArrays {

    /// Machine epsilon for doubles, the floor used when clipping ratios away from zero.
    public static final double FLOAT_EPS = Math.ulp(1.0);

    private FamilyArrays() {
    }

    /// Returns an array of `length` ones.
    ///
    /// @param length the array length
    /// @return a new array filled with 1.0
    public static double[] ones(int length) {
        return filled(length, 1.0);
    }

    /// Returns an array of `length` copies of `value`.
    ///
    /// @param length the array length
    /// @param value the fill value
    /// @return a new filled array
    public static double[] filled(int length, double value) {
        double[] out = new double[length];
        Arrays.fill(out, value);
        return out;
    }

    /// Clamps `x` into `[lower, upper]`. NaN passes through unchanged.
    ///
    /// @param x the value
    /// @param lower the lower bound
    /// @param upper the upper bound
    /// @return the clamped value
    public static double clip(double x, double lower, double upper) {
        if (x < lower) {
            return lower;
        }
        if (x > upper) {
            return upper;
        }
        return x;
    }

    /// Computes `sum(values[i] * weights[i])`.
    ///
    /// @param values the values
    /// @param weights the weights; must match `values` in length
    /// @return the weighted sum
    public static double weightedSum(double[] values, double[] weights) {
        requireSameLength(values, weights, "weights");
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
        }
        return sum;
    }

    /// Computes the plain sum of `values`.
    ///
    /// @param values the values
    /// @return the sum
    public static double sum(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    /// Computes the arithmetic mean of `values`.
    ///
    /// @param values the values; must not be empty
    /// @return the mean
    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
        return sum(values) / values.length;
    }

    /// Checks that `other` is non-null and has the same length as `reference`.
    ///
    /// @param reference the reference array
    /// @param other the array to check
    /// @param name the name of `other` used in error messages
    /// @throws IllegalArgumentException if the lengths differ
    public static void requireSameLength(double[] reference, double[] other, String name) {
        Objects.requireNonNull(reference, "reference cannot be null");
        Objects.requireNonNull(other, name + " cannot be null");
        if (reference.length != other.length) {
            throw new IllegalArgumentException(String.format(
                "%s length (%d) does not match observation count (%d)",
                name, other.length, reference.length));
        }
    }
}
