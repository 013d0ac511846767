package io.nosqlbench.glm.family;

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

/// Closed interval of permissible mean values for a family.
///
/// @param lower the lower bound, possibly negative infinity
/// @param upper the upper bound, possibly positive infinity
public record MeanDomain(double lower, double upper) {

    /// Unrestricted domain of the Gaussian family.
    public static final MeanDomain REAL_LINE = new MeanDomain(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    /// Domain of the count and positive-continuous families.
    public static final MeanDomain NON_NEGATIVE = new MeanDomain(0.0, Double.POSITIVE_INFINITY);

    /// Domain of the Binomial proportion.
    public static final MeanDomain UNIT_INTERVAL = new MeanDomain(0.0, 1.0);

    /// Validates the bounds.
    ///
    /// @param lower the lower bound
    /// @param upper the upper bound
    public MeanDomain {
        if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
            throw new IllegalArgumentException("Invalid mean domain [" + lower + ", " + upper + "]");
        }
    }

    /// Tests whether `mu` lies inside the interval.
    ///
    /// @param mu the mean
    /// @return true if `lower <= mu <= upper`
    public boolean contains(double mu) {
        return mu >= lower && mu <= upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
