package io.nosqlbench.glm.varfuncs;

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

/// Mean-to-variance relation of an exponential family.
///
/// ## Contract
///
/// - Pure elementwise function of the mean; any parameter (trial count,
///   dispersion) is fixed when the instance is constructed and never varies
///   per call.
/// - Results are fresh arrays of the same length as the input.
/// - A zero variance is returned as zero, not clamped, unless the
///   implementation documents its own clipping. Callers dividing by it
///   receive Inf/NaN.
///
/// ## Implementations
///
/// | Class | V(μ) |
/// |-------|------|
/// | [ConstantVariance] | 1 |
/// | [PowerVariance] | \|μ\|ᵖ |
/// | [BinomialVariance] | p(1-p)n with p = μ/n |
/// | [NegativeBinomialVariance] | μ + αμ² |
public interface VarianceFunction {

    /// Evaluates the variance at each mean.
    ///
    /// @param mu the means
    /// @return the variances
    double[] apply(double[] mu);

    /// Evaluates the derivative of the variance with respect to the mean.
    ///
    /// @param mu the means
    /// @return the derivatives
    double[] deriv(double[] mu);
}
