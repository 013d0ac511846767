package io.nosqlbench.glm.links;

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

/// Invertible, differentiable transform between the mean response and the
/// linear predictor of a generalized linear model.
///
/// ## Contract
///
/// ```
///        link(mu)                 inverse(eta)
///   mu ───────────► eta      eta ─────────────► mu
///
///   inverse(link(mu)) == mu   (floating-point tolerance, over the
///                              owning family's valid mean range)
/// ```
///
/// Implementations are stateless apart from construction-time parameters
/// (power, alpha) and are safe to share across threads.
///
/// The scalar methods define the transform; the array overloads apply them
/// elementwise and always return a new array.
///
/// ## Implementations
///
/// | Link | Transform | Typical family |
/// |------|-----------|----------------|
/// | [LogitLink] | log(p/(1-p)) | Binomial |
/// | [ProbitLink] | Φ⁻¹(p) | Binomial |
/// | [CauchyLink] | tan(π(p-½)) | Binomial |
/// | [CLogLogLink] | log(-log(1-p)) | Binomial |
/// | [LogLink] | log(μ) | Poisson, Gamma, NegativeBinomial |
/// | [PowerLink] | μᵖ | Gaussian, Gamma, Poisson |
/// | [NegativeBinomialLink] | log(μ/(μ+1/α)) | NegativeBinomial |
public interface Link {

    /// Short identifier used by configuration, e.g. `logit` or `power(2.0)`.
    ///
    /// @return the link name
    String name();

    /// Forward transform of a mean value.
    ///
    /// @param mu the mean
    /// @return the linear predictor
    double link(double mu);

    /// Inverse transform of a linear predictor.
    ///
    /// @param eta the linear predictor
    /// @return the mean
    double inverse(double eta);

    /// First derivative of the forward transform, `d eta / d mu`.
    ///
    /// @param mu the mean
    /// @return the derivative
    double deriv(double mu);

    /// Second derivative of the forward transform.
    ///
    /// @param mu the mean
    /// @return the second derivative
    double deriv2(double mu);

    /// Derivative of the inverse transform, `d mu / d eta`.
    ///
    /// @param eta the linear predictor
    /// @return the derivative
    default double inverseDeriv(double eta) {
        return 1.0 / deriv(inverse(eta));
    }

    /// Clamps a mean into the numerically safe domain of this link.
    ///
    /// The default is the identity; probability links clamp away from 0 and 1.
    ///
    /// @param mu the mean
    /// @return the clamped mean
    default double clip(double mu) {
        return mu;
    }

    default double[] link(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = link(mu[i]);
        }
        return out;
    }

    default double[] inverse(double[] eta) {
        double[] out = new double[eta.length];
        for (int i = 0; i < eta.length; i++) {
            out[i] = inverse(eta[i]);
        }
        return out;
    }

    default double[] deriv(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = deriv(mu[i]);
        }
        return out;
    }

    default double[] deriv2(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = deriv2(mu[i]);
        }
        return out;
    }

    default double[] inverseDeriv(double[] eta) {
        double[] out = new double[eta.length];
        for (int i = 0; i < eta.length; i++) {
            out[i] = inverseDeriv(eta[i]);
        }
        return out;
    }

    default double[] clip(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = clip(mu[i]);
        }
        return out;
    }
}
