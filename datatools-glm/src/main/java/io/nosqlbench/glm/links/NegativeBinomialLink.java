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

import io.nosqlbench.glm.special.FamilyArrays;

import java.util.Objects;

/**
 * Canonical Negative Binomial transform {@code eta = log(mu / (mu + 1/alpha))}.
 *
 * <p>The linear predictor is always negative; its inverse is
 * {@code mu = -1 / (alpha * (1 - exp(-eta)))}.
 */
public class NegativeBinomialLink implements Link {

    private final double alpha;

    public NegativeBinomialLink() {
        this(1.0);
    }

    /**
     * @param alpha the dispersion parameter; must be positive
     */
    public NegativeBinomialLink(double alpha) {
        if (!(alpha > 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("Alpha must be positive and finite, got: " + alpha);
        }
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public String name() {
        return "nbinom(" + alpha + ")";
    }

    @Override
    public double clip(double mu) {
        return Math.max(mu, FamilyArrays.FLOAT_EPS);
    }

    @Override
    public double link(double mu) {
        double p = clip(mu);
        return Math.log(p / (p + 1.0 / alpha));
    }

    @Override
    public double inverse(double eta) {
        return -1.0 / (alpha * (1.0 - Math.exp(-eta)));
    }

    @Override
    public double deriv(double mu) {
        return 1.0 / (mu + alpha * mu * mu);
    }

    @Override
    public double deriv2(double mu) {
        double denom = mu + alpha * mu * mu;
        return -(1.0 + 2.0 * alpha * mu) / (denom * denom);
    }

    @Override
    public double inverseDeriv(double eta) {
        double t = Math.exp(eta);
        return t / (alpha * (1.0 - t) * (1.0 - t));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NegativeBinomialLink)) return false;
        NegativeBinomialLink that = (NegativeBinomialLink) o;
        return Double.compare(that.alpha, alpha) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(NegativeBinomialLink.class, alpha);
    }

    @Override
    public String toString() {
        return name();
    }
}
