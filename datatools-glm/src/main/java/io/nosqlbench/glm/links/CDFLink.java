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

import org.apache.commons.math3.distribution.RealDistribution;

/**
 * Link defined by the quantile function of a continuous distribution,
 * {@code eta = F⁻¹(p)}, with {@code mu = F(eta)}.
 *
 * <p>The second derivative defaults to a central difference of
 * {@link #deriv(double)}; subclasses with a closed form override it.
 */
public abstract class CDFLink extends ProbabilityLink {

    private static final double STEP = 1e-6;

    private final RealDistribution distribution;

    protected CDFLink(RealDistribution distribution) {
        this.distribution = distribution;
    }

    protected RealDistribution distribution() {
        return distribution;
    }

    @Override
    public double link(double mu) {
        return distribution.inverseCumulativeProbability(clip(mu));
    }

    @Override
    public double inverse(double eta) {
        return distribution.cumulativeProbability(eta);
    }

    @Override
    public double deriv(double mu) {
        double p = clip(mu);
        return 1.0 / distribution.density(distribution.inverseCumulativeProbability(p));
    }

    @Override
    public double deriv2(double mu) {
        double p = clip(mu);
        double h = Math.min(STEP, Math.min(p, 1.0 - p) / 2.0);
        return (deriv(p + h) - deriv(p - h)) / (2.0 * h);
    }

    @Override
    public double inverseDeriv(double eta) {
        return distribution.density(eta);
    }
}
