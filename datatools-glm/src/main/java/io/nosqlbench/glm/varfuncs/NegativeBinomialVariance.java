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

import io.nosqlbench.glm.special.FamilyArrays;

/**
 * Negative Binomial variance {@code V(mu) = mu + alpha * mu^2}.
 *
 * <p>The mean is clipped to at least machine epsilon before evaluation.
 */
public final class NegativeBinomialVariance implements VarianceFunction {

    private final double alpha;

    /**
     * @param alpha the dispersion parameter; must be positive
     */
    public NegativeBinomialVariance(double alpha) {
        if (!(alpha > 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("Alpha must be positive and finite, got: " + alpha);
        }
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public double[] apply(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            double p = Math.max(mu[i], FamilyArrays.FLOAT_EPS);
            out[i] = p + alpha * p * p;
        }
        return out;
    }

    @Override
    public double[] deriv(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            double p = Math.max(mu[i], FamilyArrays.FLOAT_EPS);
            out[i] = 1.0 + 2.0 * alpha * p;
        }
        return out;
    }

    @Override
    public String toString() {
        return "NegativeBinomialVariance[alpha=" + alpha + "]";
    }
}
