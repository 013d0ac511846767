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

import java.util.Arrays;

/**
 * Binomial variance {@code V(mu) = p(1-p)n} with {@code p = mu/n}.
 *
 * <p>The trial count is either a single value shared by all observations
 * or a per-observation array, fixed at construction. The proportion is
 * clamped into {@code [eps, 1-eps]}, so the variance never reaches zero.
 */
public final class BinomialVariance implements VarianceFunction {

    private final double n;
    private final double[] trials;

    /**
     * Creates a binomial variance with a shared trial count.
     *
     * @param n the number of trials; must be positive
     */
    public BinomialVariance(double n) {
        if (!(n > 0)) {
            throw new IllegalArgumentException("Trial count must be positive, got: " + n);
        }
        this.n = n;
        this.trials = null;
    }

    /**
     * Creates a binomial variance with per-observation trial counts.
     *
     * @param trials the trial count of each observation
     */
    public BinomialVariance(double[] trials) {
        if (trials == null || trials.length == 0) {
            throw new IllegalArgumentException("trials cannot be null or empty");
        }
        this.n = Double.NaN;
        this.trials = trials.clone();
    }

    /**
     * @return true when each observation carries its own trial count
     */
    public boolean isPerObservation() {
        return trials != null;
    }

    private double trialsAt(int i) {
        return trials == null ? n : trials[i];
    }

    private void checkLength(double[] mu) {
        if (trials != null && trials.length != mu.length) {
            throw new IllegalArgumentException(String.format(
                "mu length (%d) does not match trial count length (%d)", mu.length, trials.length));
        }
    }

    @Override
    public double[] apply(double[] mu) {
        checkLength(mu);
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            double ni = trialsAt(i);
            double p = FamilyArrays.clip(mu[i] / ni, FamilyArrays.FLOAT_EPS, 1.0 - FamilyArrays.FLOAT_EPS);
            out[i] = p * (1.0 - p) * ni;
        }
        return out;
    }

    @Override
    public double[] deriv(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = 1.0 - 2.0 * mu[i];
        }
        return out;
    }

    @Override
    public String toString() {
        return trials == null
            ? "BinomialVariance[n=" + n + "]"
            : "BinomialVariance[trials=" + Arrays.toString(trials) + "]";
    }
}
