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

/**
 * Power variance {@code V(mu) = |mu|^power}.
 *
 * <p>{@link #mu()} is the Poisson variance and {@link #muSquared()} the Gamma variance.
 */
public final class PowerVariance implements VarianceFunction {

    private final double power;

    public PowerVariance(double power) {
        if (!Double.isFinite(power)) {
            throw new IllegalArgumentException("Power must be finite, got: " + power);
        }
        this.power = power;
    }

    /**
     * @return the variance {@code V(mu) = mu}
     */
    public static PowerVariance mu() {
        return new PowerVariance(1.0);
    }

    /**
     * @return the variance {@code V(mu) = mu^2}
     */
    public static PowerVariance muSquared() {
        return new PowerVariance(2.0);
    }

    public double getPower() {
        return power;
    }

    @Override
    public double[] apply(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = Math.pow(Math.abs(mu[i]), power);
        }
        return out;
    }

    @Override
    public double[] deriv(double[] mu) {
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            double d = power * Math.pow(Math.abs(mu[i]), power - 1);
            out[i] = mu[i] < 0 ? -d : d;
        }
        return out;
    }

    @Override
    public String toString() {
        return "PowerVariance[power=" + power + "]";
    }
}
