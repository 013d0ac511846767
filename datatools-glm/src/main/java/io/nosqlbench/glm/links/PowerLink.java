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

import java.util.Objects;

/**
 * Power transform {@code eta = mu^power}.
 *
 * <p>The named special cases are subclasses so that family link checks can
 * distinguish them: {@link IdentityLink} (1), {@link InversePowerLink} (-1),
 * {@link SqrtLink} (0.5) and {@link InverseSquaredLink} (-2).
 */
public class PowerLink implements Link {

    private final double power;
    private final String name;

    /**
     * Creates a power link.
     *
     * @param power the exponent; must be finite and non-zero (use {@link LogLink} for the limit)
     * @throws IllegalArgumentException if power is zero or not finite
     */
    public PowerLink(double power) {
        this(power, "power(" + power + ")");
    }

    protected PowerLink(double power, String name) {
        if (power == 0.0 || !Double.isFinite(power)) {
            throw new IllegalArgumentException("Power must be finite and non-zero, got: " + power);
        }
        this.power = power;
        this.name = name;
    }

    public double getPower() {
        return power;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double link(double mu) {
        return Math.pow(mu, power);
    }

    @Override
    public double inverse(double eta) {
        return Math.pow(eta, 1.0 / power);
    }

    @Override
    public double deriv(double mu) {
        return power * Math.pow(mu, power - 1);
    }

    @Override
    public double deriv2(double mu) {
        return power * (power - 1) * Math.pow(mu, power - 2);
    }

    @Override
    public double inverseDeriv(double eta) {
        return Math.pow(eta, 1.0 / power - 1) / power;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PowerLink that = (PowerLink) o;
        return Double.compare(that.power, power) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), power);
    }

    @Override
    public String toString() {
        return name;
    }
}
