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

/**
 * Natural log transform {@code eta = log(mu)}.
 *
 * <p>The transform and its derivatives clip the mean to at least machine
 * epsilon, so a zero mean maps to a large negative but finite predictor
 * and a finite slope.
 */
public class LogLink implements Link {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public double clip(double mu) {
        return Math.max(mu, FamilyArrays.FLOAT_EPS);
    }

    @Override
    public double link(double mu) {
        return Math.log(clip(mu));
    }

    @Override
    public double inverse(double eta) {
        return Math.exp(eta);
    }

    @Override
    public double deriv(double mu) {
        return 1.0 / clip(mu);
    }

    @Override
    public double deriv2(double mu) {
        double p = clip(mu);
        return -1.0 / (p * p);
    }

    @Override
    public double inverseDeriv(double eta) {
        return Math.exp(eta);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
