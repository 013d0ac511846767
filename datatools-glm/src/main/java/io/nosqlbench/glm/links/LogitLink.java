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

/**
 * Logistic transform {@code eta = log(p / (1 - p))}, the canonical Binomial link.
 */
public class LogitLink extends ProbabilityLink {

    @Override
    public String name() {
        return "logit";
    }

    @Override
    public double link(double mu) {
        double p = clip(mu);
        return Math.log(p / (1.0 - p));
    }

    @Override
    public double inverse(double eta) {
        return 1.0 / (1.0 + Math.exp(-eta));
    }

    @Override
    public double deriv(double mu) {
        double p = clip(mu);
        return 1.0 / (p * (1.0 - p));
    }

    @Override
    public double deriv2(double mu) {
        double p = clip(mu);
        double v = p * (1.0 - p);
        return (2.0 * p - 1.0) / (v * v);
    }

    @Override
    public double inverseDeriv(double eta) {
        double t = Math.exp(eta);
        return t / ((1.0 + t) * (1.0 + t));
    }
}
