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
 * Complementary log-log transform {@code eta = log(-log(1 - p))}.
 */
public class CLogLogLink extends ProbabilityLink {

    @Override
    public String name() {
        return "cloglog";
    }

    @Override
    public double link(double mu) {
        double p = clip(mu);
        return Math.log(-Math.log1p(-p));
    }

    @Override
    public double inverse(double eta) {
        return -Math.expm1(-Math.exp(eta));
    }

    @Override
    public double deriv(double mu) {
        double p = clip(mu);
        return 1.0 / ((p - 1.0) * Math.log1p(-p));
    }

    @Override
    public double deriv2(double mu) {
        double p = clip(mu);
        double fl = Math.log1p(-p);
        double d2 = -1.0 / ((1.0 - p) * (1.0 - p) * fl);
        return d2 * (1.0 + 1.0 / fl);
    }

    @Override
    public double inverseDeriv(double eta) {
        return Math.exp(eta - Math.exp(eta));
    }
}
