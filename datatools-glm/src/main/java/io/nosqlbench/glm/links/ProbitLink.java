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

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Standard normal quantile transform {@code eta = Φ⁻¹(p)}.
 */
public class ProbitLink extends CDFLink {

    public ProbitLink() {
        super(new NormalDistribution(0.0, 1.0));
    }

    @Override
    public String name() {
        return "probit";
    }

    @Override
    public double deriv2(double mu) {
        double eta = link(mu);
        double pdf = distribution().density(eta);
        return eta / (pdf * pdf);
    }
}
