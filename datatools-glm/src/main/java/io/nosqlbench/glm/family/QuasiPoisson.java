package io.nosqlbench.glm.family;

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

import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.special.FamilyArrays;

/**
 * Quasi-Poisson family: Poisson mean-variance relation with a free dispersion.
 *
 * <p>Deviance, residuals, weights and links are those of {@link Poisson}.
 * The quasi-likelihood is not a true likelihood, so {@link #loglike} and
 * {@link #loglikeObs} return NaN. Callers read NaN as "not reported", not
 * as a failed evaluation.
 */
public class QuasiPoisson extends Poisson {

    public QuasiPoisson() {
        this(new LogLink());
    }

    public QuasiPoisson(Link link) {
        super("quasi_poisson", link);
    }

    @Override
    public double[] loglikeObs(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        return FamilyArrays.filled(endog.length, Double.NaN);
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        return Double.NaN;
    }
}
