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

import io.nosqlbench.glm.links.IdentityLink;
import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.SqrtLink;
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.varfuncs.PowerVariance;
import org.apache.commons.math3.special.Gamma;

import java.util.Set;

/**
 * Poisson family for count responses, {@code V(mu) = mu}.
 *
 * <h2>Links</h2>
 *
 * <p>Accepts log (default, range-preserving), identity and sqrt.
 *
 * <h2>Deviance</h2>
 *
 * <pre>{@code
 * D = 2 * sum(w * y * log(y/mu)) / scale
 * }</pre>
 *
 * <p>This is the partial form without the {@code -(y - mu)} term of the
 * saturated-minus-fitted expansion. The two agree whenever
 * {@code sum(w * y) == sum(w * mu)}, which holds at the maximum likelihood
 * fit of a log-link model with an intercept. The deviance residuals do
 * include the term, so their squares sum to the deviance only in that case.
 *
 * <p>The ratio {@code y/mu} is clipped to at least machine epsilon before
 * taking logarithms, so zero counts contribute zero.
 */
public class Poisson extends Family {

    static final Set<Class<? extends Link>> ALLOWED_LINKS =
        Set.of(LogLink.class, IdentityLink.class, SqrtLink.class);
    static final Set<Class<? extends Link>> SAFE_LINKS = Set.of(LogLink.class);

    /**
     * Creates a Poisson family with the log link.
     */
    public Poisson() {
        this(new LogLink());
    }

    /**
     * Creates a Poisson family.
     *
     * @param link the link; must be log, identity or sqrt
     */
    public Poisson(Link link) {
        this("poisson", link);
    }

    Poisson(String name, Link link) {
        super(name, link, PowerVariance.mu(), MeanDomain.NON_NEGATIVE, ALLOWED_LINKS, SAFE_LINKS, LogLink.class);
    }

    @Override
    public double[] residDev(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            double unit = 2.0 * (y * Math.log(clippedRatio(y, m)) - (y - m));
            out[i] = Math.signum(y - m) * Math.sqrt(unit) / scale;
        }
        return out;
    }

    @Override
    public double deviance(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double sum = 0.0;
        for (int i = 0; i < endog.length; i++) {
            sum += endog[i] * freqWeights[i] * Math.log(clippedRatio(endog[i], mu[i]));
        }
        return 2.0 * sum / scale;
    }

    /**
     * Per-observation log-likelihood {@code scale * (y*log(mu) - mu - log(y!))}.
     *
     * @param endog the counts
     * @param mu the fitted means
     * @param scale the scale parameter
     * @return the log-likelihood of each observation
     */
    public double[] loglikeObs(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            out[i] = scale * (y * Math.log(mu[i]) - mu[i] - Gamma.logGamma(y + 1.0));
        }
        return out;
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        return FamilyArrays.weightedSum(loglikeObs(endog, mu, scale), freqWeights);
    }

    /**
     * Anscombe residuals {@code 1.5 * (y^(2/3) - mu^(2/3)) / mu^(1/6)}.
     */
    @Override
    public double[] residAnscombe(double[] endog, double[] mu) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            out[i] = 1.5 * (Math.pow(endog[i], 2.0 / 3.0) - Math.pow(mu[i], 2.0 / 3.0))
                / Math.pow(mu[i], 1.0 / 6.0);
        }
        return out;
    }
}
