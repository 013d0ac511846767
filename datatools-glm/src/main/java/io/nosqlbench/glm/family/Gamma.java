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
import io.nosqlbench.glm.links.InversePowerLink;
import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.varfuncs.PowerVariance;

import java.util.Set;

/**
 * Gamma family for positive continuous responses, {@code V(mu) = mu²}.
 *
 * <h2>Links</h2>
 *
 * <p>Accepts inverse_power (default, canonical), log (range-preserving) and identity.
 *
 * <h2>Formulas</h2>
 *
 * <pre>{@code
 * D        = 2 * sum(w * ((y - mu)/mu - log(y/mu)))
 * resid_i  = sign(y - mu) * sqrt(-2 * (-(y - mu)/mu + log(y/mu)))
 * llf      = -1/scale * sum(w * (y/mu + log(mu) + (scale-1) log(y) + log(scale) + scale lnΓ(1/scale)))
 * anscombe = 3 * (y^(1/3) - mu^(1/3)) / mu^(1/3)
 * }</pre>
 *
 * <p>Deviance and deviance residuals do not use the scale argument.
 */
public class Gamma extends Family {

    static final Set<Class<? extends Link>> ALLOWED_LINKS =
        Set.of(LogLink.class, IdentityLink.class, InversePowerLink.class);
    static final Set<Class<? extends Link>> SAFE_LINKS = Set.of(LogLink.class);

    public Gamma() {
        this(new InversePowerLink());
    }

    /**
     * @param link the link; must be inverse_power, log or identity
     */
    public Gamma(Link link) {
        super("gamma", link, PowerVariance.muSquared(), MeanDomain.NON_NEGATIVE, ALLOWED_LINKS, SAFE_LINKS,
            InversePowerLink.class);
    }

    @Override
    public double deviance(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double sum = 0.0;
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            sum += freqWeights[i] * ((y - m) / m - Math.log(clippedRatio(y, m)));
        }
        return 2.0 * sum;
    }

    @Override
    public double[] residDev(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            out[i] = Math.signum(y - m) * Math.sqrt(-2.0 * (-(y - m) / m + Math.log(clippedRatio(y, m))));
        }
        return out;
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double constant = Math.log(scale) + scale * org.apache.commons.math3.special.Gamma.logGamma(1.0 / scale);
        double sum = 0.0;
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            sum += (y / m + Math.log(m) + (scale - 1.0) * Math.log(y) + constant) * freqWeights[i];
        }
        return -1.0 / scale * sum;
    }

    @Override
    public double[] residAnscombe(double[] endog, double[] mu) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double cubeMu = Math.pow(mu[i], 1.0 / 3.0);
            out[i] = 3.0 * (Math.pow(endog[i], 1.0 / 3.0) - cubeMu) / cubeMu;
        }
        return out;
    }
}
