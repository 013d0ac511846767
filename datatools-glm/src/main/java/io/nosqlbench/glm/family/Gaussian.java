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
import io.nosqlbench.glm.links.PowerLink;
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.varfuncs.ConstantVariance;

import java.util.Set;

/**
 * Gaussian family with constant variance.
 *
 * <h2>Links</h2>
 *
 * <p>Accepts identity (default), log and inverse_power; all are treated as safe
 * because the mean is unrestricted.
 *
 * <h2>Log-likelihood</h2>
 *
 * <p>Under a power link with exponent 1 the concentrated least-squares
 * likelihood is used, which does not depend on the scale:
 *
 * <pre>{@code
 * llf = -n/2 * log(SSR) - n/2 * (1 + log(2π/n))
 * }</pre>
 *
 * <p>where {@code SSR = sum((y - fitted(mu))^2)}. Frequency weights do not
 * enter this branch. Any other link uses the exponential-family form
 * {@code sum(w * ((y*mu - mu²/2)/scale - y²/(2 scale) - log(2π scale)/2))}.
 */
public class Gaussian extends Family {

    static final Set<Class<? extends Link>> ALLOWED_LINKS =
        Set.of(LogLink.class, IdentityLink.class, InversePowerLink.class);

    public Gaussian() {
        this(new IdentityLink());
    }

    /**
     * @param link the link; must be identity, log or inverse_power
     */
    public Gaussian(Link link) {
        super("gaussian", link, new ConstantVariance(), MeanDomain.REAL_LINE, ALLOWED_LINKS, ALLOWED_LINKS,
            IdentityLink.class);
    }

    @Override
    public double[] residDev(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        double[] var = variance().apply(mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            out[i] = (endog[i] - mu[i]) / Math.sqrt(var[i]) / scale;
        }
        return out;
    }

    @Override
    public double deviance(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double sum = 0.0;
        for (int i = 0; i < endog.length; i++) {
            double r = endog[i] - mu[i];
            sum += freqWeights[i] * r * r;
        }
        return sum / scale;
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        if (isUnitPower(link())) {
            double nobs2 = endog.length / 2.0;
            double[] fits = fitted(mu);
            double ssr = 0.0;
            for (int i = 0; i < endog.length; i++) {
                double r = endog[i] - fits[i];
                ssr += r * r;
            }
            double llf = -Math.log(ssr) * nobs2;
            llf -= (1.0 + Math.log(Math.PI / nobs2)) * nobs2;
            return llf;
        }
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double sum = 0.0;
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            sum += freqWeights[i] * ((y * m - m * m / 2.0) / scale
                - y * y / (2.0 * scale)
                - 0.5 * Math.log(2.0 * Math.PI * scale));
        }
        return sum;
    }

    private static boolean isUnitPower(Link link) {
        return link instanceof PowerLink && ((PowerLink) link).getPower() == 1.0;
    }

    /**
     * Gaussian residuals are already variance-stabilized: {@code y - mu}.
     */
    @Override
    public double[] residAnscombe(double[] endog, double[] mu) {
        checkObservations(endog, mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            out[i] = endog[i] - mu[i];
        }
        return out;
    }
}
