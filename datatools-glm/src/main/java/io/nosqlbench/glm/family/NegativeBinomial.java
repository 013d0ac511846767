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

import io.nosqlbench.glm.links.CLogLogLink;
import io.nosqlbench.glm.links.IdentityLink;
import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.NegativeBinomialLink;
import io.nosqlbench.glm.links.PowerLink;
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.special.Hypergeometric;
import io.nosqlbench.glm.varfuncs.NegativeBinomialVariance;
import org.apache.commons.math3.special.Gamma;

import java.util.Set;

/**
 * Negative Binomial family for over-dispersed counts.
 *
 * <h2>Parameterization</h2>
 *
 * <pre>{@code
 * f(y) = Γ(y + 1/α) / (y! Γ(1/α)) * (1/(1 + αμ))^(1/α) * (αμ/(1 + αμ))^y
 *
 * E[Y] = μ      Var[Y] = μ + αμ²
 * }</pre>
 *
 * <p>The dispersion {@code alpha} is fixed at construction and treated as
 * non-stochastic; typical values lie between 0.01 and 2. As alpha approaches
 * zero the family approaches {@link Poisson}.
 *
 * <h2>Deviance</h2>
 *
 * <p>{@link #residDev(double[], double[])} returns the unit deviance of each
 * observation (not its signed square root), and the deviance is their
 * weighted sum {@code sum(residDev * freqWeights * varWeights / scale)}.
 *
 * <h2>Links</h2>
 *
 * <p>Accepts log (default, range-preserving), cloglog, identity, nbinom and
 * any power link.
 */
public class NegativeBinomial extends Family {

    static final Set<Class<? extends Link>> ALLOWED_LINKS = Set.of(
        LogLink.class, CLogLogLink.class, IdentityLink.class, NegativeBinomialLink.class, PowerLink.class);
    static final Set<Class<? extends Link>> SAFE_LINKS = Set.of(LogLink.class);

    /** Default dispersion. */
    public static final double DEFAULT_ALPHA = 1.0;

    private final double alpha;

    public NegativeBinomial() {
        this(new LogLink(), DEFAULT_ALPHA);
    }

    public NegativeBinomial(Link link) {
        this(link, DEFAULT_ALPHA);
    }

    /**
     * Creates a Negative Binomial family.
     *
     * @param link the link
     * @param alpha the dispersion parameter; must be positive and finite
     * @throws IllegalArgumentException if alpha is not positive
     */
    public NegativeBinomial(Link link, double alpha) {
        super("negative_binomial", link, new NegativeBinomialVariance(alpha),
            MeanDomain.NON_NEGATIVE, ALLOWED_LINKS, SAFE_LINKS, LogLink.class);
        this.alpha = alpha;
    }

    public double getAlpha() {
        return alpha;
    }

    /**
     * Unit deviances
     * {@code 2 * (y log(y/mu) - (y + 1/α) log((y + 1/α)/(mu + 1/α)))}.
     *
     * <p>The scale argument is not used.
     */
    @Override
    public double[] residDev(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        double k = 1.0 / alpha;
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            double endogAlpha = y + k;
            double muAlpha = m + k;
            out[i] = 2.0 * (y * Math.log(clippedRatio(y, m)) - endogAlpha * Math.log(endogAlpha / muAlpha));
        }
        return out;
    }

    /**
     * Per-observation log-likelihood.
     *
     * <pre>{@code
     * ll_i = varWeights_i / scale * (y log(αμ) - (y + 1/α) log(1 + αμ)
     *        + lnΓ(y + 1/α) - lnΓ(1/α) - lnΓ(y + 1))
     * }</pre>
     *
     * @param endog the counts
     * @param mu the fitted means
     * @param varWeights the variance (analytic) weights
     * @param scale the scale parameter
     * @return the log-likelihood of each observation
     */
    public double[] loglikeObs(double[] endog, double[] mu, double[] varWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, varWeights, "varWeights");
        double k = 1.0 / alpha;
        double lgammaK = Gamma.logGamma(k);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            double ll = y * Math.log(alpha * m);
            ll -= (y + k) * Math.log1p(alpha * m);
            ll += Gamma.logGamma(y + k);
            ll -= lgammaK;
            ll -= Gamma.logGamma(y + 1.0);
            out[i] = varWeights[i] / scale * ll;
        }
        return out;
    }

    /**
     * Total log-likelihood {@code sum(loglikeObs * freqWeights)}.
     *
     * @param endog the counts
     * @param mu the fitted means
     * @param varWeights the variance (analytic) weights
     * @param freqWeights the frequency weights
     * @param scale the scale parameter
     * @return the log-likelihood
     */
    public double loglike(double[] endog, double[] mu, double[] varWeights, double[] freqWeights, double scale) {
        return FamilyArrays.weightedSum(loglikeObs(endog, mu, varWeights, scale), freqWeights);
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        return loglike(endog, mu, FamilyArrays.ones(endog.length), freqWeights, scale);
    }

    /**
     * Deviance {@code sum(residDev * freqWeights * varWeights / scale)}.
     *
     * @param endog the counts
     * @param mu the fitted means
     * @param varWeights the variance (analytic) weights
     * @param freqWeights the frequency weights
     * @param scale the scale parameter
     * @return the deviance
     */
    public double deviance(double[] endog, double[] mu, double[] varWeights, double[] freqWeights, double scale) {
        FamilyArrays.requireSameLength(endog, varWeights, "varWeights");
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        double[] unit = residDev(endog, mu);
        double sum = 0.0;
        for (int i = 0; i < unit.length; i++) {
            sum += unit[i] * freqWeights[i] * varWeights[i] / scale;
        }
        return sum;
    }

    @Override
    public double deviance(double[] endog, double[] mu, double[] freqWeights, double scale) {
        return deviance(endog, mu, FamilyArrays.ones(endog.length), freqWeights, scale);
    }

    /**
     * Anscombe residuals through {@code H(x) = 2F1(2/3, 1/3; 5/3; x)}:
     *
     * <pre>{@code
     * 1.5 * (y^(2/3) H(-αy) - μ^(2/3) H(-αμ)) / (μ (1 + αμ) scale³)^(1/6) * sqrt(varWeights)
     * }</pre>
     *
     * <p>This equals the Binomial form with {@code n = -1/α}.
     *
     * @param endog the counts
     * @param mu the fitted means
     * @param varWeights the variance (analytic) weights
     * @param scale the scale parameter
     * @return the residuals
     */
    public double[] residAnscombe(double[] endog, double[] mu, double[] varWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, varWeights, "varWeights");
        double scaleCubed = scale * scale * scale;
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = mu[i];
            double numer = Math.pow(y, 2.0 / 3.0) * h2f1(-alpha * y) - Math.pow(m, 2.0 / 3.0) * h2f1(-alpha * m);
            double denom = Math.pow(m * (1.0 + alpha * m) * scaleCubed, 1.0 / 6.0);
            out[i] = 1.5 * numer / denom * Math.sqrt(varWeights[i]);
        }
        return out;
    }

    @Override
    public double[] residAnscombe(double[] endog, double[] mu) {
        return residAnscombe(endog, mu, FamilyArrays.ones(endog.length), 1.0);
    }

    private static double h2f1(double x) {
        return Hypergeometric.hyp2f1(2.0 / 3.0, 1.0 / 3.0, 5.0 / 3.0, x);
    }

    @Override
    public String toString() {
        return "NegativeBinomial[link=" + link().name() + ", alpha=" + alpha + "]";
    }
}
