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
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.varfuncs.VarianceFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Set;

/// Base type for the one-parameter exponential families used by GLM fitting.
///
/// ## Purpose
///
/// A family pairs a [Link] with a [VarianceFunction] and supplies the
/// quantities an iteratively reweighted least squares (IRLS) loop needs:
/// starting values, weights, deviance, residuals and log-likelihood. All
/// operations are pure functions of the arrays passed in.
///
/// ## Calling Contract
///
/// ```
///   startingMu(y)                         once
///        │
///        ▼
///   ┌─► predict / fitted ─► weights ─► deviance ──┐
///   └──────────────── until converged ◄───────────┘
///        │
///        ▼
///   loglike, residDev, residAnscombe      reporting
/// ```
///
/// ## Link Validation
///
/// The link is checked once, at construction:
/// - a null or non-[Link] object raises [InvalidLinkTypeException]
/// - a link outside [#allowedLinks()] raises [InvalidLinkChoiceException]
///
/// Membership uses `instanceof`, so a subclass of an allowed link is allowed.
/// Links outside [#safeLinks()] are accepted but logged as a warning, since
/// they can predict means outside [#validRange()]. The family's own default
/// link is exempt from the warning (the canonical Gamma link is unsafe) and
/// is logged at debug instead.
///
/// ## Numeric Boundaries
///
/// Values at the edge of the mean domain are kept finite with small floors
/// where a family defines one. Elsewhere NaN and infinities propagate to the
/// caller, which owns the decision to abort a fit.
///
/// Instances are immutable and may be shared across threads.
///
/// @see Poisson
/// @see QuasiPoisson
/// @see Gaussian
/// @see Gamma
/// @see Binomial
/// @see NegativeBinomial
public abstract class Family {

    private static final Logger logger = LogManager.getLogger(Family.class);

    private final String name;
    private final Link link;
    private final VarianceFunction variance;
    private final MeanDomain validRange;
    private final Set<Class<? extends Link>> allowedLinks;
    private final Set<Class<? extends Link>> safeLinks;

    protected Family(String name, Link link, VarianceFunction variance, MeanDomain validRange,
                     Set<Class<? extends Link>> allowedLinks, Set<Class<? extends Link>> safeLinks,
                     Class<? extends Link> defaultLink) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.variance = Objects.requireNonNull(variance, "variance cannot be null");
        this.validRange = Objects.requireNonNull(validRange, "validRange cannot be null");
        this.allowedLinks = Set.copyOf(allowedLinks);
        this.safeLinks = Set.copyOf(safeLinks);
        this.link = checkLink(name, link, this.allowedLinks);
        if (!isSafeLink() && link.getClass() == defaultLink) {
            logger.debug("Default link {} is not range-preserving for the {} family", link.name(), name);
        } else if (!isSafeLink()) {
            logger.warn("Link {} is not range-preserving for the {} family; fitted means may leave {}",
                link.name(), name, validRange);
        }
    }

    /// Checks the type and allowed-set membership of a candidate link.
    ///
    /// @param familyName the family name for error messages
    /// @param candidate the supplied link object
    /// @param allowed the link types the family accepts
    /// @return the candidate as a link
    /// @throws InvalidLinkTypeException if the candidate is null or not a [Link]
    /// @throws InvalidLinkChoiceException if the link is not in the allowed set
    static Link checkLink(String familyName, Object candidate, Set<Class<? extends Link>> allowed) {
        if (!(candidate instanceof Link)) {
            throw new InvalidLinkTypeException(candidate);
        }
        Link link = (Link) candidate;
        if (!matchesAny(link, allowed)) {
            throw new InvalidLinkChoiceException(familyName, link, allowed);
        }
        return link;
    }

    private static boolean matchesAny(Link link, Set<Class<? extends Link>> types) {
        for (Class<? extends Link> type : types) {
            if (type.isInstance(link)) {
                return true;
            }
        }
        return false;
    }

    /// @return the family identifier, e.g. `poisson`
    public String name() {
        return name;
    }

    public Link link() {
        return link;
    }

    public VarianceFunction variance() {
        return variance;
    }

    /// @return the closed interval of permissible means
    public MeanDomain validRange() {
        return validRange;
    }

    public Set<Class<? extends Link>> allowedLinks() {
        return allowedLinks;
    }

    /// @return the link types guaranteed to keep predictions inside [#validRange()]
    public Set<Class<? extends Link>> safeLinks() {
        return safeLinks;
    }

    /// @return true if the configured link is range-preserving for this family
    public boolean isSafeLink() {
        return matchesAny(link, safeLinks);
    }

    /// Initial mean guess for the first IRLS iteration, `(y + mean(y)) / 2`.
    ///
    /// @param y the untransformed response
    /// @return the starting means
    public double[] startingMu(double[] y) {
        Objects.requireNonNull(y, "y cannot be null");
        double mean = FamilyArrays.mean(y);
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = (y[i] + mean) / 2.0;
        }
        return out;
    }

    /// IRLS weights `1 / (g'(mu)^2 * V(mu))`.
    ///
    /// A zero variance yields an infinite or NaN weight; callers clip means first.
    ///
    /// @param mu the current means
    /// @return the weights
    public double[] weights(double[] mu) {
        Objects.requireNonNull(mu, "mu cannot be null");
        double[] deriv = link.deriv(mu);
        double[] var = variance.apply(mu);
        double[] out = new double[mu.length];
        for (int i = 0; i < mu.length; i++) {
            out[i] = 1.0 / (deriv[i] * deriv[i] * var[i]);
        }
        return out;
    }

    /// Deviance with unit frequency weights and unit scale.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @return the deviance
    public double deviance(double[] endog, double[] mu) {
        return deviance(endog, mu, FamilyArrays.ones(endog.length), 1.0);
    }

    /// Twice the log-likelihood ratio of the saturated model to the fitted one.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @param freqWeights the frequency weights
    /// @param scale the scale parameter
    /// @return the deviance
    public abstract double deviance(double[] endog, double[] mu, double[] freqWeights, double scale);

    /// Deviance residuals at unit scale.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @return the signed residuals
    public double[] residDev(double[] endog, double[] mu) {
        return residDev(endog, mu, 1.0);
    }

    /// Per-observation signed deviance residuals.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @param scale divisor applied to the residuals, where the family uses one
    /// @return the residuals
    public abstract double[] residDev(double[] endog, double[] mu, double scale);

    /// Log-likelihood with unit frequency weights and unit scale.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @return the log-likelihood
    public double loglike(double[] endog, double[] mu) {
        return loglike(endog, mu, FamilyArrays.ones(endog.length), 1.0);
    }

    /// Total log-likelihood at the given means.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @param freqWeights the frequency weights
    /// @param scale the scale parameter
    /// @return the log-likelihood, or NaN where the family has none
    public abstract double loglike(double[] endog, double[] mu, double[] freqWeights, double scale);

    /// Variance-stabilizing Anscombe residuals.
    ///
    /// @param endog the response
    /// @param mu the fitted means
    /// @return the residuals
    public abstract double[] residAnscombe(double[] endog, double[] mu);

    /// Means from linear predictors through the inverse link.
    ///
    /// @param linPred the linear predictor
    /// @return the fitted means
    public double[] fitted(double[] linPred) {
        Objects.requireNonNull(linPred, "linPred cannot be null");
        return link.inverse(linPred);
    }

    /// Linear predictors from means through the link.
    ///
    /// @param mu the means
    /// @return the linear predictor
    public double[] predict(double[] mu) {
        Objects.requireNonNull(mu, "mu cannot be null");
        return link.link(mu);
    }

    /// Validates that `endog` and `mu` are non-null and aligned.
    protected static void checkObservations(double[] endog, double[] mu) {
        Objects.requireNonNull(endog, "endog cannot be null");
        FamilyArrays.requireSameLength(endog, mu, "mu");
    }

    /// Clips `endog / mu` to at least machine epsilon so its logarithm stays finite.
    protected static double clippedRatio(double endog, double mu) {
        return Math.max(endog / mu, FamilyArrays.FLOAT_EPS);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[link=" + link.name() + "]";
    }
}
