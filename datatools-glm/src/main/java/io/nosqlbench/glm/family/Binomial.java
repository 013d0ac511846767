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
import io.nosqlbench.glm.links.CauchyLink;
import io.nosqlbench.glm.links.IdentityLink;
import io.nosqlbench.glm.links.Link;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.LogitLink;
import io.nosqlbench.glm.links.ProbabilityLink;
import io.nosqlbench.glm.links.ProbitLink;
import io.nosqlbench.glm.special.FamilyArrays;
import io.nosqlbench.glm.varfuncs.BinomialVariance;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Set;

/// Binomial family for proportions, `V(mu) = mu(1 - mu)` scaled by the trial count.
///
/// ## Trial Count
///
/// A freshly constructed family is Bernoulli: every observation is a single
/// trial and the response is 0/1 (or a proportion with `n = 1`). Grouped data
/// is configured once, before fitting, through [#initialize(double[][])]:
///
/// ```
///   successes  failures            proportion   trials
///   ┌────┬────┐                    ┌──────┐     ┌────┐
///   │  3 │  7 │    initialize ──►  │ 0.30 │     │ 10 │
///   │  5 │  5 │                    │ 0.50 │     │ 10 │
///   │  1 │  3 │                    │ 0.25 │     │  4 │
///   └────┴────┘                    └──────┘     └────┘
/// ```
///
/// The step returns a new, fully configured family carrying the trial counts;
/// the original instance is left unchanged.
///
/// ## Branches
///
/// Deviance, residuals and log-likelihood use the Bernoulli forms when the
/// trial count is the scalar 1 and the grouped forms when per-observation
/// counts are present, even if every count happens to be 1. An additive
/// floor of 1e-200 keeps the logarithms finite at `mu = 0` and `mu = 1`.
///
/// ## Links
///
/// Accepts logit (default), probit, cauchy, cloglog, log and identity. The
/// probability links are range-preserving.
public class Binomial extends Family {

    private static final Logger logger = LogManager.getLogger(Binomial.class);

    static final Set<Class<? extends Link>> ALLOWED_LINKS = Set.of(
        LogitLink.class, ProbitLink.class, CauchyLink.class, LogLink.class, CLogLogLink.class, IdentityLink.class);
    static final Set<Class<? extends Link>> SAFE_LINKS = Set.of(ProbabilityLink.class);

    private static final double LOG_FLOOR = 1e-200;
    private static final double TWO_THIRDS = 2.0 / 3.0;
    private static final double BETA_TWO_THIRDS = Math.exp(Beta.logBeta(TWO_THIRDS, TWO_THIRDS));

    /// Per-observation trial counts, or null for the Bernoulli case.
    private final double[] trials;

    /// Result of [#initialize(double[][])].
    ///
    /// @param endog the response as proportions
    /// @param trials the trial count of each observation
    /// @param family the family configured for these trial counts
    public record Initialization(double[] endog, double[] trials, Binomial family) {
    }

    public Binomial() {
        this(new LogitLink());
    }

    /**
     * Creates a Bernoulli-configured Binomial family.
     *
     * @param link the link; must be logit, probit, cauchy, cloglog, log or identity
     */
    public Binomial(Link link) {
        this(link, null);
    }

    private Binomial(Link link, double[] trials) {
        super("binomial", link, trials == null ? new BinomialVariance(1.0) : new BinomialVariance(trials),
            MeanDomain.UNIT_INTERVAL, ALLOWED_LINKS, SAFE_LINKS, LogitLink.class);
        this.trials = trials;
    }

    /**
     * @return true when the trial count is the scalar 1
     */
    public boolean isBernoulli() {
        return trials == null;
    }

    /**
     * @return a copy of the per-observation trial counts, or null for the Bernoulli case
     */
    public double[] trials() {
        return trials == null ? null : trials.clone();
    }

    private double trialsAt(int i) {
        return trials == null ? 1.0 : trials[i];
    }

    /**
     * Starting means {@code (y + 0.5) / 2}.
     */
    @Override
    public double[] startingMu(double[] y) {
        Objects.requireNonNull(y, "y cannot be null");
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = (y[i] + 0.5) / 2.0;
        }
        return out;
    }

    /**
     * Configures the family from a response matrix.
     *
     * <p>With two or more columns the rows are read as (successes, failures, ...);
     * the proportion is {@code successes / rowSum} and the trial count is the
     * row sum. A single column is treated as proportions with one trial each.
     *
     * @param endog the response, one row per observation
     * @return the proportions, trial counts and configured family
     */
    public Initialization initialize(double[][] endog) {
        Objects.requireNonNull(endog, "endog cannot be null");
        if (endog.length > 0 && endog[0].length == 0) {
            throw new IllegalArgumentException("endog must have at least one column");
        }
        if (endog.length == 0 || endog[0].length <= 1) {
            double[] column = new double[endog.length];
            for (int i = 0; i < endog.length; i++) {
                if (endog[i].length != 1) {
                    throw new IllegalArgumentException(String.format(
                        "Row %d has %d columns, expected 1", i, endog[i].length));
                }
                column[i] = endog[i][0];
            }
            return initialize(column);
        }

        int columns = endog[0].length;
        double[] proportions = new double[endog.length];
        double[] counts = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            if (endog[i].length != columns) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d columns, expected %d", i, endog[i].length, columns));
            }
            double total = 0.0;
            for (double v : endog[i]) {
                total += v;
            }
            counts[i] = total;
            proportions[i] = endog[i][0] / total;
        }
        logger.debug("Initialized binomial family with grouped trial counts for {} observations", endog.length);
        return new Initialization(proportions, counts.clone(), new Binomial(link(), counts));
    }

    /**
     * Treats the response as proportions with one trial per observation.
     *
     * @param endog the response
     * @return the response unchanged, unit trial counts and this family
     */
    public Initialization initialize(double[] endog) {
        Objects.requireNonNull(endog, "endog cannot be null");
        return new Initialization(endog.clone(), FamilyArrays.ones(endog.length), this);
    }

    private void checkTrials(double[] endog) {
        if (trials != null && trials.length != endog.length) {
            throw new IllegalArgumentException(String.format(
                "endog length (%d) does not match trial count length (%d)", endog.length, trials.length));
        }
    }

    @Override
    public double deviance(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        checkTrials(endog);
        double sum = 0.0;
        if (isBernoulli()) {
            for (int i = 0; i < endog.length; i++) {
                double one = endog[i] == 1.0 ? 1.0 : 0.0;
                double m = mu[i];
                sum += (one * Math.log(m + LOG_FLOOR) + (1.0 - one) * Math.log(1.0 - m + LOG_FLOOR))
                    * freqWeights[i];
            }
            return -2.0 * sum;
        }
        for (int i = 0; i < endog.length; i++) {
            sum += trials[i] * freqWeights[i] * groupedUnit(endog[i], mu[i]);
        }
        return 2.0 * sum;
    }

    private static double groupedUnit(double y, double m) {
        return y * Math.log(y / m + LOG_FLOOR) + (1.0 - y) * Math.log((1.0 - y) / (1.0 - m) + LOG_FLOOR);
    }

    /**
     * Deviance residuals, with {@code mu} first clipped through the link.
     */
    @Override
    public double[] residDev(double[] endog, double[] mu, double scale) {
        checkObservations(endog, mu);
        checkTrials(endog);
        double[] clipped = link().clip(mu);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double y = endog[i];
            double m = clipped[i];
            double unit;
            if (isBernoulli()) {
                double one = y == 1.0 ? 1.0 : 0.0;
                unit = -2.0 * Math.log(one * m + (1.0 - one) * (1.0 - m));
            } else {
                unit = 2.0 * trials[i] * groupedUnit(y, m);
            }
            out[i] = Math.signum(y - m) * Math.sqrt(unit) / scale;
        }
        return out;
    }

    @Override
    public double loglike(double[] endog, double[] mu, double[] freqWeights, double scale) {
        checkObservations(endog, mu);
        FamilyArrays.requireSameLength(endog, freqWeights, "freqWeights");
        checkTrials(endog);
        double sum = 0.0;
        if (isBernoulli()) {
            for (int i = 0; i < endog.length; i++) {
                double m = mu[i];
                sum += (endog[i] * Math.log(m / (1.0 - m) + LOG_FLOOR) + Math.log(1.0 - m)) * freqWeights[i];
            }
            return scale * sum;
        }
        for (int i = 0; i < endog.length; i++) {
            double n = trials[i];
            double y = endog[i] * n;
            double m = mu[i];
            double logChoose = Gamma.logGamma(n + 1.0) - Gamma.logGamma(y + 1.0) - Gamma.logGamma(n - y + 1.0);
            sum += (logChoose + y * Math.log(m / (1.0 - m)) + n * Math.log(1.0 - m)) * freqWeights[i];
        }
        return scale * sum;
    }

    /**
     * Anscombe residuals from the Cox-Snell transform
     * {@code A(x) = I(x; 2/3, 2/3) * B(2/3, 2/3)}:
     *
     * <pre>{@code
     * sqrt(n) * (A(y) - A(mu)) / (mu^(1/6) * (1 - mu)^(1/6))
     * }</pre>
     */
    @Override
    public double[] residAnscombe(double[] endog, double[] mu) {
        checkObservations(endog, mu);
        checkTrials(endog);
        double[] out = new double[endog.length];
        for (int i = 0; i < endog.length; i++) {
            double m = mu[i];
            double denom = Math.pow(m, 1.0 / 6.0) * Math.pow(1.0 - m, 1.0 / 6.0);
            out[i] = Math.sqrt(trialsAt(i)) * (coxSnell(endog[i]) - coxSnell(m)) / denom;
        }
        return out;
    }

    private static double coxSnell(double x) {
        return Beta.regularizedBeta(x, TWO_THIRDS, TWO_THIRDS) * BETA_TWO_THIRDS;
    }

    @Override
    public String toString() {
        return "Binomial[link=" + link().name() + (isBernoulli() ? ", n=1" : ", trials=" + trials.length) + "]";
    }
}
