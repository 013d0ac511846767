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
import io.nosqlbench.glm.links.InversePowerLink;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.ProbitLink;
import io.nosqlbench.glm.links.SqrtLink;
import io.nosqlbench.glm.special.FamilyArrays;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties shared by every family: non-negative deviance, positive finite
 * weights, link round trips and the IRLS calling contract.
 */
@Tag("unit")
public class FamilyPropertiesTest {

    private static final double[] COUNTS = {0, 1, 3, 4};
    private static final double[] COUNT_MU = {0.5, 1.2, 2.3, 4.0};
    private static final double[] PROPORTIONS = {0, 1, 1, 0};
    private static final double[] PROPORTION_MU = {0.2, 0.7, 0.6, 0.4};
    private static final double[] REALS = {-1.0, 0.5, 2.0, 3.0};
    private static final double[] REAL_MU = {-0.5, 1.0, 1.5, 3.5};
    private static final double[] POSITIVES = {0.5, 1.0, 2.0, 4.0};
    private static final double[] POSITIVE_MU = {1.0, 1.0, 1.5, 3.0};

    static Stream<Arguments> families() {
        return Stream.of(
            Arguments.of(new Poisson(), COUNTS, COUNT_MU),
            Arguments.of(new Poisson(new SqrtLink()), COUNTS, COUNT_MU),
            Arguments.of(new QuasiPoisson(), COUNTS, COUNT_MU),
            Arguments.of(new NegativeBinomial(), COUNTS, COUNT_MU),
            Arguments.of(new NegativeBinomial(new LogLink(), 0.2), COUNTS, COUNT_MU),
            Arguments.of(new Binomial(), PROPORTIONS, PROPORTION_MU),
            Arguments.of(new Binomial(new ProbitLink()), PROPORTIONS, PROPORTION_MU),
            Arguments.of(new Binomial(new CLogLogLink()), PROPORTIONS, PROPORTION_MU),
            Arguments.of(new Gaussian(), REALS, REAL_MU),
            Arguments.of(new Gamma(), POSITIVES, POSITIVE_MU),
            Arguments.of(new Gamma(new LogLink()), POSITIVES, POSITIVE_MU)
        );
    }

    @ParameterizedTest
    @MethodSource("families")
    void devianceIsNonNegative(Family family, double[] y, double[] mu) {
        double deviance = family.deviance(y, mu);
        assertTrue(deviance >= 0.0, family + " deviance " + deviance);
    }

    @ParameterizedTest
    @MethodSource("families")
    void weightsArePositiveAndFinite(Family family, double[] y, double[] mu) {
        for (double w : family.weights(mu)) {
            assertTrue(w > 0.0 && Double.isFinite(w), family + " weight " + w);
        }
    }

    @ParameterizedTest
    @MethodSource("families")
    void fittedInvertsPredict(Family family, double[] y, double[] mu) {
        assertArrayEquals(mu, family.fitted(family.predict(mu)), 1e-10, family.toString());
    }

    @ParameterizedTest
    @MethodSource("families")
    void startingMuStaysInValidRange(Family family, double[] y, double[] mu) {
        for (double m : family.startingMu(y)) {
            assertTrue(family.validRange().contains(m), family + " starting mean " + m);
        }
    }

    @ParameterizedTest
    @MethodSource("families")
    void operationsDoNotModifyInputs(Family family, double[] y, double[] mu) {
        double[] yCopy = y.clone();
        double[] muCopy = mu.clone();
        family.deviance(y, mu);
        family.residDev(y, mu);
        family.loglike(y, mu);
        family.residAnscombe(y, mu);
        family.weights(mu);
        assertArrayEquals(yCopy, y, 0.0);
        assertArrayEquals(muCopy, mu, 0.0);
    }

    static Stream<Arguments> interceptOnlyFits() {
        return Stream.of(
            Arguments.of(new Poisson(), new double[]{0, 1, 3, 4, 2}),
            Arguments.of(new NegativeBinomial(new LogLink(), 0.5), new double[]{0, 1, 3, 4, 2}),
            Arguments.of(new Binomial(), new double[]{0, 1, 1, 0, 1}),
            Arguments.of(new Gaussian(), new double[]{-1.0, 0.5, 2.0, 3.0, 0.0}),
            Arguments.of(new Gamma(new LogLink()), new double[]{0.5, 1.0, 2.0, 4.0, 1.5}),
            Arguments.of(new Gamma(new InversePowerLink()), new double[]{0.5, 1.0, 2.0, 4.0, 1.5})
        );
    }

    /// Runs IRLS for an intercept-only model; the maximum likelihood mean is the sample mean.
    @ParameterizedTest
    @MethodSource("interceptOnlyFits")
    void interceptOnlyFitConvergesToSampleMean(Family family, double[] y) {
        double[] mu = family.startingMu(y);
        double previous = Double.POSITIVE_INFINITY;
        for (int iteration = 0; iteration < 50; iteration++) {
            double[] eta = family.predict(mu);
            double[] deriv = family.link().deriv(mu);
            double[] weights = family.weights(mu);
            double numerator = 0.0;
            double denominator = 0.0;
            for (int i = 0; i < y.length; i++) {
                double z = eta[i] + (y[i] - mu[i]) * deriv[i];
                numerator += weights[i] * z;
                denominator += weights[i];
            }
            mu = family.fitted(FamilyArrays.filled(y.length, numerator / denominator));
            double deviance = family.deviance(y, mu);
            if (Math.abs(previous - deviance) < 1e-14) {
                break;
            }
            previous = deviance;
        }
        double mean = FamilyArrays.mean(y);
        for (double m : mu) {
            assertEquals(mean, m, 1e-8, family.toString());
        }
        assertTrue(Double.isFinite(family.loglike(y, mu)) || family instanceof QuasiPoisson);
    }

    /// A constant response is fitted exactly in one step; the concentrated
    /// Gaussian likelihood of a zero residual sum of squares is unbounded.
    @Test
    void constantResponseIsFittedExactly() {
        Gaussian gaussian = new Gaussian(new IdentityLink());
        double[] y = {1.0, 1.0, 1.0};
        double[] mu = gaussian.startingMu(y);
        assertArrayEquals(y, mu, 0.0);
        assertEquals(0.0, gaussian.deviance(y, mu), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, gaussian.loglike(y, mu));
    }
}
