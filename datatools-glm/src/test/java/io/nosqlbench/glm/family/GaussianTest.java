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
import io.nosqlbench.glm.links.LogLink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GaussianTest {

    private static final double[] Y = {1.0, 2.0, 3.0};
    private static final double[] MU = {1.1, 1.9, 3.2};

    @Test
    void allAllowedLinksAreSafe() {
        assertInstanceOf(IdentityLink.class, new Gaussian().link());
        assertTrue(new Gaussian().isSafeLink());
        assertTrue(new Gaussian(new LogLink()).isSafeLink());
        assertTrue(new Gaussian(new InversePowerLink()).isSafeLink());
        assertEquals(MeanDomain.REAL_LINE, new Gaussian().validRange());
    }

    @Test
    void devianceIsScaledResidualSumOfSquares() {
        Gaussian gaussian = new Gaussian();
        assertEquals(0.06, gaussian.deviance(Y, MU), 1e-12);
        assertEquals(0.03, gaussian.deviance(Y, MU, new double[]{1, 1, 1}, 2.0), 1e-12);
        assertEquals(0.07, gaussian.deviance(Y, MU, new double[]{1, 2, 1}, 1.0), 1e-12);
    }

    @Test
    void residualsAreRawDifferences() {
        Gaussian gaussian = new Gaussian();
        assertArrayEquals(new double[]{-0.1, 0.1, -0.2}, gaussian.residDev(Y, MU), 1e-12);
        assertArrayEquals(new double[]{-0.05, 0.05, -0.1}, gaussian.residDev(Y, MU, 2.0), 1e-12);
        assertArrayEquals(new double[]{-0.1, 0.1, -0.2}, gaussian.residAnscombe(Y, MU), 1e-12);
    }

    @Test
    void identityLinkUsesConcentratedLikelihood() {
        double ssr = 0.06;
        double expected = -1.5 * Math.log(ssr) - 1.5 * (1.0 + Math.log(2.0 * Math.PI / 3.0));
        Gaussian gaussian = new Gaussian();
        assertEquals(expected, gaussian.loglike(Y, MU), 1e-9);
        // scale and frequency weights do not enter this branch
        assertEquals(expected, gaussian.loglike(Y, MU, new double[]{3, 3, 3}, 7.0), 1e-9);
    }

    @Test
    void exactFitHasUnboundedConcentratedLikelihood() {
        double[] y = {1.0, 1.0, 1.0};
        assertEquals(Double.POSITIVE_INFINITY, new Gaussian().loglike(y, y));
    }

    @Test
    void otherLinksUseNormalDensity() {
        Gaussian gaussian = new Gaussian(new LogLink());
        double scale = 2.0;
        double expected = 0.0;
        for (int i = 0; i < Y.length; i++) {
            double r = Y[i] - MU[i];
            expected += -r * r / (2.0 * scale) - 0.5 * Math.log(2.0 * Math.PI * scale);
        }
        assertEquals(expected, gaussian.loglike(Y, MU, new double[]{1, 1, 1}, scale), 1e-12);
    }

    @Test
    void weightsUnderIdentityLinkAreOne() {
        assertArrayEquals(new double[]{1.0, 1.0, 1.0}, new Gaussian().weights(MU), 1e-15);
    }
}
