package io.nosqlbench.glm.special;

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

import org.apache.commons.math3.special.Gamma;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gauss hypergeometric function <sub>2</sub>F<sub>1</sub>(a, b; c; z) for real arguments.
 *
 * <h2>Evaluation Strategy</h2>
 *
 * <pre>{@code
 *   z < 0          Pfaff:  F(a,b;c;z) = (1-z)^(-a) F(a, c-b; c; z/(z-1))
 *   0 <= z <= 0.5  direct power series
 *   0.5 < z < 1    connection formula in (1-z)  (A&S 15.3.6)
 *   z = 1          Gauss' theorem, finite only when c-a-b > 0
 *   z > 1          NaN (branch cut)
 * }</pre>
 *
 * <p>The connection formula needs c-a-b to be non-integral. When it is
 * integral the direct series is used instead, which converges but slowly
 * as z approaches 1.
 *
 * <p>Commons Math has no hypergeometric function, so this class fills the
 * gap using {@link Gamma#gamma(double)} for the connection coefficients.
 */
public final class Hypergeometric {

    private static final Logger logger = LogManager.getLogger(Hypergeometric.class);

    private static final int MAX_TERMS = 500_000;
    private static final double SERIES_TOLERANCE = 1e-17;
    private static final double INTEGER_TOLERANCE = 1e-12;

    private Hypergeometric() {
    }

    /**
     * Evaluates <sub>2</sub>F<sub>1</sub>(a, b; c; z).
     *
     * @param a first numerator parameter
     * @param b second numerator parameter
     * @param c denominator parameter; non-positive integers yield NaN
     * @param z the argument; values above 1 yield NaN
     * @return the function value, or NaN outside the real domain
     */
    public static double hyp2f1(double a, double b, double c, double z) {
        if (Double.isNaN(a) || Double.isNaN(b) || Double.isNaN(c) || Double.isNaN(z)) {
            return Double.NaN;
        }
        if (c <= 0 && c == Math.rint(c)) {
            return Double.NaN;
        }
        if (z == 0.0) {
            return 1.0;
        }
        if (z > 1.0) {
            return Double.NaN;
        }
        if (z == 1.0) {
            return gaussSum(a, b, c);
        }
        if (z < 0.0) {
            double w = z / (z - 1.0);
            double oneMinusW = 1.0 / (1.0 - z);
            return Math.pow(1.0 - z, -a) * unitInterval(a, c - b, c, w, oneMinusW);
        }
        return unitInterval(a, b, c, z, 1.0 - z);
    }

    /// Evaluates for `0 <= z < 1`, with `1 - z` supplied to keep precision near 1.
    private static double unitInterval(double a, double b, double c, double z, double oneMinusZ) {
        if (z <= 0.5) {
            return series(a, b, c, z);
        }
        double s = c - a - b;
        if (Math.abs(s - Math.rint(s)) < INTEGER_TOLERANCE) {
            logger.debug("c-a-b={} is integral, falling back to direct series at z={}", s, z);
            return series(a, b, c, z);
        }
        double first = gammaRatio(c, s, c - a, c - b) * series(a, b, 1.0 - s, oneMinusZ);
        double second = Math.pow(oneMinusZ, s) * gammaRatio(c, -s, a, b)
            * series(c - a, c - b, 1.0 + s, oneMinusZ);
        return first + second;
    }

    private static double series(double a, double b, double c, double z) {
        double term = 1.0;
        double sum = 1.0;
        for (int k = 0; k < MAX_TERMS; k++) {
            term *= (a + k) * (b + k) / ((c + k) * (k + 1)) * z;
            sum += term;
            if (term == 0.0 || Math.abs(term) <= SERIES_TOLERANCE * Math.abs(sum)) {
                return sum;
            }
        }
        logger.warn("2F1({}, {}; {}; {}) series did not converge in {} terms", a, b, c, z, MAX_TERMS);
        return Double.NaN;
    }

    private static double gaussSum(double a, double b, double c) {
        double s = c - a - b;
        if (s <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return gammaRatio(c, s, c - a, c - b);
    }

    /// Γ(p)Γ(q) / (Γ(r)Γ(s)); a pole in the denominator makes the ratio zero.
    private static double gammaRatio(double p, double q, double r, double s) {
        if (isPole(r) || isPole(s)) {
            return 0.0;
        }
        return Gamma.gamma(p) * Gamma.gamma(q) / (Gamma.gamma(r) * Gamma.gamma(s));
    }

    private static boolean isPole(double x) {
        return x <= 0 && x == Math.rint(x);
    }
}
