package io.nosqlbench.glm.links;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name registry for the link implementations, used by configuration.
 *
 * <p>Recognized names:
 * <ul>
 *   <li>{@code logit}, {@code probit}, {@code cauchy}, {@code cloglog}</li>
 *   <li>{@code log}, {@code identity}, {@code inverse_power}, {@code inverse_squared}, {@code sqrt}</li>
 *   <li>{@code power(p)} for an arbitrary non-zero exponent</li>
 *   <li>{@code nbinom} or {@code nbinom(alpha)}</li>
 * </ul>
 *
 * <p>Names are case-insensitive. Every lookup returns a fresh instance.
 */
public final class Links {

    private static final Pattern PARAMETERIZED = Pattern.compile("^([a-z_]+)\\s*\\(\\s*([^)]*?)\\s*\\)$");

    private static final Map<String, Supplier<Link>> NAMED = new LinkedHashMap<>();

    static {
        NAMED.put("logit", LogitLink::new);
        NAMED.put("probit", ProbitLink::new);
        NAMED.put("cauchy", CauchyLink::new);
        NAMED.put("cloglog", CLogLogLink::new);
        NAMED.put("log", LogLink::new);
        NAMED.put("identity", IdentityLink::new);
        NAMED.put("inverse_power", InversePowerLink::new);
        NAMED.put("inverse_squared", InverseSquaredLink::new);
        NAMED.put("sqrt", SqrtLink::new);
        NAMED.put("nbinom", NegativeBinomialLink::new);
    }

    private Links() {
    }

    /**
     * Returns the names accepted without parameters.
     *
     * @return the plain link names
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(NAMED.keySet());
    }

    /**
     * Resolves a link by name.
     *
     * @param name the link name, optionally with a parameter, e.g. {@code power(2)}
     * @return a new link instance
     * @throws IllegalArgumentException if the name is unknown or the parameter is invalid
     */
    public static Link byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Link name cannot be empty");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);

        Supplier<Link> supplier = NAMED.get(key);
        if (supplier != null) {
            return supplier.get();
        }

        Matcher matcher = PARAMETERIZED.matcher(key);
        if (matcher.matches()) {
            String base = matcher.group(1);
            double parameter = parseParameter(name, matcher.group(2));
            switch (base) {
                case "power":
                    return new PowerLink(parameter);
                case "nbinom":
                    return new NegativeBinomialLink(parameter);
                default:
                    break;
            }
        }
        throw new IllegalArgumentException(
            "Unknown link '" + name + "', expected one of " + NAMED.keySet() + ", power(p) or nbinom(alpha)");
    }

    private static double parseParameter(String name, String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid parameter in link '" + name + "': " + text, e);
        }
    }
}
