package io.nosqlbench.glm.family.config;

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

import io.nosqlbench.glm.family.Family;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses compact family specifications.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code poisson}</li>
 *   <li>{@code binomial(probit)} - a bare first argument is the link</li>
 *   <li>{@code negative_binomial(link=log, alpha=0.5)}</li>
 *   <li>{@code negative_binomial(link=power(2), alpha=1.5)}</li>
 * </ul>
 *
 * <p>Arguments are split on top-level commas only, so parameterized link
 * names keep their parentheses.
 */
public final class FamilySpecParser {

    private FamilySpecParser() {
    }

    /**
     * Parses a specification and builds the family.
     *
     * @param spec the specification
     * @return the family
     * @throws IllegalArgumentException if the specification is malformed or names
     *         an unknown family, link or parameter
     */
    public static Family parse(String spec) {
        return parseConfig(spec).toFamily();
    }

    /**
     * Parses a specification into a config without building the family.
     *
     * @param spec the specification
     * @return the config
     */
    public static FamilyConfig parseConfig(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Family specification cannot be empty");
        }
        spec = spec.trim();

        int open = spec.indexOf('(');
        if (open < 0) {
            return new FamilyConfig(spec, null, null);
        }
        if (!spec.endsWith(")")) {
            throw new IllegalArgumentException("Unbalanced parentheses in family specification: " + spec);
        }

        String family = spec.substring(0, open).trim();
        String body = spec.substring(open + 1, spec.length() - 1).trim();

        String link = null;
        Double alpha = null;
        List<String> args = body.isEmpty() ? List.of() : splitArguments(body);
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i).trim();
            int eq = arg.indexOf('=');
            if (eq < 0) {
                if (i != 0) {
                    throw new IllegalArgumentException("Only the first argument may omit its name: " + spec);
                }
                link = arg;
                continue;
            }
            String key = arg.substring(0, eq).trim();
            String value = arg.substring(eq + 1).trim();
            switch (key) {
                case "link":
                    link = value;
                    break;
                case "alpha":
                    alpha = parseAlpha(value, spec);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown parameter '" + key + "' in: " + spec);
            }
        }
        return new FamilyConfig(family, link, alpha);
    }

    private static Double parseAlpha(String value, String spec) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid alpha '" + value + "' in: " + spec, e);
        }
    }

    private static List<String> splitArguments(String body) {
        List<String> args = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ',' && depth == 0) {
                args.add(body.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in family arguments: " + body);
        }
        args.add(body.substring(start));
        return args;
    }
}
