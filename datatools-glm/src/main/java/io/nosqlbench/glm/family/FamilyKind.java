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
import io.nosqlbench.glm.links.LogitLink;

import java.util.Arrays;
import java.util.Locale;

/**
 * The closed set of supported families, with validating factories.
 *
 * <p>{@link #create(Object)} accepts an untyped link, as it arrives from
 * configuration or reflection, and rejects anything that is not a
 * {@link Link} with {@link InvalidLinkTypeException} before the family
 * constructor checks the allowed set.
 *
 * <pre>{@code
 * Family poisson = FamilyKind.POISSON.create();
 * Family probit = FamilyKind.BINOMIAL.create(new ProbitLink());
 * Family nb = FamilyKind.NEGATIVE_BINOMIAL.create(new LogLink(), 0.5);
 * }</pre>
 */
public enum FamilyKind {

    POISSON("poisson") {
        @Override
        public Link defaultLink() {
            return new LogLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new Poisson(link);
        }
    },

    QUASI_POISSON("quasi_poisson") {
        @Override
        public Link defaultLink() {
            return new LogLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new QuasiPoisson(link);
        }
    },

    GAUSSIAN("gaussian") {
        @Override
        public Link defaultLink() {
            return new IdentityLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new Gaussian(link);
        }
    },

    GAMMA("gamma") {
        @Override
        public Link defaultLink() {
            return new InversePowerLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new Gamma(link);
        }
    },

    BINOMIAL("binomial") {
        @Override
        public Link defaultLink() {
            return new LogitLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new Binomial(link);
        }
    },

    NEGATIVE_BINOMIAL("negative_binomial") {
        @Override
        public Link defaultLink() {
            return new LogLink();
        }

        @Override
        Family build(Link link, double alpha) {
            return new NegativeBinomial(link, alpha);
        }

        @Override
        public boolean hasAlpha() {
            return true;
        }
    };

    private final String familyName;

    FamilyKind(String familyName) {
        this.familyName = familyName;
    }

    /**
     * @return the configuration name, e.g. {@code negative_binomial}
     */
    public String familyName() {
        return familyName;
    }

    /**
     * @return a new instance of the default link for this family
     */
    public abstract Link defaultLink();

    abstract Family build(Link link, double alpha);

    /**
     * @return true if the family takes a dispersion parameter
     */
    public boolean hasAlpha() {
        return false;
    }

    /**
     * Creates the family with its default link.
     *
     * @return the family
     */
    public Family create() {
        return build(defaultLink(), NegativeBinomial.DEFAULT_ALPHA);
    }

    /**
     * Creates the family with the given link.
     *
     * @param link the link object
     * @return the family
     * @throws InvalidLinkTypeException if {@code link} is null or not a {@link Link}
     * @throws InvalidLinkChoiceException if the family does not accept the link
     */
    public Family create(Object link) {
        return create(link, NegativeBinomial.DEFAULT_ALPHA);
    }

    /**
     * Creates the family with the given link and dispersion.
     *
     * @param link the link object
     * @param alpha the dispersion, used only by {@link #NEGATIVE_BINOMIAL}
     * @return the family
     * @throws InvalidLinkTypeException if {@code link} is null or not a {@link Link}
     * @throws InvalidLinkChoiceException if the family does not accept the link
     */
    public Family create(Object link, double alpha) {
        if (!(link instanceof Link)) {
            throw new InvalidLinkTypeException(link);
        }
        return build((Link) link, alpha);
    }

    /**
     * Resolves a family by configuration name. Case, hyphens and the
     * {@code quasipoisson}/{@code negativebinomial} spellings are tolerated.
     *
     * @param name the family name
     * @return the family kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FamilyKind byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Family name cannot be empty");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FamilyKind kind : values()) {
            if (kind.familyName.equals(key) || kind.familyName.replace("_", "").equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown family '" + name + "', expected one of "
            + Arrays.stream(values()).map(FamilyKind::familyName).toList());
    }
}
