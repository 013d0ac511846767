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

import io.nosqlbench.glm.family.Binomial;
import io.nosqlbench.glm.family.Family;
import io.nosqlbench.glm.family.Gamma;
import io.nosqlbench.glm.family.NegativeBinomial;
import io.nosqlbench.glm.family.Poisson;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.PowerLink;
import io.nosqlbench.glm.links.ProbitLink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FamilySpecParserTest {

    @Test
    void bareFamilyName() {
        Family family = FamilySpecParser.parse("poisson");
        assertInstanceOf(Poisson.class, family);
        assertEquals(new LogLink(), family.link());
    }

    @Test
    void positionalLink() {
        Family family = FamilySpecParser.parse("binomial(probit)");
        assertInstanceOf(Binomial.class, family);
        assertInstanceOf(ProbitLink.class, family.link());

        assertInstanceOf(Gamma.class, FamilySpecParser.parse(" Gamma ( log ) "));
    }

    @Test
    void namedArgumentsWithNestedParentheses() {
        Family family = FamilySpecParser.parse("negative_binomial(link=power(2), alpha=1.5)");
        NegativeBinomial nb = assertInstanceOf(NegativeBinomial.class, family);
        assertEquals(new PowerLink(2.0), nb.link());
        assertEquals(1.5, nb.getAlpha(), 0.0);
    }

    @Test
    void parsesConfigWithoutBuilding() {
        assertEquals(new FamilyConfig("negative_binomial", null, 0.5),
            FamilySpecParser.parseConfig("negative_binomial(alpha=0.5)"));
        assertEquals(new FamilyConfig("poisson", null, null), FamilySpecParser.parseConfig("poisson()"));
        assertEquals(new FamilyConfig("gaussian", "log", null), FamilySpecParser.parseConfig("gaussian(log)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "poisson(",
        "poisson(log",
        "gaussian(link=power(2)",
        "poisson(log, identity)",
        "poisson(scale=2)",
        "negative_binomial(alpha=abc)",
        "tweedie",
        "poisson(logit)",
        "gaussian(alpha=0.5)"
    })
    void rejectsMalformedSpecifications(String spec) {
        assertThrows(IllegalArgumentException.class, () -> FamilySpecParser.parse(spec));
    }

    @Test
    void invalidAlphaKeepsCause() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> FamilySpecParser.parseConfig("negative_binomial(alpha=abc)"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }
}
