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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FamilyKindTest {

    @ParameterizedTest
    @EnumSource(FamilyKind.class)
    void createUsesDefaultLink(FamilyKind kind) {
        Family family = kind.create();
        assertEquals(kind.familyName(), family.name());
        assertEquals(kind.defaultLink().getClass(), family.link().getClass());
        assertEquals(kind, FamilyKind.byName(family.name()));
    }

    @Test
    void onlyNegativeBinomialTakesAlpha() {
        for (FamilyKind kind : FamilyKind.values()) {
            assertEquals(kind == FamilyKind.NEGATIVE_BINOMIAL, kind.hasAlpha(), kind.name());
        }
        Family nb = FamilyKind.NEGATIVE_BINOMIAL.create(FamilyKind.NEGATIVE_BINOMIAL.defaultLink(), 2.5);
        assertEquals(2.5, ((NegativeBinomial) nb).getAlpha(), 0.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"negative_binomial", "Negative-Binomial", "negativebinomial", " NEGATIVE_BINOMIAL "})
    void byNameToleratesSpelling(String name) {
        assertEquals(FamilyKind.NEGATIVE_BINOMIAL, FamilyKind.byName(name));
    }

    @Test
    void byNameResolvesQuasiPoisson() {
        assertEquals(FamilyKind.QUASI_POISSON, FamilyKind.byName("quasipoisson"));
        assertEquals(FamilyKind.QUASI_POISSON, FamilyKind.byName("quasi-poisson"));
    }

    @Test
    void byNameRejectsUnknown() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FamilyKind.byName("tweedie"));
        assertTrue(e.getMessage().contains("poisson"));
        assertThrows(IllegalArgumentException.class, () -> FamilyKind.byName(" "));
        assertThrows(IllegalArgumentException.class, () -> FamilyKind.byName(null));
    }
}
