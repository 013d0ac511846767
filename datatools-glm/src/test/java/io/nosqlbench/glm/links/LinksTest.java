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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for resolving links by configuration name.
 */
@Tag("unit")
public class LinksTest {

    @Test
    void resolvesPlainNames() {
        assertThat(Links.byName("logit")).isInstanceOf(LogitLink.class);
        assertThat(Links.byName("PROBIT")).isInstanceOf(ProbitLink.class);
        assertThat(Links.byName(" cloglog ")).isInstanceOf(CLogLogLink.class);
        assertThat(Links.byName("inverse_power")).isInstanceOf(InversePowerLink.class);
        assertThat(Links.byName("sqrt")).isInstanceOf(SqrtLink.class);
        assertThat(Links.byName("nbinom")).isEqualTo(new NegativeBinomialLink(1.0));
    }

    @Test
    void resolvesParameterizedNames() {
        assertThat(Links.byName("power(2)")).isEqualTo(new PowerLink(2.0));
        assertThat(Links.byName("power( -0.5 )")).isEqualTo(new PowerLink(-0.5));
        assertThat(Links.byName("nbinom(0.25)")).isEqualTo(new NegativeBinomialLink(0.25));
    }

    @Test
    void namesRoundTripThroughRegistry() {
        for (String name : Links.names()) {
            Link link = Links.byName(name);
            assertThat(Links.byName(link.name())).isEqualTo(link);
        }
        Link power = new PowerLink(3.0);
        assertThat(Links.byName(power.name())).isEqualTo(power);
    }

    @Test
    void rejectsUnknownOrMalformedNames() {
        assertThatThrownBy(() -> Links.byName("softmax"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("softmax");
        assertThatThrownBy(() -> Links.byName("power(x)"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Links.byName(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
