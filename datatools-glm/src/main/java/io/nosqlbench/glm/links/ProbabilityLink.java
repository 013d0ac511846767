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

import io.nosqlbench.glm.special.FamilyArrays;

/**
 * Base for links whose mean is a probability.
 *
 * <p>Means are clamped into {@code [eps, 1-eps]} before the forward transform
 * and its derivatives, which keeps logits and quantiles finite at the
 * boundaries. Families treat every probability link as range-preserving.
 */
public abstract class ProbabilityLink implements Link {

    @Override
    public double clip(double mu) {
        return FamilyArrays.clip(mu, FamilyArrays.FLOAT_EPS, 1.0 - FamilyArrays.FLOAT_EPS);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
