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

/**
 * Identity transform, the power link with exponent 1.
 */
public class IdentityLink extends PowerLink {

    public IdentityLink() {
        super(1.0, "identity");
    }

    @Override
    public double link(double mu) {
        return mu;
    }

    @Override
    public double inverse(double eta) {
        return eta;
    }

    @Override
    public double deriv(double mu) {
        return 1.0;
    }

    @Override
    public double deriv2(double mu) {
        return 0.0;
    }

    @Override
    public double inverseDeriv(double eta) {
        return 1.0;
    }
}
