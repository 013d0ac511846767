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

/**
 * Raised when a family cannot be built from the supplied configuration.
 *
 * <p>Configuration errors are fatal and surface at construction time, never
 * while evaluating deviance or residuals.
 */
public class FamilyConfigurationException extends IllegalArgumentException {

    public FamilyConfigurationException(String message) {
        super(message);
    }
}
