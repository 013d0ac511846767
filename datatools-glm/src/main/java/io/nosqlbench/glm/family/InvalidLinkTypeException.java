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

import io.nosqlbench.glm.links.Link;

/**
 * Raised when the object supplied as a family's link is not a {@link Link}.
 */
public class InvalidLinkTypeException extends FamilyConfigurationException {

    private final transient Object supplied;

    public InvalidLinkTypeException(Object supplied) {
        super("The input should be a valid Link object, got: "
            + (supplied == null ? "null" : supplied.getClass().getName()));
        this.supplied = supplied;
    }

    /**
     * @return the rejected object, possibly null
     */
    public Object getSupplied() {
        return supplied;
    }
}
