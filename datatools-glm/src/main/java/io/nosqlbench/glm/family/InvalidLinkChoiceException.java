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

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Raised when a link is valid in itself but not among the links a family accepts.
 */
public class InvalidLinkChoiceException extends FamilyConfigurationException {

    private final String familyName;
    private final transient Set<Class<? extends Link>> allowedLinks;

    public InvalidLinkChoiceException(String familyName, Link link, Set<Class<? extends Link>> allowedLinks) {
        super(String.format("Invalid link for family %s, should be in %s. (got %s)",
            familyName, describe(allowedLinks), link.name()));
        this.familyName = familyName;
        this.allowedLinks = allowedLinks;
    }

    private static String describe(Set<Class<? extends Link>> allowed) {
        return allowed.stream()
            .map(Class::getSimpleName)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    public String getFamilyName() {
        return familyName;
    }

    public Set<Class<? extends Link>> getAllowedLinks() {
        return allowedLinks;
    }
}
