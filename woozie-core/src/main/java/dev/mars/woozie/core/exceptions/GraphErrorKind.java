/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.woozie.core.exceptions;

/**
 * The kinds of structural failure a workflow compilation can end with.
 */
public enum GraphErrorKind {

    /** The declared dependencies contain a cycle. */
    CYCLIC_DEPENDENCY("Cyclic dependency"),

    /** A dependency names an action that does not exist. */
    MISSING_DEPENDENCY("Missing dependency"),

    /** A fork/join or sequential splice point has no unique entry or exit. */
    AMBIGUOUS_TRANSITION("Ambiguous transition"),

    /** The error handler cannot be attached to a single exit node. */
    MULTIPLE_ERROR_TARGETS("Multiple error targets"),

    /** The start or end node cannot be attached to a single node. */
    AMBIGUOUS_BOUNDARY("Ambiguous boundary"),

    /** An action payload is missing or mis-shaped at emission time. */
    MALFORMED_CONFIG("Malformed configuration");

    private final String description;

    GraphErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
