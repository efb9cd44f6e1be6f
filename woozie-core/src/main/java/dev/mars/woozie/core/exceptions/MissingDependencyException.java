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

import java.util.Collection;
import java.util.List;

/**
 * Thrown when an action depends on a name that no action in the workflow carries.
 * The node names are the unresolved dependency names.
 */
public class MissingDependencyException extends WorkflowGraphException {

    public MissingDependencyException(String message, Collection<String> nodeNames) {
        super(GraphErrorKind.MISSING_DEPENDENCY, message, nodeNames);
    }

    public MissingDependencyException(String message, String nodeName) {
        this(message, List.of(nodeName));
    }
}
