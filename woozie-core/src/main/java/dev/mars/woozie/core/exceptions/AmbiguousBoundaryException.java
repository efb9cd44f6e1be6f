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
 * Thrown when the composed graph has no unique entry for {@code start} or no
 * unique exit for {@code end}.
 */
public class AmbiguousBoundaryException extends WorkflowGraphException {

    public AmbiguousBoundaryException(String message, Collection<String> nodeNames) {
        super(GraphErrorKind.AMBIGUOUS_BOUNDARY, message, nodeNames);
    }

    public AmbiguousBoundaryException(String message, String nodeName) {
        this(message, List.of(nodeName));
    }
}
