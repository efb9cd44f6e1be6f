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
 * Thrown when the error handler cannot be routed from exactly one exit node.
 */
public class MultipleErrorTargetsException extends WorkflowGraphException {

    public MultipleErrorTargetsException(String message, Collection<String> nodeNames) {
        super(GraphErrorKind.MULTIPLE_ERROR_TARGETS, message, nodeNames);
    }

    public MultipleErrorTargetsException(String message, String nodeName) {
        this(message, List.of(nodeName));
    }
}
