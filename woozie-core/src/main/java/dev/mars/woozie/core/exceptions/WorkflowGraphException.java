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
import java.util.Objects;

/**
 * Thrown when a workflow cannot be turned into a structured control-flow graph
 * or serialized into a workflow document.
 *
 * <p>Every failure carries the {@link GraphErrorKind} that was violated and the
 * names of the offending nodes so the caller can fix the source definition.
 * All of these failures abort the current compilation; no partial document is
 * ever produced.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class WorkflowGraphException extends WoozieException {

    private final GraphErrorKind kind;
    private final List<String> nodeNames;

    public WorkflowGraphException(GraphErrorKind kind, String message, Collection<String> nodeNames) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.nodeNames = nodeNames != null ? List.copyOf(nodeNames) : List.of();
    }

    public GraphErrorKind getKind() {
        return kind;
    }

    /**
     * Names of the nodes involved in the failure, in the order they were found.
     */
    public List<String> getNodeNames() {
        return nodeNames;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getDescription()).append(": ").append(super.getMessage());
        if (!nodeNames.isEmpty()) {
            sb.append(" ").append(nodeNames);
        }
        return sb.toString();
    }
}
