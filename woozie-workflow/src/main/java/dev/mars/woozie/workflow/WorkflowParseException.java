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

package dev.mars.woozie.workflow;

import dev.mars.woozie.core.exceptions.WoozieException;

/**
 * Exception thrown when a workflow definition or an action-type configuration
 * cannot be read, parsed, or turned into actions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class WorkflowParseException extends WoozieException {

    private final String source;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(null, fieldPath, message, null);
    }

    public WorkflowParseException(String source, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.fieldPath = fieldPath;
    }

    /**
     * The file or document the problem was found in, if known.
     */
    public String getSource() {
        return source;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * Copies this exception with the given source, keeping field path and cause.
     */
    public WorkflowParseException withSource(String source) {
        return new WorkflowParseException(source, fieldPath, super.getMessage(), getCause());
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (source != null) {
            sb.append(source).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
