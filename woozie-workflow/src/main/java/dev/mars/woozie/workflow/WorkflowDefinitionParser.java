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

import java.nio.file.Path;

/**
 * Reads workflow definitions and action-type catalogs.
 */
public interface WorkflowDefinitionParser {

    WorkflowDefinition parseDefinition(Path workflowFile) throws WorkflowParseException;

    WorkflowDefinition parseDefinitionFromString(String content) throws WorkflowParseException;

    ActionTypeCatalog parseCatalog(Path configFile) throws WorkflowParseException;

    ActionTypeCatalog parseCatalogFromString(String content) throws WorkflowParseException;

    /**
     * Checks a parsed definition on its own: names, dependencies and the
     * error handler entry.
     *
     * @param definition the definition to check
     * @return validation result
     */
    ValidationResult validate(WorkflowDefinition definition);

    /**
     * Checks a parsed definition and that every action type it uses is in the catalog.
     */
    ValidationResult validate(WorkflowDefinition definition, ActionTypeCatalog catalog);
}
