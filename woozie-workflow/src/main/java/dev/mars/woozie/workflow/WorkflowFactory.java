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

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.Workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns a parsed workflow definition into the {@link Workflow} the compiler
 * consumes. Each action's payload is the configuration template of its type
 * with placeholders filled from the action parameters and workflow variables.
 */
public class WorkflowFactory {

    private static final Logger logger = Logger.getLogger(WorkflowFactory.class.getName());

    private final String errorHandlerName;

    public WorkflowFactory() {
        this(YamlWorkflowDefinitionParser.ERROR_HANDLER_NAME);
    }

    public WorkflowFactory(String errorHandlerName) {
        this.errorHandlerName = errorHandlerName;
    }

    /**
     * Builds the workflow.
     *
     * @param definition the parsed workflow definition
     * @param catalog    the action types available to it
     * @return the workflow, with the entry named after the error handler separated out
     * @throws WorkflowParseException if an action type is unknown, a placeholder
     *                                cannot be filled or an action name is invalid
     */
    public Workflow build(WorkflowDefinition definition, ActionTypeCatalog catalog) throws WorkflowParseException {
        PlaceholderResolver resolver = new PlaceholderResolver(definition.getVariables());

        List<Action> actions = new ArrayList<>();
        Action errorHandler = null;

        for (WorkflowDefinition.ActionDefinition actionDefinition : definition.getActions().values()) {
            Action action = buildAction(actionDefinition, catalog, resolver);
            if (action.getName().equals(errorHandlerName)) {
                errorHandler = new Action(action.getName(), action.getActionType(), List.of(), action.getConfig());
            } else {
                actions.add(action);
            }
        }

        try {
            Workflow workflow = new Workflow(definition.getName(), actions, errorHandler);
            logger.fine("Built workflow '" + workflow.getName() + "' with " + actions.size() + " actions"
                    + (errorHandler != null ? " and error handler '" + errorHandler.getName() + "'" : ""));
            return workflow;
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("actions", e.getMessage());
        }
    }

    private Action buildAction(WorkflowDefinition.ActionDefinition actionDefinition, ActionTypeCatalog catalog,
                               PlaceholderResolver resolver) throws WorkflowParseException {
        String path = "actions." + actionDefinition.getName();
        Map<String, Object> template;
        try {
            template = catalog.fetch(actionDefinition.getType());
        } catch (WorkflowParseException e) {
            throw new WorkflowParseException(null, path + ".type", e.getMessage(), e);
        }

        Map<String, Object> config;
        try {
            config = resolver.withContext(actionDefinition.getParameters()).resolve(template);
        } catch (PlaceholderResolver.PlaceholderResolutionException e) {
            throw new WorkflowParseException(null, path + ".parameters", e.getMessage(), e);
        }

        try {
            return new Action(actionDefinition.getName(), actionDefinition.getType(),
                    actionDefinition.getDependencies(), config);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage());
        }
    }
}
