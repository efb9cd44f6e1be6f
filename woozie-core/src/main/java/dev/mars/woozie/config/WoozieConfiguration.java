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

package dev.mars.woozie.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Woozie compiler.
 * Layers built-in defaults, a {@code woozie.properties} file, and
 * {@code woozie.*} system properties, in increasing precedence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class WoozieConfiguration {
    private static final Logger logger = Logger.getLogger(WoozieConfiguration.class.getName());

    public static final String WORKFLOW_NAMESPACE = "woozie.workflow.namespace";
    public static final String OUTPUT_FILE = "woozie.output.file";
    public static final String OUTPUT_INDENT = "woozie.output.indent";
    public static final String GRAPH_EXPORT_ENABLED = "woozie.graph.export.enabled";
    public static final String GRAPH_RAW_FILE = "woozie.graph.raw.file";
    public static final String GRAPH_STRUCTURED_FILE = "woozie.graph.structured.file";
    public static final String ERROR_HANDLER_NAME = "woozie.error.handler.name";

    // Default configuration values
    private static final String DEFAULT_WORKFLOW_NAMESPACE = "uri:oozie:workflow:1.0";
    private static final String DEFAULT_OUTPUT_FILE = "workflow.xml";
    private static final int DEFAULT_OUTPUT_INDENT = 2;
    private static final String DEFAULT_GRAPH_RAW_FILE = "workflow-definition-dag.dot";
    private static final String DEFAULT_GRAPH_STRUCTURED_FILE = "oozie-workflow-dag.dot";
    private static final String DEFAULT_ERROR_HANDLER_NAME = "error_handler";

    private final Properties properties;

    public WoozieConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public WoozieConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Document configuration
    public String getWorkflowNamespace() {
        return getStringProperty(WORKFLOW_NAMESPACE, DEFAULT_WORKFLOW_NAMESPACE);
    }

    public String getOutputFileName() {
        return getStringProperty(OUTPUT_FILE, DEFAULT_OUTPUT_FILE);
    }

    public int getOutputIndent() {
        return getIntProperty(OUTPUT_INDENT, DEFAULT_OUTPUT_INDENT);
    }

    // Graph visualisation
    public boolean isGraphExportEnabled() {
        return getBooleanProperty(GRAPH_EXPORT_ENABLED, false);
    }

    public String getRawGraphFileName() {
        return getStringProperty(GRAPH_RAW_FILE, DEFAULT_GRAPH_RAW_FILE);
    }

    public String getStructuredGraphFileName() {
        return getStringProperty(GRAPH_STRUCTURED_FILE, DEFAULT_GRAPH_STRUCTURED_FILE);
    }

    // Definition loading
    public String getErrorHandlerName() {
        return getStringProperty(ERROR_HANDLER_NAME, DEFAULT_ERROR_HANDLER_NAME);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(WORKFLOW_NAMESPACE, DEFAULT_WORKFLOW_NAMESPACE);
        properties.setProperty(OUTPUT_FILE, DEFAULT_OUTPUT_FILE);
        properties.setProperty(OUTPUT_INDENT, String.valueOf(DEFAULT_OUTPUT_INDENT));
        properties.setProperty(GRAPH_EXPORT_ENABLED, "false");
        properties.setProperty(GRAPH_RAW_FILE, DEFAULT_GRAPH_RAW_FILE);
        properties.setProperty(GRAPH_STRUCTURED_FILE, DEFAULT_GRAPH_STRUCTURED_FILE);
        properties.setProperty(ERROR_HANDLER_NAME, DEFAULT_ERROR_HANDLER_NAME);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "woozie.properties",
                "config/woozie.properties",
                System.getProperty("user.home") + "/.woozie/woozie.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("woozie.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("woozie."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "WoozieConfiguration{" +
                "workflowNamespace='" + getWorkflowNamespace() + '\'' +
                ", outputFile='" + getOutputFileName() + '\'' +
                ", outputIndent=" + getOutputIndent() +
                ", graphExportEnabled=" + isGraphExportEnabled() +
                '}';
    }
}
