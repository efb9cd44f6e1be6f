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

package dev.mars.woozie.emit;

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.exceptions.MalformedConfigException;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Projects the configuration payload of an ordinary action into its
 * action-type element.
 *
 * <p>The first config entry names the element; its value holds the element
 * attributes, where {@code xmlns} sets the element namespace. Each remaining
 * entry becomes child content:</p>
 * <ul>
 *   <li>a list: one child per item, all with the entry name</li>
 *   <li>{@code configuration}: a block of {@code property} name/value pairs,
 *       taken from a nested {@code properties} map when present</li>
 *   <li>anything else: one child holding the value as text</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ActionElementProjector {

    static final String CONFIGURATION_FIELD = "configuration";
    static final String PROPERTIES_FIELD = "properties";
    private static final String XMLNS = "xmlns";

    /**
     * Creates the action-type element for an action.
     *
     * @param document the owning document
     * @param action the action to project
     * @param parentNamespace namespace used when the payload declares none
     * @return the detached element, ready to append to the {@code action} element
     * @throws MalformedConfigException if the payload is missing or mis-shaped
     */
    public Element project(Document document, Action action, String parentNamespace) throws MalformedConfigException {
        Map<String, Object> config = action.getConfig();
        if (config.isEmpty()) {
            throw new MalformedConfigException("Action has no configuration payload", action.getName());
        }

        try {
            Iterator<Map.Entry<String, Object>> entries = config.entrySet().iterator();
            Map.Entry<String, Object> head = entries.next();
            Map<?, ?> attributes = attributesOf(action, head);

            Object declaredNamespace = attributes.get(XMLNS);
            String namespace = declaredNamespace != null ? declaredNamespace.toString() : parentNamespace;

            Element element = document.createElementNS(namespace, head.getKey());
            for (Map.Entry<?, ?> attribute : attributes.entrySet()) {
                String attributeName = String.valueOf(attribute.getKey());
                String value = scalarText(action, attributeName, attribute.getValue());
                if (XMLNS.equals(attributeName)) {
                    element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLNS, value);
                } else {
                    element.setAttribute(attributeName, value);
                }
            }

            while (entries.hasNext()) {
                Map.Entry<String, Object> entry = entries.next();
                appendField(document, element, namespace, action, entry.getKey(), entry.getValue());
            }
            return element;
        } catch (DOMException e) {
            throw new MalformedConfigException("Configuration payload is not valid markup: " + e.getMessage(),
                    action.getName());
        }
    }

    private Map<?, ?> attributesOf(Action action, Map.Entry<String, Object> head) throws MalformedConfigException {
        Object value = head.getValue();
        if (value == null || "".equals(value)) {
            return Map.of();
        }
        if (value instanceof Map) {
            return (Map<?, ?>) value;
        }
        throw new MalformedConfigException("Element '" + head.getKey()
                + "' must map to its attributes, found " + value.getClass().getSimpleName(), action.getName());
    }

    private void appendField(Document document, Element parent, String namespace, Action action,
                             String field, Object value) throws MalformedConfigException {
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                appendText(document, parent, namespace, field, scalarText(action, field, item));
            }
        } else if (CONFIGURATION_FIELD.equals(field)) {
            parent.appendChild(configurationBlock(document, namespace, action, value));
        } else {
            appendText(document, parent, namespace, field, scalarText(action, field, value));
        }
    }

    private Element configurationBlock(Document document, String namespace, Action action, Object value)
            throws MalformedConfigException {
        if (!(value instanceof Map)) {
            throw new MalformedConfigException("Field 'configuration' must be a map of properties", action.getName());
        }

        Map<?, ?> properties = (Map<?, ?>) value;
        Object nested = properties.get(PROPERTIES_FIELD);
        if (properties.size() == 1 && nested instanceof Map) {
            properties = (Map<?, ?>) nested;
        }

        Element configuration = document.createElementNS(namespace, CONFIGURATION_FIELD);
        for (Map.Entry<?, ?> property : properties.entrySet()) {
            String propertyName = String.valueOf(property.getKey());
            Element propertyElement = document.createElementNS(namespace, "property");
            appendText(document, propertyElement, namespace, "name", propertyName);
            appendText(document, propertyElement, namespace, "value",
                    scalarText(action, CONFIGURATION_FIELD + "." + propertyName, property.getValue()));
            configuration.appendChild(propertyElement);
        }
        return configuration;
    }

    private void appendText(Document document, Element parent, String namespace, String name, String text) {
        Element child = document.createElementNS(namespace, name);
        child.setTextContent(text);
        parent.appendChild(child);
    }

    private String scalarText(Action action, String field, Object value) throws MalformedConfigException {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            throw new MalformedConfigException("Field '" + field + "' must be a scalar value", action.getName());
        }
        return value.toString();
    }
}
