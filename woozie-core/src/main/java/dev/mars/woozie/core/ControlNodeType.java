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

package dev.mars.woozie.core;

/**
 * Reserved action types for the control nodes synthesized by the compiler.
 * Any other action type is a user type resolved against the action-type catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public enum ControlNodeType {
    START("start"),
    END("end"),
    FORK("fork"),
    JOIN("join");

    private final String typeName;

    ControlNodeType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * Looks up the control type for an action type name.
     *
     * @param actionType the action type
     * @return the control type, or null for ordinary action types
     */
    public static ControlNodeType fromTypeName(String actionType) {
        for (ControlNodeType type : values()) {
            if (type.typeName.equals(actionType)) {
                return type;
            }
        }
        return null;
    }

    public static boolean isControlType(String actionType) {
        return fromTypeName(actionType) != null;
    }
}
