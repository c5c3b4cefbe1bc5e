/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.bindery.common;

import static java.util.Objects.requireNonNull;

import java.util.Map;

import com.google.common.primitives.Primitives;

/**
 * Provides common {@link FieldAssigner}s and the type checks shared by binders.
 */
public final class FieldAssigners {

    private static final FieldAssigner<Map<String, Object>> MAP = new FieldAssigner<Map<String, Object>>() {
        @Override
        public Class<?> fieldType(String field) {
            return Object.class;
        }

        @Override
        public void assign(Map<String, Object> target, String field, Object value) {
            target.put(field, value);
        }

        @Override
        public String toString() {
            return "FieldAssigners.ofMap()";
        }
    };

    /**
     * Returns a {@link FieldAssigner} which accepts any field and puts values into a {@link Map}
     * keyed by the field identifier.
     */
    public static FieldAssigner<Map<String, Object>> ofMap() {
        return MAP;
    }

    /**
     * Ensures that {@code assigner} has the specified field and that the field accepts values of
     * {@code valueType}.
     *
     * @throws IllegalArgumentException if the field is unknown or has an incompatible type
     */
    public static void checkAssignable(FieldAssigner<?> assigner, String field, Class<?> valueType) {
        requireNonNull(assigner, "assigner");
        requireNonNull(field, "field");
        requireNonNull(valueType, "valueType");
        final Class<?> fieldType = assigner.fieldType(field);
        if (fieldType == null) {
            throw new IllegalArgumentException("unknown field: " + field + " (assigner: " + assigner + ')');
        }
        if (!isAssignable(fieldType, valueType)) {
            throw new IllegalArgumentException(
                    "field '" + field + "' of type '" + fieldType.getSimpleName() +
                    "' cannot accept a value of type '" + valueType.getSimpleName() + '\'');
        }
    }

    private static boolean isAssignable(Class<?> fieldType, Class<?> valueType) {
        return Primitives.wrap(fieldType).isAssignableFrom(valueType);
    }

    private FieldAssigners() {}
}
