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

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;

/**
 * The declared type of a parameter value.
 */
public enum ParamType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    FILE;

    private static final Map<String, ParamType> byValue;

    static {
        final ImmutableMap.Builder<String, ParamType> builder = ImmutableMap.builder();
        for (ParamType type : values()) {
            builder.put(type.value(), type);
        }
        byValue = builder.build();
    }

    /**
     * Returns the textual form of this type, e.g. {@code "integer"}.
     */
    public String value() {
        return Ascii.toLowerCase(name());
    }

    /**
     * Returns the {@link ParamType} of the specified textual form, ignoring ASCII case.
     *
     * @throws IllegalArgumentException if {@code value} is not a known type
     */
    public static ParamType of(String value) {
        final ParamType type = find(requireNonNull(value, "value"));
        if (type == null) {
            throw new IllegalArgumentException("unknown parameter type: " + value +
                                               " (expected: " + byValue.keySet() + ')');
        }
        return type;
    }

    /**
     * Returns the {@link ParamType} of the specified textual form, or {@code null} if unknown.
     */
    @Nullable
    public static ParamType find(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return byValue.get(Ascii.toLowerCase(value));
    }
}
