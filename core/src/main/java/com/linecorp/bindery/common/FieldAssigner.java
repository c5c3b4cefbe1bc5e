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

import javax.annotation.Nullable;

/**
 * Assigns bound values to the fields of a destination of type {@code T}, addressing each field
 * by an identifier. A {@link FieldAssigner} is consulted once when a binder is built, to check
 * that every field exists and accepts the coerced Java type, and then on every bind.
 *
 * @param <T> the destination type
 *
 * @see FieldTable
 * @see FieldAssigners
 */
public interface FieldAssigner<T> {

    /**
     * Returns the type of the values the specified field accepts, or {@code null} if this
     * assigner has no such field.
     */
    @Nullable
    Class<?> fieldType(String field);

    /**
     * Assigns {@code value} to the specified field of {@code target}.
     */
    void assign(T target, String field, Object value);
}
