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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;

/**
 * A statically typed {@link FieldAssigner} built from a table of field identifiers, value types
 * and setters.
 *
 * <pre>{@code
 * FieldTable<Order> table =
 *         FieldTable.<Order>builder()
 *                   .add("ID", Long.class, Order::setId)
 *                   .add("Tags", List.class, Order::setTags)
 *                   .build();
 * }</pre>
 *
 * @param <T> the destination type
 */
public final class FieldTable<T> implements FieldAssigner<T> {

    /**
     * Returns a new {@link Builder}.
     */
    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    private final Map<String, Entry<T, ?>> entries;

    private FieldTable(Map<String, Entry<T, ?>> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    @Nullable
    @Override
    public Class<?> fieldType(String field) {
        final Entry<T, ?> entry = entries.get(field);
        return entry != null ? entry.type : null;
    }

    @Override
    public void assign(T target, String field, Object value) {
        requireNonNull(target, "target");
        requireNonNull(value, "value");
        final Entry<T, ?> entry = entries.get(field);
        if (entry == null) {
            throw new IllegalArgumentException("unknown field: " + field);
        }
        entry.assign(target, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("fields", entries.keySet())
                          .toString();
    }

    private static final class Entry<T, V> {
        private final Class<V> type;
        private final BiConsumer<? super T, ? super V> setter;

        Entry(Class<V> type, BiConsumer<? super T, ? super V> setter) {
            this.type = type;
            this.setter = setter;
        }

        void assign(T target, Object value) {
            setter.accept(target, type.cast(value));
        }
    }

    /**
     * Builds a {@link FieldTable}.
     */
    public static final class Builder<T> {
        private final Map<String, Entry<T, ?>> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds a field which accepts values of {@code type}. A primitive type is treated as its
         * wrapper type.
         */
        public <V> Builder<T> add(String field, Class<V> type, BiConsumer<? super T, ? super V> setter) {
            requireNonNull(field, "field");
            requireNonNull(type, "type");
            requireNonNull(setter, "setter");
            checkArgument(!field.isEmpty(), "field is empty");
            checkArgument(!entries.containsKey(field), "duplicate field: %s", field);
            entries.put(field, new Entry<>(Primitives.wrap(type), setter));
            return this;
        }

        public FieldTable<T> build() {
            return new FieldTable<>(entries);
        }
    }
}
