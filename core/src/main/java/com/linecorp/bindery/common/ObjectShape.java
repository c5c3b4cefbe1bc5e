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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Describes how a JSON object is bound into a nested destination: how to create a fresh instance
 * of it, how to assign its fields, and which properties it has.
 *
 * @param <T> the type of the nested destination
 */
public final class ObjectShape<T> {

    /**
     * Returns a new {@link ObjectShape}.
     *
     * @param type the type of the nested destination
     * @param factory creates a new nested destination for every bound object
     * @param assigner assigns the coerced properties to the nested destination
     * @param properties the properties of the object, in binding order
     *
     * @throws IllegalArgumentException if two properties share a field, or a property's coerced
     *                                  type cannot be assigned to its field
     */
    public static <T> ObjectShape<T> of(Class<T> type, Supplier<? extends T> factory,
                                        FieldAssigner<? super T> assigner,
                                        PropertyDescriptor... properties) {
        return of(type, factory, assigner, ImmutableList.copyOf(requireNonNull(properties, "properties")));
    }

    /**
     * Returns a new {@link ObjectShape}.
     *
     * @see #of(Class, Supplier, FieldAssigner, PropertyDescriptor...)
     */
    public static <T> ObjectShape<T> of(Class<T> type, Supplier<? extends T> factory,
                                        FieldAssigner<? super T> assigner,
                                        Iterable<PropertyDescriptor> properties) {
        return new ObjectShape<>(type, factory, assigner, ImmutableList.copyOf(properties));
    }

    private final Class<T> type;
    private final Supplier<? extends T> factory;
    private final FieldAssigner<? super T> assigner;
    private final List<PropertyDescriptor> properties;

    private ObjectShape(Class<T> type, Supplier<? extends T> factory,
                        FieldAssigner<? super T> assigner, List<PropertyDescriptor> properties) {
        this.type = requireNonNull(type, "type");
        this.factory = requireNonNull(factory, "factory");
        this.assigner = requireNonNull(assigner, "assigner");
        this.properties = properties;

        final Set<String> fields = new HashSet<>();
        for (PropertyDescriptor property : properties) {
            if (!fields.add(property.field())) {
                throw new IllegalArgumentException("duplicate field: " + property.field() +
                                                   " (type: " + type.getSimpleName() + ')');
            }
            FieldAssigners.checkAssignable(assigner, property.field(), property.schema().javaType());
        }
    }

    public Class<T> type() {
        return type;
    }

    /**
     * Creates a new nested destination.
     */
    public T newInstance() {
        return requireNonNull(factory.get(), "factory.get() returned null");
    }

    public FieldAssigner<? super T> assigner() {
        return assigner;
    }

    public List<PropertyDescriptor> properties() {
        return properties;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("type", type.getSimpleName())
                          .add("properties", properties)
                          .toString();
    }
}
