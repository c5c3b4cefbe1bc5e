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

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A property of an object value: its JSON member name, the destination field it is assigned to,
 * whether it is required, and its {@link ValueSchema}.
 */
public final class PropertyDescriptor {

    /**
     * Returns an optional property whose destination field has the same name as the JSON member.
     */
    public static PropertyDescriptor of(String name, ValueSchema schema) {
        return new PropertyDescriptor(name, name, false, schema);
    }

    /**
     * Returns a required property whose destination field has the same name as the JSON member.
     */
    public static PropertyDescriptor required(String name, ValueSchema schema) {
        return new PropertyDescriptor(name, name, true, schema);
    }

    private final String name;
    private final String field;
    private final boolean required;
    private final ValueSchema schema;

    private PropertyDescriptor(String name, String field, boolean required, ValueSchema schema) {
        requireNonNull(name, "name");
        requireNonNull(field, "field");
        checkArgument(!name.isEmpty(), "name is empty");
        checkArgument(!field.isEmpty(), "field is empty");
        this.name = name;
        this.field = field;
        this.required = required;
        this.schema = requireNonNull(schema, "schema");
    }

    /**
     * Returns a copy of this property which is assigned to the specified destination field.
     */
    public PropertyDescriptor withField(String field) {
        return new PropertyDescriptor(name, field, required, schema);
    }

    public String name() {
        return name;
    }

    public String field() {
        return field;
    }

    public boolean isRequired() {
        return required;
    }

    public ValueSchema schema() {
        return schema;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyDescriptor)) {
            return false;
        }
        final PropertyDescriptor that = (PropertyDescriptor) o;
        return required == that.required &&
               name.equals(that.name) &&
               field.equals(that.field) &&
               schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, field, required, schema);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("field", field)
                          .add("required", required)
                          .add("schema", schema)
                          .toString();
    }
}
