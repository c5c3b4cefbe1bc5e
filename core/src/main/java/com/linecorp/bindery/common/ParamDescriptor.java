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
 * Declares one expected input of a request: where it is found, how it is typed, whether it is
 * required, its default value and the destination field it is bound to.
 *
 * <p>The location is kept as it was declared, so that a descriptor with an unknown location can
 * still be built; such a descriptor is reported as a configuration error when it is bound.
 *
 * <pre>{@code
 * ParamDescriptor tags =
 *         ParamDescriptor.builder(ParamLocation.QUERY, "tags")
 *                        .schema(ValueSchema.arrayOf(ValueSchema.of(ParamType.STRING),
 *                                                    CollectionFormat.PIPES))
 *                        .field("Tags")
 *                        .build();
 * }</pre>
 */
public final class ParamDescriptor {

    /**
     * Returns a new {@link Builder} for a parameter named {@code name} at the specified location.
     */
    public static Builder builder(ParamLocation location, String name) {
        return new Builder(requireNonNull(location, "location").value(), name);
    }

    /**
     * Returns a new {@link Builder} for a parameter named {@code name} at the location declared
     * as text, e.g. {@code "query"} or {@code "formData"}.
     */
    public static Builder builder(String in, String name) {
        return new Builder(in, name);
    }

    private final String name;
    private final String in;
    @Nullable
    private final ParamLocation location;
    @Nullable
    private final ValueSchema schema;
    private final boolean required;
    @Nullable
    private final String defaultValue;
    private final String field;

    private ParamDescriptor(Builder builder) {
        name = builder.name;
        in = builder.in;
        location = ParamLocation.find(in);
        schema = builder.schema;
        required = builder.required != null ? builder.required : location == ParamLocation.PATH;
        defaultValue = builder.defaultValue;
        field = builder.field != null ? builder.field : name;
    }

    /**
     * Returns the wire name of this parameter.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the location of this parameter as it was declared.
     */
    public String in() {
        return in;
    }

    /**
     * Returns the {@link ParamLocation} of this parameter, or {@code null} if the declared
     * location is not a known one.
     */
    @Nullable
    public ParamLocation location() {
        return location;
    }

    /**
     * Returns the {@link ValueSchema} of this parameter, or {@code null} if no type was declared.
     * A {@link ParamLocation#FILE} parameter does not need one.
     */
    @Nullable
    public ValueSchema schema() {
        return schema;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Returns the default value in the form a client would send it, or {@code null}.
     * A default of a {@link ParamLocation#BODY} parameter is JSON text.
     */
    @Nullable
    public String defaultValue() {
        return defaultValue;
    }

    /**
     * Returns the identifier of the destination field this parameter is bound to.
     */
    public String field() {
        return field;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParamDescriptor)) {
            return false;
        }
        final ParamDescriptor that = (ParamDescriptor) o;
        return required == that.required &&
               name.equals(that.name) &&
               in.equals(that.in) &&
               Objects.equals(schema, that.schema) &&
               Objects.equals(defaultValue, that.defaultValue) &&
               field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, in, schema, required, defaultValue, field);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("in", in)
                          .add("schema", schema)
                          .add("required", required)
                          .add("defaultValue", defaultValue)
                          .add("field", field)
                          .toString();
    }

    /**
     * Builds a {@link ParamDescriptor}.
     */
    public static final class Builder {
        private final String in;
        private final String name;
        @Nullable
        private ValueSchema schema;
        @Nullable
        private Boolean required;
        @Nullable
        private String defaultValue;
        @Nullable
        private String field;

        private Builder(String in, String name) {
            this.in = requireNonNull(in, "in");
            this.name = requireNonNull(name, "name");
        }

        /**
         * Sets the {@link ValueSchema} of the parameter.
         */
        public Builder schema(ValueSchema schema) {
            this.schema = requireNonNull(schema, "schema");
            return this;
        }

        /**
         * Sets the type of the parameter without a format.
         */
        public Builder type(ParamType type) {
            return schema(ValueSchema.of(type));
        }

        /**
         * Sets the type and the format of the parameter.
         */
        public Builder type(ParamType type, String format) {
            return schema(ValueSchema.of(type, requireNonNull(format, "format")));
        }

        /**
         * Declares the parameter as an array of {@code items} encoded in the specified
         * {@link CollectionFormat}.
         */
        public Builder arrayOf(ValueSchema items, CollectionFormat collectionFormat) {
            return schema(ValueSchema.arrayOf(items, collectionFormat));
        }

        /**
         * Sets whether the parameter is required. A {@link ParamLocation#PATH} parameter is
         * required by default; others are optional by default.
         */
        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        /**
         * Sets the value used when the parameter is absent, in the form a client would send it.
         */
        public Builder defaultValue(String defaultValue) {
            this.defaultValue = requireNonNull(defaultValue, "defaultValue");
            return this;
        }

        /**
         * Sets the identifier of the destination field. Defaults to the wire name.
         */
        public Builder field(String field) {
            requireNonNull(field, "field");
            checkArgument(!field.isEmpty(), "field is empty");
            this.field = field;
            return this;
        }

        public ParamDescriptor build() {
            return new ParamDescriptor(this);
        }
    }
}
