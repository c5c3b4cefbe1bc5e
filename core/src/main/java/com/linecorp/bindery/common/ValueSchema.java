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

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * The type, format and structure of a value: a parameter, an item of an array or a property of
 * an object. Arrays and objects nest {@link ValueSchema}s, so the same coercion applies at
 * every level.
 */
public final class ValueSchema {

    public static final String INT32 = "int32";
    public static final String INT64 = "int64";
    public static final String FLOAT = "float";
    public static final String DOUBLE = "double";
    public static final String DATE = "date";
    public static final String DATE_TIME = "date-time";
    public static final String BYTE = "byte";

    /**
     * Returns a {@link ValueSchema} of the specified scalar {@link ParamType} without a format.
     */
    public static ValueSchema of(ParamType type) {
        return of(type, null);
    }

    /**
     * Returns a {@link ValueSchema} of the specified scalar {@link ParamType} and format,
     * e.g. {@code of(INTEGER, "int64")} or {@code of(STRING, "date-time")}.
     */
    public static ValueSchema of(ParamType type, @Nullable String format) {
        requireNonNull(type, "type");
        checkArgument(type != ParamType.ARRAY, "use arrayOf() for an array schema");
        return new ValueSchema(type, format, null, null, null);
    }

    /**
     * Returns a {@link ValueSchema} of an array of {@code items} encoded as {@link CollectionFormat#CSV}.
     */
    public static ValueSchema arrayOf(ValueSchema items) {
        return arrayOf(items, CollectionFormat.CSV);
    }

    /**
     * Returns a {@link ValueSchema} of an array of {@code items} encoded in the specified
     * {@link CollectionFormat}.
     */
    public static ValueSchema arrayOf(ValueSchema items, CollectionFormat collectionFormat) {
        return new ValueSchema(ParamType.ARRAY, null, requireNonNull(collectionFormat, "collectionFormat"),
                               requireNonNull(items, "items"), null);
    }

    /**
     * Returns a {@link ValueSchema} of a free-form object which is bound as a {@link Map}.
     */
    public static ValueSchema object() {
        return new ValueSchema(ParamType.OBJECT, null, null, null, null);
    }

    /**
     * Returns a {@link ValueSchema} of an object which is bound into a new instance of the
     * specified {@link ObjectShape}.
     */
    public static ValueSchema objectOf(ObjectShape<?> shape) {
        return new ValueSchema(ParamType.OBJECT, null, null, null, requireNonNull(shape, "shape"));
    }

    private final ParamType type;
    @Nullable
    private final String format;
    @Nullable
    private final CollectionFormat collectionFormat;
    @Nullable
    private final ValueSchema items;
    @Nullable
    private final ObjectShape<?> shape;

    private ValueSchema(ParamType type, @Nullable String format,
                        @Nullable CollectionFormat collectionFormat,
                        @Nullable ValueSchema items, @Nullable ObjectShape<?> shape) {
        this.type = type;
        this.format = format;
        this.collectionFormat = collectionFormat;
        this.items = items;
        this.shape = shape;
    }

    public ParamType type() {
        return type;
    }

    @Nullable
    public String format() {
        return format;
    }

    /**
     * Returns the {@link CollectionFormat} of an array schema, or {@code null} for other types.
     */
    @Nullable
    public CollectionFormat collectionFormat() {
        return collectionFormat;
    }

    /**
     * Returns the item schema of an array schema, or {@code null} for other types.
     */
    @Nullable
    public ValueSchema items() {
        return items;
    }

    /**
     * Returns the {@link ObjectShape} of an object schema, or {@code null} for a free-form object
     * or a non-object type.
     */
    @Nullable
    public ObjectShape<?> shape() {
        return shape;
    }

    /**
     * Returns a copy of this array schema with the specified {@link CollectionFormat}.
     */
    public ValueSchema withCollectionFormat(CollectionFormat collectionFormat) {
        requireNonNull(collectionFormat, "collectionFormat");
        checkArgument(type == ParamType.ARRAY, "not an array schema: %s", type);
        return new ValueSchema(type, format, collectionFormat, items, shape);
    }

    /**
     * Returns the Java type of the values produced when a value is coerced with this schema.
     */
    public Class<?> javaType() {
        switch (type) {
            case STRING:
                if (DATE.equals(format)) {
                    return LocalDate.class;
                }
                if (DATE_TIME.equals(format)) {
                    return OffsetDateTime.class;
                }
                if (BYTE.equals(format)) {
                    return byte[].class;
                }
                return String.class;
            case INTEGER:
                return INT32.equals(format) ? Integer.class : Long.class;
            case NUMBER:
                return FLOAT.equals(format) ? Float.class : Double.class;
            case BOOLEAN:
                return Boolean.class;
            case ARRAY:
                return List.class;
            case OBJECT:
                return shape != null ? shape.type() : Map.class;
            case FILE:
                return UploadedFile.class;
        }
        throw new Error("unknown type: " + type);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueSchema)) {
            return false;
        }
        final ValueSchema that = (ValueSchema) o;
        return type == that.type &&
               Objects.equals(format, that.format) &&
               collectionFormat == that.collectionFormat &&
               Objects.equals(items, that.items) &&
               shape == that.shape;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, format, collectionFormat, items);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("type", type.value())
                          .add("format", format)
                          .add("collectionFormat", collectionFormat)
                          .add("items", items)
                          .add("shape", shape != null ? shape.type().getSimpleName() : null)
                          .toString();
    }
}
