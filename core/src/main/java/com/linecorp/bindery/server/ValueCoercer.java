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
package com.linecorp.bindery.server;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;

import com.linecorp.bindery.common.CollectionFormat;
import com.linecorp.bindery.common.FieldAssigner;
import com.linecorp.bindery.common.ObjectShape;
import com.linecorp.bindery.common.ParamType;
import com.linecorp.bindery.common.PropertyDescriptor;
import com.linecorp.bindery.common.ValueSchema;

/**
 * Coerces raw text or a decoded {@link JsonNode} into the Java type of a {@link ValueSchema}.
 * Every failure is recorded into the {@link ErrorCollector} under the path of the failing value
 * and {@code null} is returned.
 */
final class ValueCoercer {

    private static final ObjectMapper mapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<Map<String, Object>> MAP_TYPE =
            new TypeReference<Map<String, Object>>() {};

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private static final Pattern DATE_PATTERN = Pattern.compile("[0-9]{4}-[0-9]{2}-[0-9]{2}");

    private static final Pattern DATE_TIME_PATTERN = Pattern.compile(
            "[0-9]{4}-[0-9]{2}-[0-9]{2}[Tt][0-9]{2}:[0-9]{2}:[0-9]{2}(?:\\.[0-9]{1,9})?" +
            "(?:[Zz]|[+-][0-9]{2}:[0-9]{2})");

    private final ErrorCollector errors;
    private final String in;
    private final boolean verbose;

    ValueCoercer(ErrorCollector errors, String in, boolean verbose) {
        this.errors = requireNonNull(errors, "errors");
        this.in = requireNonNull(in, "in");
        this.verbose = verbose;
    }

    /**
     * Coerces the text fragments of a parameter. An array is split with its collection format
     * first, and any other type is coerced from the first fragment.
     */
    @Nullable
    Object coerceFragments(List<String> fragments, ValueSchema schema, String path) {
        if (schema.type() == ParamType.ARRAY) {
            final CollectionFormat format = requireNonNull(schema.collectionFormat(), "collectionFormat");
            return coerceItems(format.split(fragments), itemsOf(schema), path);
        }
        return coerceText(fragments.get(0), schema, path, BindingErrorKind.MALFORMED_VALUE);
    }

    /**
     * Coerces a default value declared in wire form. A body default is JSON text, and an array
     * default is delimited as its collection format says, with {@code multi} read as {@code csv}.
     */
    @Nullable
    Object coerceDefault(String text, ValueSchema schema, String path, boolean json) {
        if (json) {
            final JsonNode node = readJson(text, path, BindingErrorKind.MALFORMED_VALUE);
            if (node == null) {
                return null;
            }
            if (node.isNull()) {
                errors.add(path, in, BindingErrorKind.MALFORMED_VALUE, "default value is null");
                return null;
            }
            return coerceNode(node, schema, path, BindingErrorKind.MALFORMED_VALUE);
        }
        if (schema.type() == ParamType.ARRAY && schema.collectionFormat() == CollectionFormat.MULTI) {
            return coerceFragments(ImmutableList.of(text), schema.withCollectionFormat(CollectionFormat.CSV),
                                   path);
        }
        return coerceFragments(ImmutableList.of(text), schema, path);
    }

    /**
     * Coerces a single string. {@code failureKind} is the kind recorded when the string does not
     * conform to a scalar type.
     */
    @Nullable
    Object coerceText(String text, ValueSchema schema, String path, BindingErrorKind failureKind) {
        switch (schema.type()) {
            case STRING:
                return coerceString(text, schema.format(), path, failureKind);
            case INTEGER:
                if (ValueSchema.INT32.equals(schema.format())) {
                    return check(parseInt(text), "an int32 value", text, path, failureKind);
                }
                return check(parseLong(text), "an int64 value", text, path, failureKind);
            case NUMBER:
                if (ValueSchema.FLOAT.equals(schema.format())) {
                    return check(parseFloat(text), "a float value", text, path, failureKind);
                }
                return check(parseDouble(text), "a double value", text, path, failureKind);
            case BOOLEAN:
                return check(parseBoolean(text), "a boolean value", text, path, failureKind);
            case ARRAY:
                final CollectionFormat format = requireNonNull(schema.collectionFormat(), "collectionFormat");
                if (format == CollectionFormat.MULTI) {
                    errors.add(path, in, BindingErrorKind.MALFORMED_COLLECTION,
                               "multi cannot be used for a nested array");
                    return null;
                }
                return coerceItems(format.split(ImmutableList.of(text)), itemsOf(schema), path);
            case OBJECT:
                final JsonNode node = readJson(text, path, failureKind);
                if (node == null) {
                    return null;
                }
                return coerceNode(node, schema, path, failureKind);
            case FILE:
                errors.add(path, in, BindingErrorKind.CONFIGURATION_ERROR,
                           "a file can be bound only from a multipart body");
                return null;
        }
        throw new Error("unknown type: " + schema.type());
    }

    /**
     * Coerces a decoded value. A JSON scalar must be of the JSON type matching the schema.
     */
    @Nullable
    Object coerceNode(JsonNode node, ValueSchema schema, String path, BindingErrorKind failureKind) {
        switch (schema.type()) {
            case STRING:
                if (!node.isTextual()) {
                    return mismatch("a JSON string", node, path, failureKind);
                }
                return coerceString(node.textValue(), schema.format(), path, failureKind);
            case INTEGER:
                if (!node.isIntegralNumber()) {
                    return mismatch("a JSON integer", node, path, failureKind);
                }
                if (ValueSchema.INT32.equals(schema.format())) {
                    return node.canConvertToInt() ? Integer.valueOf(node.intValue())
                                                  : mismatch("an int32 value", node, path, failureKind);
                }
                return node.canConvertToLong() ? Long.valueOf(node.longValue())
                                               : mismatch("an int64 value", node, path, failureKind);
            case NUMBER:
                if (!node.isNumber()) {
                    return mismatch("a JSON number", node, path, failureKind);
                }
                if (ValueSchema.FLOAT.equals(schema.format())) {
                    final float floatValue = (float) node.doubleValue();
                    return Float.isInfinite(floatValue) ? mismatch("a float value", node, path, failureKind)
                                                        : Float.valueOf(floatValue);
                }
                final double doubleValue = node.doubleValue();
                return Double.isInfinite(doubleValue) ? mismatch("a double value", node, path, failureKind)
                                                      : Double.valueOf(doubleValue);
            case BOOLEAN:
                if (!node.isBoolean()) {
                    return mismatch("a JSON boolean", node, path, failureKind);
                }
                return node.booleanValue();
            case ARRAY:
                if (!node.isArray()) {
                    return mismatch("a JSON array", node, path, failureKind);
                }
                return coerceNodeItems(node, itemsOf(schema), path);
            case OBJECT:
                if (!node.isObject()) {
                    return mismatch("a JSON object", node, path, failureKind);
                }
                final ObjectShape<?> shape = schema.shape();
                if (shape == null) {
                    return mapper.convertValue(node, MAP_TYPE);
                }
                return coerceObject(node, shape, path);
            case FILE:
                errors.add(path, in, BindingErrorKind.CONFIGURATION_ERROR,
                           "a file can be bound only from a multipart body");
                return null;
        }
        throw new Error("unknown type: " + schema.type());
    }

    @Nullable
    private List<Object> coerceItems(List<String> items, ValueSchema itemSchema, String path) {
        final int mark = errors.mark();
        final ImmutableList.Builder<Object> builder = ImmutableList.builderWithExpectedSize(items.size());
        for (int i = 0; i < items.size(); i++) {
            final Object value = coerceText(items.get(i), itemSchema, path + '[' + i + ']',
                                            BindingErrorKind.MALFORMED_COLLECTION);
            if (value != null) {
                builder.add(value);
            }
        }
        return errors.hasErrorsSince(mark) ? null : builder.build();
    }

    @Nullable
    private List<Object> coerceNodeItems(JsonNode array, ValueSchema itemSchema, String path) {
        final int mark = errors.mark();
        final ImmutableList.Builder<Object> builder = ImmutableList.builderWithExpectedSize(array.size());
        for (int i = 0; i < array.size(); i++) {
            final String itemPath = path + '[' + i + ']';
            final JsonNode item = array.get(i);
            if (item.isNull()) {
                errors.add(itemPath, in, BindingErrorKind.MALFORMED_COLLECTION, "null item");
                continue;
            }
            final Object value = coerceNode(item, itemSchema, itemPath, BindingErrorKind.MALFORMED_COLLECTION);
            if (value != null) {
                builder.add(value);
            }
        }
        return errors.hasErrorsSince(mark) ? null : builder.build();
    }

    @Nullable
    private <T> T coerceObject(JsonNode node, ObjectShape<T> shape, String path) {
        final int mark = errors.mark();
        final T target = shape.newInstance();
        final FieldAssigner<? super T> assigner = shape.assigner();
        for (PropertyDescriptor property : shape.properties()) {
            final String propertyPath = path + '.' + property.name();
            final JsonNode child = node.get(property.name());
            if (child == null || child.isNull()) {
                if (property.isRequired()) {
                    errors.add(propertyPath, in, BindingErrorKind.MISSING_REQUIRED,
                               "required property is missing");
                }
                continue;
            }
            final Object value = coerceNode(child, property.schema(), propertyPath,
                                            BindingErrorKind.MALFORMED_VALUE);
            if (value != null) {
                assigner.assign(target, property.field(), value);
            }
        }
        return errors.hasErrorsSince(mark) ? null : target;
    }

    @Nullable
    private Object coerceString(String text, @Nullable String format, String path,
                                BindingErrorKind failureKind) {
        if (ValueSchema.DATE.equals(format)) {
            return check(parseDate(text), "a date (YYYY-MM-DD)", text, path, failureKind);
        }
        if (ValueSchema.DATE_TIME.equals(format)) {
            return check(parseDateTime(text), "an RFC 3339 date-time", text, path, failureKind);
        }
        if (ValueSchema.BYTE.equals(format)) {
            return check(parseBase64(text), "a base64 string", text, path, failureKind);
        }
        return text;
    }

    @Nullable
    private JsonNode readJson(String text, String path, BindingErrorKind failureKind) {
        try {
            return mapper.readTree(text);
        } catch (IOException e) {
            errors.add(path, in, failureKind, verbose ? "malformed JSON: " + e.getMessage()
                                                      : "malformed JSON");
            return null;
        }
    }

    @Nullable
    private Object check(@Nullable Object value, String expected, String text, String path,
                         BindingErrorKind failureKind) {
        if (value == null) {
            errors.add(path, in, failureKind,
                       verbose ? "expected " + expected + " but got '" + text + '\''
                               : "expected " + expected);
        }
        return value;
    }

    @Nullable
    private Object mismatch(String expected, JsonNode node, String path, BindingErrorKind failureKind) {
        errors.add(path, in, failureKind,
                   verbose ? "expected " + expected + " but got " + node
                           : "expected " + expected + " but got a JSON " + Ascii.toLowerCase(
                                   node.getNodeType().name()));
        return null;
    }

    private static ValueSchema itemsOf(ValueSchema arraySchema) {
        return requireNonNull(arraySchema.items(), "items");
    }

    @Nullable
    @VisibleForTesting
    static Integer parseInt(String text) {
        if (!isInteger(text)) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            // Overflow
            return null;
        }
    }

    @Nullable
    @VisibleForTesting
    static Long parseLong(String text) {
        if (!isInteger(text)) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // Overflow
            return null;
        }
    }

    private static boolean isInteger(String text) {
        final int start = !text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-') ? 1 : 0;
        return text.length() > start && DIGITS.matchesAllOf(text.substring(start));
    }

    @Nullable
    @VisibleForTesting
    static Float parseFloat(String text) {
        if (!NUMBER_PATTERN.matcher(text).matches()) {
            return null;
        }
        final float value = Float.parseFloat(text);
        return Float.isInfinite(value) ? null : value;
    }

    @Nullable
    @VisibleForTesting
    static Double parseDouble(String text) {
        if (!NUMBER_PATTERN.matcher(text).matches()) {
            return null;
        }
        final double value = Double.parseDouble(text);
        return Double.isInfinite(value) ? null : value;
    }

    @Nullable
    @VisibleForTesting
    static Boolean parseBoolean(String text) {
        if (Ascii.equalsIgnoreCase("true", text)) {
            return Boolean.TRUE;
        }
        if (Ascii.equalsIgnoreCase("false", text)) {
            return Boolean.FALSE;
        }
        return null;
    }

    @Nullable
    @VisibleForTesting
    static LocalDate parseDate(String text) {
        if (!DATE_PATTERN.matcher(text).matches()) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            // Not a calendar date, e.g. 2023-02-30.
            return null;
        }
    }

    @Nullable
    @VisibleForTesting
    static OffsetDateTime parseDateTime(String text) {
        if (!DATE_TIME_PATTERN.matcher(text).matches()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(Ascii.toUpperCase(text));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Nullable
    @VisibleForTesting
    static byte[] parseBase64(String text) {
        if (text.length() % 4 != 0 || text.endsWith("===")) {
            return null;
        }
        try {
            return BaseEncoding.base64().decode(text);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
