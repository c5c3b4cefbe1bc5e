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

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.linecorp.bindery.common.CollectionFormat;
import com.linecorp.bindery.common.ParamDescriptor;
import com.linecorp.bindery.common.ParamLocation;
import com.linecorp.bindery.common.ParamType;
import com.linecorp.bindery.common.ValueSchema;

/**
 * A {@link ParamDescriptor} resolved against its location. It knows how to extract and coerce the
 * value of its parameter, or, if the descriptor is invalid, which configuration error to report
 * whenever a request is bound.
 */
final class ParamBinding {

    /**
     * Resolves the specified {@link ParamDescriptor}. {@code bodyDeclared} tells whether a preceding
     * descriptor has already claimed the body, and {@code claimedFileParts} holds the names of the
     * file parts claimed by the preceding descriptors.
     */
    static ParamBinding of(ParamDescriptor descriptor, boolean bodyDeclared, Set<String> claimedFileParts) {
        requireNonNull(descriptor, "descriptor");
        requireNonNull(claimedFileParts, "claimedFileParts");
        final ParamLocation location = descriptor.location();
        if (location == null) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR,
                           "unknown parameter location: " + descriptor.in());
        }
        if (location == ParamLocation.BODY && bodyDeclared) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR,
                           "only one body parameter is allowed");
        }

        ValueSchema schema = descriptor.schema();
        if (schema == null && location == ParamLocation.FILE) {
            schema = ValueSchema.of(ParamType.FILE);
        }
        if (schema == null) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR, "missing parameter type");
        }
        final boolean isFile = schema.type() == ParamType.FILE;
        if (location == ParamLocation.FILE && !isFile) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR,
                           "a file parameter must be of type file: " + schema.type().value());
        }
        if (isFile && location != ParamLocation.FILE && location != ParamLocation.FORM) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR,
                           "type file is allowed only for form or file parameters");
        }
        if (schema.type() == ParamType.ARRAY && schema.collectionFormat() == CollectionFormat.MULTI &&
            location != ParamLocation.QUERY) {
            return invalid(descriptor, BindingErrorKind.MALFORMED_COLLECTION,
                           "multi collection format is allowed only for query parameters");
        }
        if (isFile && claimedFileParts.contains(descriptor.name())) {
            return invalid(descriptor, BindingErrorKind.CONFIGURATION_ERROR,
                           "file part '" + descriptor.name() + "' is claimed by another parameter");
        }

        final ValueExtractor extractor = isFile ? ValueExtractors.ofFile() : ValueExtractors.of(location);
        return new ParamBinding(descriptor, schema, extractor, null, "");
    }

    private static ParamBinding invalid(ParamDescriptor descriptor, BindingErrorKind kind, String message) {
        return new ParamBinding(descriptor, null, null, kind, message);
    }

    private final ParamDescriptor descriptor;
    @Nullable
    private final ValueSchema schema;
    @Nullable
    private final ValueExtractor extractor;
    @Nullable
    private final BindingErrorKind configErrorKind;
    private final String configErrorMessage;

    private ParamBinding(ParamDescriptor descriptor, @Nullable ValueSchema schema,
                         @Nullable ValueExtractor extractor,
                         @Nullable BindingErrorKind configErrorKind, String configErrorMessage) {
        this.descriptor = descriptor;
        this.schema = schema;
        this.extractor = extractor;
        this.configErrorKind = configErrorKind;
        this.configErrorMessage = configErrorMessage;
    }

    ParamDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Returns the schema the value is coerced with, or {@code null} if the descriptor is invalid.
     */
    @Nullable
    ValueSchema schema() {
        return schema;
    }

    boolean isValid() {
        return configErrorKind == null;
    }

    boolean isFile() {
        return schema != null && schema.type() == ParamType.FILE;
    }

    /**
     * Returns the value to assign, or {@code null} if there is nothing to assign. Nothing is
     * assigned when an error has been recorded, or when the parameter is absent, optional and
     * without a default value.
     */
    @Nullable
    Object resolve(BindingContext ctx, ErrorCollector errors, boolean verbose) {
        if (configErrorKind != null) {
            errors.add(descriptor.name(), descriptor.in(), configErrorKind, configErrorMessage);
            return null;
        }
        assert schema != null;
        assert extractor != null;

        final RawValue raw = extractor.extract(descriptor, schema, ctx, errors);
        if (raw == null) {
            return null;
        }

        final ValueCoercer coercer = new ValueCoercer(errors, descriptor.in(), verbose);
        if (isAbsent(raw, schema)) {
            return resolveAbsent(coercer, errors);
        }

        final Object value;
        if (raw.file() != null) {
            value = raw.file();
        } else if (raw.node() != null) {
            value = coercer.coerceNode(raw.node(), schema, descriptor.name(), BindingErrorKind.MALFORMED_VALUE);
        } else {
            value = coercer.coerceFragments(raw.fragments(), schema, descriptor.name());
        }

        if (value instanceof List && ((List<?>) value).isEmpty() && descriptor.isRequired()) {
            errors.add(descriptor.name(), descriptor.in(), BindingErrorKind.MISSING_REQUIRED,
                       "required parameter is empty");
            return null;
        }
        return value;
    }

    /**
     * Coerces the default value of the descriptor, or returns {@code null} if it has none.
     */
    @Nullable
    Object coerceDefault(ErrorCollector errors, boolean verbose) {
        final String defaultValue = descriptor.defaultValue();
        if (defaultValue == null || schema == null) {
            return null;
        }
        final ValueCoercer coercer = new ValueCoercer(errors, descriptor.in(), verbose);
        return coercer.coerceDefault(defaultValue, schema, descriptor.name(),
                                     descriptor.location() == ParamLocation.BODY);
    }

    @Nullable
    private Object resolveAbsent(ValueCoercer coercer, ErrorCollector errors) {
        assert schema != null;
        final String defaultValue = descriptor.defaultValue();
        if (defaultValue != null) {
            return coercer.coerceDefault(defaultValue, schema, descriptor.name(),
                                         descriptor.location() == ParamLocation.BODY);
        }
        if (descriptor.isRequired()) {
            errors.add(descriptor.name(), descriptor.in(), BindingErrorKind.MISSING_REQUIRED,
                       "required parameter is missing");
        }
        return null;
    }

    /**
     * A scalar sent as an empty string, such as {@code ?age=}, is treated as absent. An array sent
     * that way is present but empty.
     */
    private static boolean isAbsent(RawValue raw, ValueSchema schema) {
        if (raw.isAbsent()) {
            return true;
        }
        final List<String> fragments = raw.fragments();
        return schema.type() != ParamType.ARRAY && !fragments.isEmpty() && fragments.get(0).isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("descriptor", descriptor)
                          .add("schema", schema)
                          .add("configErrorKind", configErrorKind)
                          .toString();
    }
}
