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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import com.linecorp.bindery.common.CollectionFormat;
import com.linecorp.bindery.common.ParamDescriptor;
import com.linecorp.bindery.common.ParamLocation;
import com.linecorp.bindery.common.ParamType;
import com.linecorp.bindery.common.UploadedFile;
import com.linecorp.bindery.common.ValueSchema;
import com.linecorp.bindery.internal.FormData;

/**
 * The {@link ValueExtractor} of each {@link ParamLocation}.
 */
final class ValueExtractors {

    private static final Map<ParamLocation, ValueExtractor> extractors;

    static {
        final Map<ParamLocation, ValueExtractor> map = new EnumMap<>(ParamLocation.class);
        map.put(ParamLocation.PATH, ValueExtractors::ofPathVariable);
        map.put(ParamLocation.QUERY, ValueExtractors::ofQueryParam);
        map.put(ParamLocation.HEADER, ValueExtractors::ofHeader);
        map.put(ParamLocation.FORM, ValueExtractors::ofFormField);
        map.put(ParamLocation.FILE, ValueExtractors::ofFilePart);
        map.put(ParamLocation.BODY, ValueExtractors::ofBody);
        extractors = Maps.immutableEnumMap(map);
    }

    /**
     * Returns the {@link ValueExtractor} for the specified {@link ParamLocation}.
     */
    static ValueExtractor of(ParamLocation location) {
        return requireNonNull(extractors.get(requireNonNull(location, "location")), "extractor");
    }

    /**
     * Returns the {@link ValueExtractor} for a parameter of type {@code file}, regardless of whether
     * it was declared in {@code file} or {@code form}.
     */
    static ValueExtractor ofFile() {
        return of(ParamLocation.FILE);
    }

    private static RawValue ofPathVariable(ParamDescriptor descriptor, ValueSchema schema,
                                           BindingContext ctx, ErrorCollector errors) {
        final String value = ctx.routeParam(descriptor.name());
        return value != null ? RawValue.ofText(value) : RawValue.ABSENT;
    }

    @Nullable
    private static RawValue ofQueryParam(ParamDescriptor descriptor, ValueSchema schema,
                                         BindingContext ctx, ErrorCollector errors) {
        final BindingContext.Outcome<Map<String, List<String>>> query = ctx.query();
        if (query.isFailure()) {
            query.report(errors, descriptor.name(), descriptor.in());
            return null;
        }
        return occurrences(query.value().get(descriptor.name()), schema);
    }

    private static RawValue ofHeader(ParamDescriptor descriptor, ValueSchema schema,
                                     BindingContext ctx, ErrorCollector errors) {
        final String value = ctx.request().headers().get(descriptor.name());
        return value != null ? RawValue.ofText(value) : RawValue.ABSENT;
    }

    @Nullable
    private static RawValue ofFormField(ParamDescriptor descriptor, ValueSchema schema,
                                        BindingContext ctx, ErrorCollector errors) {
        final BindingContext.Outcome<FormData> form = ctx.form();
        if (form.isFailure()) {
            form.report(errors, descriptor.name(), descriptor.in());
            return null;
        }
        return occurrences(form.value().fields(descriptor.name()), schema);
    }

    @Nullable
    private static RawValue ofFilePart(ParamDescriptor descriptor, ValueSchema schema,
                                       BindingContext ctx, ErrorCollector errors) {
        final BindingContext.Outcome<FormData> form = ctx.multipartForm();
        if (form.isFailure()) {
            form.report(errors, descriptor.name(), descriptor.in());
            return null;
        }
        final String name = descriptor.name();
        final UploadedFile file = form.value().file(name);
        if (file == null) {
            if (!form.value().fields(name).isEmpty()) {
                errors.add(name, descriptor.in(), BindingErrorKind.MALFORMED_VALUE,
                           "form field is not a file part");
                return null;
            }
            return RawValue.ABSENT;
        }
        return RawValue.ofFile(file);
    }

    @Nullable
    private static RawValue ofBody(ParamDescriptor descriptor, ValueSchema schema,
                                   BindingContext ctx, ErrorCollector errors) {
        final BindingContext.Outcome<JsonNode> body = ctx.body();
        if (body.isFailure()) {
            body.report(errors, descriptor.name(), descriptor.in());
            return null;
        }
        final JsonNode node = body.value();
        return node.isMissingNode() || node.isNull() ? RawValue.ABSENT : RawValue.ofNode(node);
    }

    private static RawValue occurrences(@Nullable List<String> values, ValueSchema schema) {
        if (values == null || values.isEmpty()) {
            return RawValue.ABSENT;
        }
        if (schema.type() == ParamType.ARRAY &&
            schema.collectionFormat() == CollectionFormat.MULTI) {
            return RawValue.ofText(values);
        }
        return RawValue.ofText(ImmutableList.of(values.get(0)));
    }

    private ValueExtractors() {}
}
