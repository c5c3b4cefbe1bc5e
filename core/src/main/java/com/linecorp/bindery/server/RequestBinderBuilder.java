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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import com.linecorp.bindery.common.FieldAssigner;
import com.linecorp.bindery.common.FieldAssigners;
import com.linecorp.bindery.common.Flags;
import com.linecorp.bindery.common.ParamDescriptor;
import com.linecorp.bindery.common.ParamLocation;
import com.linecorp.bindery.common.ParamType;
import com.linecorp.bindery.common.ValueSchema;

/**
 * Builds a {@link RequestBinder}.
 *
 * <p>{@link #build()} checks the descriptors against the {@link FieldAssigner}: every field must be
 * declared once, must exist and must accept the Java type its value is coerced into, and every
 * default value must coerce. A descriptor with an unknown location, a missing type, an unsupported
 * collection format, a second body descriptor or a second descriptor of the same file part is
 * accepted here and reported as an error on every bind.
 *
 * @param <T> the destination type
 */
public final class RequestBinderBuilder<T> {

    private static final Logger logger = LoggerFactory.getLogger(RequestBinderBuilder.class);

    private final FieldAssigner<T> assigner;
    private final List<ParamDescriptor> descriptors = new ArrayList<>();
    private long maxRequestLength = Flags.maxRequestLength();
    private int maxNumParameters = Flags.maxNumParameters();
    private boolean verboseErrors = Flags.verboseBindingErrors();

    RequestBinderBuilder(FieldAssigner<T> assigner) {
        this.assigner = requireNonNull(assigner, "assigner");
    }

    /**
     * Adds the specified {@link ParamDescriptor}s.
     */
    public RequestBinderBuilder<T> add(ParamDescriptor... descriptors) {
        return add(ImmutableList.copyOf(requireNonNull(descriptors, "descriptors")));
    }

    /**
     * Adds the specified {@link ParamDescriptor}s.
     */
    public RequestBinderBuilder<T> add(Iterable<ParamDescriptor> descriptors) {
        requireNonNull(descriptors, "descriptors");
        for (ParamDescriptor descriptor : descriptors) {
            this.descriptors.add(requireNonNull(descriptor, "descriptors contains null."));
        }
        return this;
    }

    /**
     * Sets the maximum length of a request body in bytes. {@code 0} disables the limit.
     * Defaults to {@link Flags#maxRequestLength()}.
     */
    public RequestBinderBuilder<T> maxRequestLength(long maxRequestLength) {
        checkArgument(maxRequestLength >= 0, "maxRequestLength: %s (expected: >= 0)", maxRequestLength);
        this.maxRequestLength = maxRequestLength;
        return this;
    }

    /**
     * Sets the maximum number of parameters decoded from a query string or a form body. A request
     * with more parameters fails to bind. Defaults to {@link Flags#maxNumParameters()}.
     */
    public RequestBinderBuilder<T> maxNumParameters(int maxNumParameters) {
        checkArgument(maxNumParameters > 0, "maxNumParameters: %s (expected: > 0)", maxNumParameters);
        this.maxNumParameters = maxNumParameters;
        return this;
    }

    /**
     * Sets whether the rejected raw text is included in the message of a {@link BindingError}.
     * Defaults to {@link Flags#verboseBindingErrors()}.
     */
    public RequestBinderBuilder<T> verboseErrors(boolean verboseErrors) {
        this.verboseErrors = verboseErrors;
        return this;
    }

    /**
     * Returns a newly-created {@link RequestBinder}.
     *
     * @throws IllegalArgumentException if a field is declared twice, is unknown to the
     *                                  {@link FieldAssigner} or cannot accept its value, or if a
     *                                  default value does not coerce
     */
    public RequestBinder<T> build() {
        final ImmutableList.Builder<ParamBinding> bindings = ImmutableList.builder();
        final Set<String> fields = new HashSet<>();
        final Set<String> claimedFileParts = new HashSet<>();
        boolean bodyDeclared = false;
        for (ParamDescriptor descriptor : descriptors) {
            if (!fields.add(descriptor.field())) {
                throw new IllegalArgumentException("duplicate field: " + descriptor.field() +
                                                   " (parameter: " + descriptor.name() + ')');
            }
            final ParamBinding binding = ParamBinding.of(descriptor, bodyDeclared, claimedFileParts);
            if (descriptor.location() == ParamLocation.BODY) {
                bodyDeclared = true;
            }
            if (binding.isValid()) {
                validate(binding);
                if (binding.isFile()) {
                    claimedFileParts.add(descriptor.name());
                }
            } else {
                logger.debug("Invalid parameter descriptor: {}", binding);
            }
            bindings.add(binding);
        }

        final RequestBinder<T> binder = new RequestBinder<>(assigner, bindings.build(), maxRequestLength,
                                                            maxNumParameters, verboseErrors);
        logger.debug("Built a {}", binder);
        return binder;
    }

    private void validate(ParamBinding binding) {
        final ParamDescriptor descriptor = binding.descriptor();
        final ValueSchema schema = binding.schema();
        assert schema != null;
        FieldAssigners.checkAssignable(assigner, descriptor.field(), schema.javaType());

        final String defaultValue = descriptor.defaultValue();
        if (defaultValue == null) {
            return;
        }
        if (schema.type() == ParamType.FILE) {
            throw new IllegalArgumentException(
                    "a file parameter cannot have a default value: " + descriptor.name());
        }
        final ErrorCollector errors = new ErrorCollector();
        binding.coerceDefault(errors, true);
        if (!errors.isEmpty()) {
            final BindingError error = errors.errors().get(0);
            throw new IllegalArgumentException(
                    "invalid default value for parameter '" + descriptor.name() + "': " +
                    defaultValue + " (" + error.name() + ": " + error.message() + ')');
        }
    }
}
