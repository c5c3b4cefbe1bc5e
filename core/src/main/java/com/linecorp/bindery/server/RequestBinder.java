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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.bindery.common.BindingRequest;
import com.linecorp.bindery.common.FieldAssigner;
import com.linecorp.bindery.common.ParamDescriptor;

/**
 * Binds the path variables, query parameters, headers, form fields, file parts and body of a
 * request into a destination of type {@code T}, as declared by a list of {@link ParamDescriptor}s.
 *
 * <p>Every parameter is processed in declaration order and every failure is collected into the
 * returned {@link BindingResult}; binding never stops at the first error. A {@link RequestBinder}
 * is immutable and may be shared by any number of threads, as long as each bind gets its own
 * destination.
 *
 * @param <T> the destination type
 *
 * @see RequestBinderBuilder
 */
public final class RequestBinder<T> {

    private static final Logger logger = LoggerFactory.getLogger(RequestBinder.class);

    /**
     * Returns a new {@link RequestBinderBuilder} which assigns values with the specified
     * {@link FieldAssigner}.
     */
    public static <T> RequestBinderBuilder<T> builder(FieldAssigner<T> assigner) {
        return new RequestBinderBuilder<>(assigner);
    }

    /**
     * Returns a new {@link RequestBinder} with the specified {@link ParamDescriptor}s and the default
     * options.
     *
     * @throws IllegalArgumentException if the descriptors do not fit the {@link FieldAssigner}
     */
    public static <T> RequestBinder<T> of(FieldAssigner<T> assigner, ParamDescriptor... descriptors) {
        return builder(assigner).add(descriptors).build();
    }

    private final FieldAssigner<T> assigner;
    private final List<ParamBinding> bindings;
    private final long maxRequestLength;
    private final int maxNumParameters;
    private final boolean verboseErrors;

    RequestBinder(FieldAssigner<T> assigner, List<ParamBinding> bindings,
                  long maxRequestLength, int maxNumParameters, boolean verboseErrors) {
        this.assigner = assigner;
        this.bindings = ImmutableList.copyOf(bindings);
        this.maxRequestLength = maxRequestLength;
        this.maxNumParameters = maxNumParameters;
        this.verboseErrors = verboseErrors;
    }

    /**
     * Returns the {@link ParamDescriptor}s in declaration order.
     */
    public List<ParamDescriptor> descriptors() {
        return bindings.stream().map(ParamBinding::descriptor).collect(ImmutableList.toImmutableList());
    }

    /**
     * Binds the specified request into {@code destination}.
     *
     * @param request the request to bind
     * @param routeParams the path variables matched by a router
     * @param bodyDecoder the decoder of a body parameter
     * @param destination the value the parameters are assigned to
     */
    public BindingResult<T> bind(BindingRequest request, Map<String, String> routeParams,
                                 BodyDecoder bodyDecoder, T destination) {
        requireNonNull(request, "request");
        requireNonNull(routeParams, "routeParams");
        requireNonNull(bodyDecoder, "bodyDecoder");
        requireNonNull(destination, "destination");

        final ErrorCollector errors = new ErrorCollector();
        final BindingContext ctx = new BindingContext(request, routeParams, bodyDecoder,
                                                      maxRequestLength, maxNumParameters);
        for (ParamBinding binding : bindings) {
            final Object value = binding.resolve(ctx, errors, verboseErrors);
            if (value != null) {
                assigner.assign(destination, binding.descriptor().field(), value);
            }
        }

        if (!errors.isEmpty()) {
            logger.debug("Failed to bind a request: {}", errors);
        }
        return new BindingResult<>(destination, errors.errors());
    }

    /**
     * Binds the specified request into {@code destination}, decoding a body parameter with
     * {@link BodyDecoders#json()}.
     */
    public BindingResult<T> bind(BindingRequest request, Map<String, String> routeParams, T destination) {
        return bind(request, routeParams, BodyDecoders.json(), destination);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("assigner", assigner)
                          .add("bindings", bindings)
                          .add("maxRequestLength", maxRequestLength)
                          .add("maxNumParameters", maxNumParameters)
                          .add("verboseErrors", verboseErrors)
                          .toString();
    }
}
