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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.math.LongMath;
import com.google.common.net.MediaType;

import com.linecorp.bindery.common.BindingRequest;
import com.linecorp.bindery.common.RequestBody;
import com.linecorp.bindery.internal.FormData;
import com.linecorp.bindery.internal.FormDataParser;

/**
 * A context which holds the state of a single bind. The query string, the content type, the body
 * content, the form and the decoded body are resolved lazily at most once, and a failure to
 * resolve one of them is remembered so that every parameter depending on it reports the same
 * error. Not thread-safe.
 */
final class BindingContext {

    private static final Logger logger = LoggerFactory.getLogger(BindingContext.class);

    private final BindingRequest request;
    private final Map<String, String> routeParams;
    private final BodyDecoder bodyDecoder;
    private final long maxRequestLength;
    private final int maxNumParameters;

    @Nullable
    private Outcome<Map<String, List<String>>> query;
    @Nullable
    private Outcome<MediaType> contentType;
    @Nullable
    private Outcome<byte[]> content;
    @Nullable
    private Outcome<FormData> form;
    @Nullable
    private Outcome<JsonNode> body;

    BindingContext(BindingRequest request, Map<String, String> routeParams,
                   BodyDecoder bodyDecoder, long maxRequestLength, int maxNumParameters) {
        this.request = requireNonNull(request, "request");
        this.routeParams = requireNonNull(routeParams, "routeParams");
        this.bodyDecoder = requireNonNull(bodyDecoder, "bodyDecoder");
        this.maxRequestLength = maxRequestLength;
        this.maxNumParameters = maxNumParameters;
    }

    BindingRequest request() {
        return request;
    }

    @Nullable
    String routeParam(String name) {
        return routeParams.get(name);
    }

    /**
     * Returns the parameters decoded from the query string as UTF-8.
     */
    Outcome<Map<String, List<String>>> query() {
        Outcome<Map<String, List<String>>> result = query;
        if (result == null) {
            query = result = decodeQuery(request.query(), maxNumParameters);
        }
        return result;
    }

    /**
     * Returns the parsed {@code content-type} header of the request.
     */
    Outcome<MediaType> contentType() {
        Outcome<MediaType> result = contentType;
        if (result == null) {
            contentType = result = parseContentType(request.contentType());
        }
        return result;
    }

    /**
     * Returns the content of the request body. The {@link RequestBody} is read only once and its
     * content is shared by every parameter which needs it.
     */
    Outcome<byte[]> content() {
        Outcome<byte[]> result = content;
        if (result == null) {
            content = result = readContent(request.body(), maxRequestLength);
        }
        return result;
    }

    /**
     * Returns the form decoded from a URL-encoded or multipart body.
     */
    Outcome<FormData> form() {
        Outcome<FormData> result = form;
        if (result == null) {
            form = result = parseForm();
        }
        return result;
    }

    /**
     * Returns the form decoded from a multipart body. Unlike {@link #form()}, a URL-encoded body
     * is rejected.
     */
    Outcome<FormData> multipartForm() {
        final Outcome<MediaType> mediaType = contentType();
        if (mediaType.isFailure()) {
            return mediaType.cast();
        }
        if (!FormDataParser.isMultipart(mediaType.value())) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE,
                                   "expected a multipart/form-data body but got: " + mediaType.value());
        }
        return form();
    }

    /**
     * Returns the body decoded by the {@link BodyDecoder}, or a {@link MissingNode} if the body is
     * empty. The decoder is invoked at most once.
     */
    Outcome<JsonNode> body() {
        Outcome<JsonNode> result = body;
        if (result == null) {
            body = result = decodeBody();
        }
        return result;
    }

    private Outcome<FormData> parseForm() {
        final Outcome<MediaType> mediaType = contentType();
        if (mediaType.isFailure()) {
            return mediaType.cast();
        }
        final MediaType type = mediaType.value();
        if (!FormDataParser.isUrlEncoded(type) && !FormDataParser.isMultipart(type)) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE,
                                   "expected a form body but got: " + type);
        }
        if (FormDataParser.isMultipart(type) && !FormDataParser.hasBoundary(type)) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE,
                                   "missing multipart boundary: " + type);
        }
        final Outcome<byte[]> bytes = content();
        if (bytes.isFailure()) {
            return bytes.cast();
        }
        if (bytes.value().length == 0) {
            return Outcome.of(FormData.empty());
        }
        try {
            return Outcome.of(FormDataParser.parse(bytes.value(), type, maxNumParameters));
        } catch (IllegalArgumentException e) {
            logger.debug("Failed to decode a form body: {}", type, e);
            return Outcome.failure(BindingErrorKind.DECODE_FAILURE, "malformed form body: " + e.getMessage());
        }
    }

    private Outcome<JsonNode> decodeBody() {
        final Outcome<byte[]> bytes = content();
        if (bytes.isFailure()) {
            return bytes.cast();
        }
        if (bytes.value().length == 0) {
            return Outcome.of(MissingNode.getInstance());
        }
        final Outcome<MediaType> mediaType = contentType();
        if (mediaType.isFailure()) {
            return mediaType.cast();
        }
        if (!bodyDecoder.canDecode(mediaType.value())) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE,
                                   "unsupported content type: " + mediaType.value());
        }
        try {
            final JsonNode node = bodyDecoder.decode(new ByteArrayInputStream(bytes.value()),
                                                     mediaType.value());
            return Outcome.of(node != null ? node : MissingNode.getInstance());
        } catch (IOException e) {
            logger.debug("Failed to decode a request body: {}", mediaType.value(), e);
            return Outcome.failure(BindingErrorKind.DECODE_FAILURE, "malformed body: " + e.getMessage());
        }
    }

    private static Outcome<Map<String, List<String>>> decodeQuery(@Nullable String query,
                                                                  int maxNumParameters) {
        if (query == null || query.isEmpty()) {
            return Outcome.of(ImmutableMap.of());
        }
        try {
            return Outcome.of(FormDataParser.decodeParameters(query, StandardCharsets.UTF_8, maxNumParameters));
        } catch (IllegalArgumentException e) {
            logger.debug("Failed to decode a query string: {}", query, e);
            return Outcome.failure(BindingErrorKind.MALFORMED_VALUE,
                                   "malformed query string: " + e.getMessage());
        }
    }

    private static Outcome<MediaType> parseContentType(@Nullable String contentType) {
        if (contentType == null) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE, "missing content type");
        }
        try {
            return Outcome.of(MediaType.parse(contentType));
        } catch (IllegalArgumentException e) {
            return Outcome.failure(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE,
                                   "malformed content type: " + contentType);
        }
    }

    private static Outcome<byte[]> readContent(RequestBody body, long maxRequestLength) {
        if (body.isConsumed()) {
            return Outcome.failure(BindingErrorKind.DECODE_FAILURE,
                                   "request body has been consumed already");
        }
        try (InputStream in = body.open()) {
            if (maxRequestLength == 0) {
                return Outcome.of(ByteStreams.toByteArray(in));
            }
            final byte[] bytes = ByteStreams.toByteArray(
                    ByteStreams.limit(in, LongMath.saturatedAdd(maxRequestLength, 1)));
            if (bytes.length > maxRequestLength) {
                return Outcome.failure(BindingErrorKind.DECODE_FAILURE,
                                       "request body is larger than " + maxRequestLength + " bytes");
            }
            return Outcome.of(bytes);
        } catch (IOException e) {
            logger.debug("Failed to read a request body", e);
            return Outcome.failure(BindingErrorKind.DECODE_FAILURE,
                                   "failed to read the request body: " + e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("request", request)
                          .add("routeParams", routeParams)
                          .add("bodyDecoder", bodyDecoder)
                          .toString();
    }

    /**
     * Either a resolved value or the kind and message of the error which prevented resolving it.
     */
    static final class Outcome<T> {

        static <T> Outcome<T> of(T value) {
            return new Outcome<>(requireNonNull(value, "value"), null, "");
        }

        static <T> Outcome<T> failure(BindingErrorKind kind, String message) {
            return new Outcome<>(null, requireNonNull(kind, "kind"), requireNonNull(message, "message"));
        }

        @Nullable
        private final T value;
        @Nullable
        private final BindingErrorKind errorKind;
        private final String message;

        private Outcome(@Nullable T value, @Nullable BindingErrorKind errorKind, String message) {
            this.value = value;
            this.errorKind = errorKind;
            this.message = message;
        }

        boolean isFailure() {
            return errorKind != null;
        }

        T value() {
            if (value == null) {
                throw new IllegalStateException("failed outcome: " + message);
            }
            return value;
        }

        /**
         * Records the error of this failed outcome for the specified parameter.
         */
        void report(ErrorCollector errors, String name, String in) {
            if (errorKind == null) {
                throw new IllegalStateException("not a failure");
            }
            errors.add(name, in, errorKind, message);
        }

        @SuppressWarnings("unchecked")
        <U> Outcome<U> cast() {
            if (errorKind == null) {
                throw new IllegalStateException("not a failure");
            }
            return (Outcome<U>) this;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).omitNullValues()
                              .add("value", value)
                              .add("errorKind", errorKind)
                              .add("message", message.isEmpty() ? null : message)
                              .toString();
        }
    }
}
