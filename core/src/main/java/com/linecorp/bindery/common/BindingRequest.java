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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * The parts of an HTTP request a binder reads values from: the headers, the raw query string
 * and the body. Path variables are not part of a request; a router supplies them separately.
 */
public final class BindingRequest {

    /**
     * Returns a new {@link BindingRequest} which copies the headers, the query string and the
     * content of the specified Netty {@link FullHttpRequest}. The {@link FullHttpRequest} is not
     * released.
     */
    public static BindingRequest of(FullHttpRequest request) {
        requireNonNull(request, "request");
        final String rawQuery = new QueryStringDecoder(request.uri()).rawQuery();
        return builder().headers(request.headers())
                        .query(rawQuery.isEmpty() ? null : rawQuery)
                        .body(RequestBody.of(ByteBufUtil.getBytes(request.content())))
                        .build();
    }

    /**
     * Returns a new {@link Builder}.
     */
    public static Builder builder() {
        return new Builder();
    }

    private final HttpHeaders headers;
    @Nullable
    private final String query;
    private final RequestBody body;

    private BindingRequest(HttpHeaders headers, @Nullable String query, RequestBody body) {
        this.headers = headers;
        this.query = query;
        this.body = body;
    }

    /**
     * Returns the headers of this request. Header names are case-insensitive.
     */
    public HttpHeaders headers() {
        return headers;
    }

    /**
     * Returns the raw query string without the leading {@code '?'}, or {@code null}.
     */
    @Nullable
    public String query() {
        return query;
    }

    /**
     * Returns the {@code content-type} header, or {@code null}.
     */
    @Nullable
    public String contentType() {
        return headers.get(HttpHeaderNames.CONTENT_TYPE);
    }

    public RequestBody body() {
        return body;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("query", query)
                          .add("headers", headers)
                          .add("body", body)
                          .toString();
    }

    /**
     * Builds a {@link BindingRequest}.
     */
    public static final class Builder {
        private final HttpHeaders headers = new DefaultHttpHeaders();
        @Nullable
        private String query;
        private RequestBody body = RequestBody.empty();

        private Builder() {}

        /**
         * Adds a header.
         */
        public Builder header(CharSequence name, Object value) {
            headers.add(requireNonNull(name, "name"), requireNonNull(value, "value"));
            return this;
        }

        /**
         * Adds all of the specified headers.
         */
        public Builder headers(HttpHeaders headers) {
            this.headers.add(requireNonNull(headers, "headers"));
            return this;
        }

        /**
         * Sets the {@code content-type} header.
         */
        public Builder contentType(CharSequence contentType) {
            headers.set(HttpHeaderNames.CONTENT_TYPE, requireNonNull(contentType, "contentType"));
            return this;
        }

        /**
         * Sets the raw query string, without the leading {@code '?'}.
         */
        public Builder query(@Nullable String query) {
            this.query = query;
            return this;
        }

        public Builder body(RequestBody body) {
            this.body = requireNonNull(body, "body");
            return this;
        }

        /**
         * Sets the body to the UTF-8 encoding of {@code content}.
         */
        public Builder content(String content) {
            return body(RequestBody.ofUtf8(content));
        }

        public Builder content(byte[] content) {
            return body(RequestBody.of(content));
        }

        public BindingRequest build() {
            return new BindingRequest(headers, query, body);
        }
    }
}
