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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.MoreObjects;

/**
 * The content of a request, which can be consumed only once. Reading it is the only blocking
 * operation of a bind.
 */
public final class RequestBody {

    private static final byte[] EMPTY_BYTES = {};

    /**
     * Returns a new empty {@link RequestBody}.
     */
    public static RequestBody empty() {
        return of(EMPTY_BYTES);
    }

    /**
     * Returns a new {@link RequestBody} backed by {@code content}, which is not copied.
     */
    public static RequestBody of(byte[] content) {
        return new RequestBody(new ByteArrayInputStream(requireNonNull(content, "content")));
    }

    /**
     * Returns a new {@link RequestBody} with the UTF-8 encoding of {@code content}.
     */
    public static RequestBody ofUtf8(String content) {
        return of(requireNonNull(content, "content").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a new {@link RequestBody} which reads from {@code stream}.
     */
    public static RequestBody of(InputStream stream) {
        return new RequestBody(requireNonNull(stream, "stream"));
    }

    private final InputStream stream;
    private final AtomicBoolean consumed = new AtomicBoolean();

    private RequestBody(InputStream stream) {
        this.stream = stream;
    }

    /**
     * Returns whether {@link #open()} has been called.
     */
    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * Returns the stream of the content. The caller is responsible for closing it.
     *
     * @throws IllegalStateException if the body has been consumed already
     */
    public InputStream open() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("the request body has been consumed already");
        }
        return stream;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("consumed", consumed.get())
                          .toString();
    }
}
