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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.google.common.io.ByteStreams;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;

class BindingRequestTest {

    @Test
    void fromNettyRequest() throws Exception {
        final FullHttpRequest nettyRequest = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, "/users/1?name=foo&tag=a&tag=b",
                Unpooled.copiedBuffer("{\"age\":3}", StandardCharsets.UTF_8));
        nettyRequest.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        nettyRequest.headers().set("X-Trace", "abc");
        try {
            final BindingRequest request = BindingRequest.of(nettyRequest);
            assertThat(request.query()).isEqualTo("name=foo&tag=a&tag=b");
            assertThat(request.contentType()).isEqualTo("application/json");
            assertThat(request.headers().get("x-trace")).isEqualTo("abc");
            try (InputStream in = request.body().open()) {
                assertThat(new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8))
                        .isEqualTo("{\"age\":3}");
            }
        } finally {
            nettyRequest.release();
        }
    }

    @Test
    void noQuery() {
        final FullHttpRequest nettyRequest = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.GET, "/users/1");
        try {
            final BindingRequest request = BindingRequest.of(nettyRequest);
            assertThat(request.query()).isNull();
            assertThat(request.contentType()).isNull();
        } finally {
            nettyRequest.release();
        }
    }

    @Test
    void builder() {
        final BindingRequest request = BindingRequest.builder()
                                                     .header("Accept", "text/plain")
                                                     .contentType("text/plain; charset=utf-8")
                                                     .query("a=1")
                                                     .content("hello")
                                                     .build();
        assertThat(request.headers().get("accept")).isEqualTo("text/plain");
        assertThat(request.contentType()).isEqualTo("text/plain; charset=utf-8");
        assertThat(request.query()).isEqualTo("a=1");
        assertThat(request.body().isConsumed()).isFalse();
    }

    @Test
    void bodyCanBeOpenedOnce() {
        final RequestBody body = RequestBody.ofUtf8("hello");
        body.open();
        assertThat(body.isConsumed()).isTrue();
        assertThatThrownBy(body::open).isInstanceOf(IllegalStateException.class)
                                      .hasMessageContaining("consumed already");
    }

    @Test
    void uploadedFileCanBeOpenedOnce() throws Exception {
        final UploadedFile file = new UploadedFile("a.txt", "text/plain",
                                                   "hi".getBytes(StandardCharsets.UTF_8));
        assertThat(file.size()).isEqualTo(2);
        assertThat(file.isOpened()).isFalse();
        try (InputStream in = file.openStream()) {
            assertThat(ByteStreams.toByteArray(in)).isEqualTo("hi".getBytes(StandardCharsets.UTF_8));
        }
        assertThat(file.isOpened()).isTrue();
        assertThatThrownBy(file::openStream).isInstanceOf(IllegalStateException.class);
    }
}
