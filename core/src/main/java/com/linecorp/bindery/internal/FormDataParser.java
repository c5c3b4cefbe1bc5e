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
package com.linecorp.bindery.internal;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.math.IntMath;
import com.google.common.net.MediaType;
import com.google.common.primitives.Bytes;

import com.linecorp.bindery.common.Flags;
import com.linecorp.bindery.common.UploadedFile;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.multipart.Attribute;
import io.netty.handler.codec.http.multipart.DefaultHttpDataFactory;
import io.netty.handler.codec.http.multipart.FileUpload;
import io.netty.handler.codec.http.multipart.HttpPostMultipartRequestDecoder;
import io.netty.handler.codec.http.multipart.HttpPostRequestDecoder.ErrorDataDecoderException;
import io.netty.handler.codec.http.multipart.InterfaceHttpData;

/**
 * Decodes URL-encoded and multipart form bodies into {@link FormData}.
 */
public final class FormDataParser {

    private static final Logger logger = LoggerFactory.getLogger(FormDataParser.class);

    /**
     * Returns whether {@code mediaType} is {@code application/x-www-form-urlencoded}.
     */
    public static boolean isUrlEncoded(MediaType mediaType) {
        return mediaType.is(MediaType.FORM_DATA.withoutParameters());
    }

    /**
     * Returns whether {@code mediaType} is {@code multipart/form-data}.
     */
    public static boolean isMultipart(MediaType mediaType) {
        return "multipart".equals(mediaType.type()) && "form-data".equals(mediaType.subtype());
    }

    /**
     * Returns whether {@code mediaType} carries a non-empty {@code boundary} parameter.
     */
    public static boolean hasBoundary(MediaType mediaType) {
        final List<String> boundary = mediaType.parameters().get("boundary");
        return !boundary.isEmpty() && !boundary.get(0).isEmpty();
    }

    /**
     * Decodes the specified body of the specified {@link MediaType}, accepting at most
     * {@link Flags#maxNumParameters()} fields.
     *
     * @throws IllegalArgumentException if the media type is not a form type, or the body is malformed
     */
    public static FormData parse(byte[] content, MediaType mediaType) {
        return parse(content, mediaType, Flags.maxNumParameters());
    }

    /**
     * Decodes the specified body of the specified {@link MediaType}.
     *
     * @throws IllegalArgumentException if the media type is not a form type, if the body is malformed
     *                                  or if it has more than {@code maxNumParameters} fields
     */
    public static FormData parse(byte[] content, MediaType mediaType, int maxNumParameters) {
        requireNonNull(content, "content");
        requireNonNull(mediaType, "mediaType");
        if (isUrlEncoded(mediaType)) {
            return parseUrlEncoded(content, mediaType.charset().or(StandardCharsets.UTF_8), maxNumParameters);
        }
        if (isMultipart(mediaType)) {
            return parseMultipart(content, mediaType, maxNumParameters);
        }
        throw new IllegalArgumentException("not a form media type: " + mediaType);
    }

    /**
     * Decodes the parameters of a query string or a URL-encoded form body with {@code charset}.
     *
     * @throws IllegalArgumentException if an escape is malformed or if there are more than
     *                                  {@code maxNumParameters} parameters
     */
    public static Map<String, List<String>> decodeParameters(String s, Charset charset, int maxNumParameters) {
        checkArgument(maxNumParameters > 0, "maxNumParameters: %s (expected: > 0)", maxNumParameters);
        // QueryStringDecoder stops silently at its limit, so one more parameter is decoded to detect it.
        final Map<String, List<String>> parameters =
                new QueryStringDecoder(s, charset, false, IntMath.saturatedAdd(maxNumParameters, 1))
                        .parameters();
        int count = 0;
        for (List<String> values : parameters.values()) {
            count += values.size();
        }
        if (count > maxNumParameters) {
            throw new IllegalArgumentException("too many parameters (max: " + maxNumParameters + ')');
        }
        return parameters;
    }

    /**
     * Decodes a URL-encoded form body. Names and values are decoded with {@code charset}.
     *
     * @see QueryStringDecoder#QueryStringDecoder(String, Charset, boolean, int)
     */
    public static FormData parseUrlEncoded(byte[] content, Charset charset, int maxNumParameters) {
        final String body = new String(content, charset);
        if (body.isEmpty()) {
            return FormData.empty();
        }
        final Map<String, List<String>> parameters = decodeParameters(body, charset, maxNumParameters);
        final ImmutableListMultimap.Builder<String, String> fields = ImmutableListMultimap.builder();
        parameters.forEach(fields::putAll);
        return FormData.of(fields.build(), ImmutableListMultimap.of());
    }

    /**
     * Decodes a multipart form body. Every part is kept in memory. A body which does not end with
     * the closing delimiter is rejected.
     */
    public static FormData parseMultipart(byte[] content, MediaType mediaType, int maxNumParameters) {
        if (!hasBoundary(mediaType)) {
            throw new IllegalArgumentException("no multipart boundary: " + mediaType);
        }
        final String boundary = mediaType.parameters().get("boundary").get(0);
        final byte[] closeDelimiter = ("--" + boundary + "--").getBytes(StandardCharsets.US_ASCII);
        if (Bytes.indexOf(content, closeDelimiter) < 0) {
            throw new IllegalArgumentException("truncated multipart body: missing the closing delimiter");
        }

        final Charset charset = mediaType.charset().or(StandardCharsets.UTF_8);
        final FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/",
                                                                   Unpooled.copiedBuffer(content));
        request.headers().set(HttpHeaderNames.CONTENT_TYPE, mediaType.toString());

        HttpPostMultipartRequestDecoder decoder = null;
        try {
            decoder = new HttpPostMultipartRequestDecoder(new DefaultHttpDataFactory(false, charset),
                                                          request, charset);
            final ImmutableListMultimap.Builder<String, String> fields = ImmutableListMultimap.builder();
            final ImmutableListMultimap.Builder<String, UploadedFile> files = ImmutableListMultimap.builder();
            final List<InterfaceHttpData> parts = decoder.getBodyHttpDatas();
            if (parts.size() > maxNumParameters) {
                throw new IllegalArgumentException("too many parts (max: " + maxNumParameters + ')');
            }
            for (InterfaceHttpData data : parts) {
                switch (data.getHttpDataType()) {
                    case Attribute:
                        fields.put(data.getName(), ((Attribute) data).getValue());
                        break;
                    case FileUpload:
                        final FileUpload upload = (FileUpload) data;
                        files.put(data.getName(), new UploadedFile(upload.getFilename(),
                                                                   upload.getContentType(), upload.get()));
                        break;
                    default:
                        logger.debug("Ignoring a multipart part: {}", data);
                }
            }
            return FormData.of(fields.build(), files.build());
        } catch (ErrorDataDecoderException | IOException e) {
            throw new IllegalArgumentException("failed to decode a multipart body: " + e.getMessage(), e);
        } finally {
            if (decoder != null) {
                decoder.destroy();
            }
            if (request.refCnt() > 0) {
                request.release();
            }
        }
    }

    private FormDataParser() {}
}
