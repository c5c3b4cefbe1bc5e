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

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.net.MediaType;

/**
 * Decodes a request body into a generic {@link JsonNode} which is then coerced into the declared
 * type of the body parameter.
 *
 * @see BodyDecoders
 */
public interface BodyDecoder {

    /**
     * Returns whether this decoder can decode a body of the specified {@link MediaType}.
     */
    boolean canDecode(MediaType mediaType);

    /**
     * Decodes the body read from {@code in}. {@link #canDecode(MediaType)} has returned
     * {@code true} for {@code mediaType}.
     *
     * @throws IOException if the body could not be read or is malformed
     */
    JsonNode decode(InputStream in, MediaType mediaType) throws IOException;
}
