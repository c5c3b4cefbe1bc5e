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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.google.common.base.MoreObjects;
import com.google.common.net.MediaType;

/**
 * A {@link BodyDecoder} which reads a JSON body as a {@link JsonNode} tree.
 */
final class JacksonBodyDecoder implements BodyDecoder {

    private final ObjectReader reader;

    JacksonBodyDecoder(ObjectMapper mapper) {
        reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public boolean canDecode(MediaType mediaType) {
        if (!"application".equals(mediaType.type())) {
            return false;
        }
        final String subtype = mediaType.subtype();
        return "json".equals(subtype) || subtype.endsWith("+json");
    }

    @Override
    public JsonNode decode(InputStream in, MediaType mediaType) throws IOException {
        return reader.readTree(in);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).toString();
    }
}
