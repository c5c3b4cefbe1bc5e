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

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Provides the {@link BodyDecoder}s shipped with Bindery.
 */
public final class BodyDecoders {

    private static final BodyDecoder DEFAULT_JSON = new JacksonBodyDecoder(new ObjectMapper());

    /**
     * Returns a {@link BodyDecoder} which decodes {@code application/json} and
     * {@code application/*+json} bodies with a default {@link ObjectMapper}.
     */
    public static BodyDecoder json() {
        return DEFAULT_JSON;
    }

    /**
     * Returns a {@link BodyDecoder} which decodes {@code application/json} and
     * {@code application/*+json} bodies with the specified {@link ObjectMapper}.
     */
    public static BodyDecoder json(ObjectMapper mapper) {
        return new JacksonBodyDecoder(requireNonNull(mapper, "mapper"));
    }

    private BodyDecoders() {}
}
