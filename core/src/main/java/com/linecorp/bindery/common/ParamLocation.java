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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;

/**
 * A location in an HTTP request where the raw value of a parameter is found.
 */
public enum ParamLocation {
    /**
     * A named variable of the matched path template.
     */
    PATH("path"),
    /**
     * A query string parameter.
     */
    QUERY("query"),
    /**
     * An HTTP header.
     */
    HEADER("header"),
    /**
     * A field of a URL-encoded or multipart form body.
     */
    FORM("form", "formdata"),
    /**
     * A file part of a multipart form body.
     */
    FILE("file"),
    /**
     * The whole request body, decoded by a {@code BodyDecoder}.
     */
    BODY("body");

    private static final Map<String, ParamLocation> byValue;

    static {
        final ImmutableMap.Builder<String, ParamLocation> builder = ImmutableMap.builder();
        for (ParamLocation location : values()) {
            for (String alias : location.aliases) {
                builder.put(alias, location);
            }
        }
        byValue = builder.build();
    }

    private final String value;
    private final String[] aliases;

    ParamLocation(String value, String... extraAliases) {
        this.value = value;
        aliases = new String[extraAliases.length + 1];
        aliases[0] = value;
        System.arraycopy(extraAliases, 0, aliases, 1, extraAliases.length);
    }

    /**
     * Returns the textual form of this location, e.g. {@code "query"}.
     */
    public String value() {
        return value;
    }

    /**
     * Returns the {@link ParamLocation} whose textual form is {@code value}, ignoring ASCII case.
     * {@code "formData"} is accepted as an alias of {@link #FORM}.
     *
     * @return the {@link ParamLocation}, or {@code null} if {@code value} is not a known location.
     */
    @Nullable
    public static ParamLocation find(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return byValue.get(Ascii.toLowerCase(value));
    }
}
