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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The reason a parameter could not be bound.
 */
public enum BindingErrorKind {
    /**
     * A required parameter is absent and has no default value.
     */
    MISSING_REQUIRED("missing-required"),
    /**
     * A value cannot be parsed as the declared type and format.
     */
    MALFORMED_VALUE("malformed-value"),
    /**
     * An item of an array cannot be coerced, or the collection format cannot be used at the
     * parameter's location.
     */
    MALFORMED_COLLECTION("malformed-collection"),
    /**
     * The content type of a body that must be decoded is missing, malformed or not supported.
     */
    UNSUPPORTED_MEDIA_TYPE("unsupported-media-type"),
    /**
     * The body could not be read or decoded.
     */
    DECODE_FAILURE("decode-failure"),
    /**
     * The parameter descriptor itself is invalid.
     */
    CONFIGURATION_ERROR("configuration-error");

    private final String value;

    BindingErrorKind(String value) {
        this.value = value;
    }

    /**
     * Returns the textual form of this kind, e.g. {@code "missing-required"}.
     */
    @JsonValue
    public String value() {
        return value;
    }
}
