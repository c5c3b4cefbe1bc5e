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

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * The textual convention by which the items of an array parameter are encoded.
 */
public enum CollectionFormat {
    /**
     * Comma separated values, e.g. {@code a,b,c}.
     */
    CSV(','),
    /**
     * Space separated values, e.g. {@code a b c}.
     */
    SSV(' '),
    /**
     * Tab separated values.
     */
    TSV('\t'),
    /**
     * Pipe separated values, e.g. {@code a|b|c}.
     */
    PIPES('|'),
    /**
     * One item per occurrence of the parameter, e.g. {@code ?tag=a&tag=b}. Valid only for
     * {@link ParamLocation#QUERY} parameters.
     */
    MULTI(null);

    @Nullable
    private final Splitter splitter;

    CollectionFormat(@Nullable Character delimiter) {
        splitter = delimiter != null ? Splitter.on(delimiter.charValue()) : null;
    }

    /**
     * Returns the textual form of this format, e.g. {@code "csv"}.
     */
    public String value() {
        return Ascii.toLowerCase(name());
    }

    /**
     * Splits the raw fragments of a parameter into item strings.
     *
     * <p>For {@link #MULTI}, each fragment is one item. For the delimited formats, only the first
     * fragment is split. Empty items between delimiters are retained. A single empty fragment
     * yields an empty list, so {@code ?tags=} is a present but empty array.
     */
    public List<String> split(List<String> fragments) {
        requireNonNull(fragments, "fragments");
        if (fragments.isEmpty()) {
            return ImmutableList.of();
        }
        if (splitter == null) {
            if (fragments.size() == 1 && fragments.get(0).isEmpty()) {
                return ImmutableList.of();
            }
            return ImmutableList.copyOf(fragments);
        }
        final String first = fragments.get(0);
        if (first.isEmpty()) {
            return ImmutableList.of();
        }
        return splitter.splitToList(first);
    }

    /**
     * Returns the {@link CollectionFormat} of the specified textual form, ignoring ASCII case.
     *
     * @throws IllegalArgumentException if {@code value} is not a known format
     */
    public static CollectionFormat of(String value) {
        requireNonNull(value, "value");
        for (CollectionFormat format : values()) {
            if (Ascii.equalsIgnoreCase(format.name(), value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("unknown collection format: " + value);
    }
}
