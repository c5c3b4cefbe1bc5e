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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.bindery.common.UploadedFile;

/**
 * The raw value of a parameter as found in a request, before it is coerced. It is one of
 * text fragments, a file part or a decoded body, or {@link #ABSENT}.
 */
final class RawValue {

    static final RawValue ABSENT = new RawValue(ImmutableList.of(), null, null);

    static RawValue ofText(List<String> fragments) {
        requireNonNull(fragments, "fragments");
        checkArgument(!fragments.isEmpty(), "fragments is empty");
        return new RawValue(ImmutableList.copyOf(fragments), null, null);
    }

    static RawValue ofText(String fragment) {
        return new RawValue(ImmutableList.of(requireNonNull(fragment, "fragment")), null, null);
    }

    static RawValue ofFile(UploadedFile file) {
        return new RawValue(ImmutableList.of(), requireNonNull(file, "file"), null);
    }

    static RawValue ofNode(JsonNode node) {
        return new RawValue(ImmutableList.of(), null, requireNonNull(node, "node"));
    }

    private final List<String> fragments;
    @Nullable
    private final UploadedFile file;
    @Nullable
    private final JsonNode node;

    private RawValue(List<String> fragments, @Nullable UploadedFile file, @Nullable JsonNode node) {
        this.fragments = fragments;
        this.file = file;
        this.node = node;
    }

    boolean isAbsent() {
        return this == ABSENT;
    }

    List<String> fragments() {
        return fragments;
    }

    @Nullable
    UploadedFile file() {
        return file;
    }

    @Nullable
    JsonNode node() {
        return node;
    }

    @Override
    public String toString() {
        if (isAbsent()) {
            return "RawValue{absent}";
        }
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("fragments", fragments.isEmpty() ? null : fragments)
                          .add("file", file)
                          .add("node", node)
                          .toString();
    }
}
