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

import static java.util.Objects.requireNonNull;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import com.linecorp.bindery.common.UploadedFile;

/**
 * The fields and file parts of a decoded form body.
 */
public final class FormData {

    private static final FormData EMPTY = new FormData(ImmutableListMultimap.of(),
                                                       ImmutableListMultimap.of());

    /**
     * Returns an empty {@link FormData}.
     */
    public static FormData empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link FormData} with the specified fields and file parts.
     */
    public static FormData of(ListMultimap<String, String> fields, ListMultimap<String, UploadedFile> files) {
        return new FormData(ImmutableListMultimap.copyOf(requireNonNull(fields, "fields")),
                            ImmutableListMultimap.copyOf(requireNonNull(files, "files")));
    }

    private final ImmutableListMultimap<String, String> fields;
    private final ImmutableListMultimap<String, UploadedFile> files;

    private FormData(ImmutableListMultimap<String, String> fields,
                     ImmutableListMultimap<String, UploadedFile> files) {
        this.fields = fields;
        this.files = files;
    }

    /**
     * Returns all values of the specified field in the order they appeared, or an empty list.
     */
    public List<String> fields(String name) {
        return fields.get(name);
    }

    /**
     * Returns the first file part of the specified name, or {@code null}.
     */
    @Nullable
    public UploadedFile file(String name) {
        final List<UploadedFile> parts = files.get(name);
        return parts.isEmpty() ? null : parts.get(0);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("fields", fields)
                          .add("files", files)
                          .toString();
    }
}
