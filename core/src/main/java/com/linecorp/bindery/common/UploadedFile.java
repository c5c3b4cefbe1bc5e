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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A file part of a multipart form body. The content can be opened only once.
 */
public final class UploadedFile {

    private final String filename;
    @Nullable
    private final String contentType;
    private final byte[] content;
    private final AtomicBoolean opened = new AtomicBoolean();

    /**
     * Creates a new instance. {@code content} is not copied.
     */
    public UploadedFile(String filename, @Nullable String contentType, byte[] content) {
        this.filename = requireNonNull(filename, "filename");
        this.contentType = contentType;
        this.content = requireNonNull(content, "content");
    }

    /**
     * Returns the file name from the {@code content-disposition} header of the part.
     */
    public String filename() {
        return filename;
    }

    /**
     * Returns the {@code content-type} declared by the part, or {@code null}.
     */
    @Nullable
    public String contentType() {
        return contentType;
    }

    /**
     * Returns the length of the content in bytes.
     */
    public long size() {
        return content.length;
    }

    /**
     * Returns whether {@link #openStream()} has been called.
     */
    public boolean isOpened() {
        return opened.get();
    }

    /**
     * Opens the content of this file.
     *
     * @throws IllegalStateException if the content has been opened already
     */
    public InputStream openStream() {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("the content of '" + filename + "' has been opened already");
        }
        return new ByteArrayInputStream(content);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("filename", filename)
                          .add("contentType", contentType)
                          .add("size", content.length)
                          .toString();
    }
}
