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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;

/**
 * Collects the {@link BindingError}s of a single bind in the order they are added. Not thread-safe.
 */
final class ErrorCollector {

    private final List<BindingError> errors = new ArrayList<>();

    void add(String name, String in, BindingErrorKind kind, String message) {
        errors.add(BindingError.of(name, in, kind, message));
    }

    /**
     * Returns a mark to be passed to {@link #hasErrorsSince(int)}.
     */
    int mark() {
        return errors.size();
    }

    /**
     * Returns whether any error was added after {@link #mark()} returned {@code mark}.
     */
    boolean hasErrorsSince(int mark) {
        return errors.size() > mark;
    }

    boolean isEmpty() {
        return errors.isEmpty();
    }

    List<BindingError> errors() {
        return errors;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("errors", errors)
                          .toString();
    }
}
