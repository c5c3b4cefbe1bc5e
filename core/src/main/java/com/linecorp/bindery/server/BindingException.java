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
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * A {@link RuntimeException} raised by {@link BindingResult#orElseThrow()} when a request could
 * not be bound.
 */
public final class BindingException extends RuntimeException {

    private static final long serialVersionUID = -3651046457935473291L;

    private final List<BindingError> errors;

    /**
     * Creates a new instance with the specified non-empty list of {@link BindingError}s.
     */
    public BindingException(List<BindingError> errors) {
        super(message(errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    /**
     * Returns the errors in the declaration order of the parameters.
     */
    public List<BindingError> errors() {
        return errors;
    }

    private static String message(List<BindingError> errors) {
        requireNonNull(errors, "errors");
        checkArgument(!errors.isEmpty(), "errors is empty");
        return "failed to bind " + errors.size() + " parameter(s): " +
               errors.stream()
                     .map(e -> e.name() + " (" + e.kind().value() + ')')
                     .collect(Collectors.joining(", "));
    }
}
