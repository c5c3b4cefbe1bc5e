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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The outcome of {@link RequestBinder#bind}: the destination and every {@link BindingError} found.
 * The destination may be partially populated when the result is not valid, so its contents must
 * not be relied upon in that case.
 *
 * @param <T> the destination type
 */
public final class BindingResult<T> {

    private final T destination;
    private final List<BindingError> errors;

    BindingResult(T destination, List<BindingError> errors) {
        this.destination = requireNonNull(destination, "destination");
        this.errors = ImmutableList.copyOf(requireNonNull(errors, "errors"));
    }

    /**
     * Returns {@code true} if every parameter was bound without an error.
     */
    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Returns the errors in the declaration order of the parameters.
     */
    public List<BindingError> errors() {
        return errors;
    }

    /**
     * Returns the destination passed to {@link RequestBinder#bind}.
     */
    public T destination() {
        return destination;
    }

    /**
     * Returns the destination if this result is valid.
     *
     * @throws BindingException if this result has any error
     */
    public T orElseThrow() {
        if (!isValid()) {
            throw new BindingException(errors);
        }
        return destination;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("valid", isValid())
                          .add("errors", errors)
                          .toString();
    }
}
