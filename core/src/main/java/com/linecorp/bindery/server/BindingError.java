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

import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;

/**
 * A failure to bind one parameter. The name of a nested value is a path such as
 * {@code friend.age} or {@code tags[2]}.
 */
@JsonPropertyOrder({ "name", "in", "kind", "message" })
public final class BindingError {

    /**
     * Returns a new {@link BindingError}.
     */
    public static BindingError of(String name, String in, BindingErrorKind kind, String message) {
        return new BindingError(name, in, kind, message);
    }

    private final String name;
    private final String in;
    private final BindingErrorKind kind;
    private final String message;

    private BindingError(String name, String in, BindingErrorKind kind, String message) {
        this.name = requireNonNull(name, "name");
        this.in = requireNonNull(in, "in");
        this.kind = requireNonNull(kind, "kind");
        this.message = requireNonNull(message, "message");
    }

    /**
     * Returns the name of the parameter, or the path of the nested value, that failed.
     */
    @JsonProperty
    public String name() {
        return name;
    }

    /**
     * Returns the location of the parameter as it was declared.
     */
    @JsonProperty
    public String in() {
        return in;
    }

    @JsonProperty
    public BindingErrorKind kind() {
        return kind;
    }

    @JsonProperty
    public String message() {
        return message;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BindingError)) {
            return false;
        }
        final BindingError that = (BindingError) o;
        return name.equals(that.name) &&
               in.equals(that.in) &&
               kind == that.kind &&
               message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, in, kind, message);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("in", in)
                          .add("kind", kind.value())
                          .add("message", message)
                          .toString();
    }
}
