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

import javax.annotation.Nullable;

import com.linecorp.bindery.common.ParamDescriptor;
import com.linecorp.bindery.common.ValueSchema;

/**
 * Pulls the raw value of a parameter out of a request.
 *
 * @see ValueExtractors
 */
@FunctionalInterface
interface ValueExtractor {

    /**
     * Returns the raw value of the specified parameter, {@link RawValue#ABSENT} if the request does
     * not have it, or {@code null} if an error has been recorded into {@code errors}.
     */
    @Nullable
    RawValue extract(ParamDescriptor descriptor, ValueSchema schema, BindingContext ctx, ErrorCollector errors);
}
