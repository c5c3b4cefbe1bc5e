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

/**
 * Binding request values into typed destinations.
 *
 * <p>A {@link com.linecorp.bindery.server.RequestBinder} is built once from a list of
 * {@link com.linecorp.bindery.common.ParamDescriptor}s and a
 * {@link com.linecorp.bindery.common.FieldAssigner}, then used for any number of requests:
 * <pre>{@code
 * RequestBinder<Order> binder =
 *         RequestBinder.builder(ORDER_FIELDS)
 *                      .add(ParamDescriptor.builder(ParamLocation.PATH, "id")
 *                                          .type(ParamType.INTEGER, "int64")
 *                                          .field("ID")
 *                                          .build())
 *                      .build();
 *
 * BindingResult<Order> result = binder.bind(request, routeParams, BodyDecoders.json(), new Order());
 * if (!result.isValid()) {
 *     // result.errors() lists every offending parameter.
 * }
 * }</pre>
 */
@NonNullByDefault
package com.linecorp.bindery.server;

import com.linecorp.bindery.common.annotation.NonNullByDefault;
