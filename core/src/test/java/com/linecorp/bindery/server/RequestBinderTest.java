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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.MediaType;

import com.linecorp.bindery.common.BindingRequest;
import com.linecorp.bindery.common.CollectionFormat;
import com.linecorp.bindery.common.FieldAssigners;
import com.linecorp.bindery.common.FieldTable;
import com.linecorp.bindery.common.ObjectShape;
import com.linecorp.bindery.common.ParamDescriptor;
import com.linecorp.bindery.common.ParamLocation;
import com.linecorp.bindery.common.ParamType;
import com.linecorp.bindery.common.PropertyDescriptor;
import com.linecorp.bindery.common.RequestBody;
import com.linecorp.bindery.common.ValueSchema;

class RequestBinderTest {

    static final class Friend {
        String name;
        Integer age;
    }

    static final class Invitation {
        long id;
        Friend friend;
        List<?> friends;
        String traceId;
    }

    static final ObjectShape<Friend> FRIEND = ObjectShape.of(
            Friend.class, Friend::new,
            FieldTable.<Friend>builder()
                      .add("Name", String.class, (f, v) -> f.name = v)
                      .add("Age", Integer.class, (f, v) -> f.age = v)
                      .build(),
            PropertyDescriptor.required("name", ValueSchema.of(ParamType.STRING)).withField("Name"),
            PropertyDescriptor.of("age", ValueSchema.of(ParamType.INTEGER, ValueSchema.INT32))
                              .withField("Age"));

    static final FieldTable<Invitation> INVITATION_FIELDS =
            FieldTable.<Invitation>builder()
                      .add("ID", long.class, (i, v) -> i.id = v)
                      .add("Friend", Friend.class, (i, v) -> i.friend = v)
                      .add("Friends", List.class, (i, v) -> i.friends = v)
                      .add("TraceID", String.class, (i, v) -> i.traceId = v)
                      .build();

    private static final Map<String, String> NO_ROUTE_PARAMS = ImmutableMap.of();

    private static Map<String, Object> newMap() {
        return new LinkedHashMap<>();
    }

    private static BindingRequest query(String query) {
        return BindingRequest.builder().query(query).build();
    }

    private static BindingRequest json(String content) {
        return BindingRequest.builder()
                             .contentType("application/json; charset=utf-8")
                             .content(content)
                             .build();
    }

    @ParameterizedTest
    @CsvSource(value = {
            "csv;things=one,two,three",
            "ssv;things=one%20two%20three",
            "tsv;things=one%09two%09three",
            "pipes;things=one|two|three",
            "multi;things=one&things=two&things=three",
    }, delimiter = ';')
    void collectionFormats(String format, String queryString) {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "things")
                               .arrayOf(ValueSchema.of(ParamType.STRING), CollectionFormat.of(format))
                               .build());

        final BindingResult<Map<String, Object>> result = binder.bind(query(queryString), NO_ROUTE_PARAMS,
                                                                      newMap());
        assertThat(result.isValid()).isTrue();
        assertThat(result.destination()).containsEntry("things", ImmutableList.of("one", "two", "three"));
    }

    @Test
    void pathVariable() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.PATH, "id")
                               .type(ParamType.INTEGER, ValueSchema.INT64)
                               .field("ID")
                               .build());

        final BindingResult<Map<String, Object>> ok =
                binder.bind(query(""), ImmutableMap.of("id", "1"), newMap());
        assertThat(ok.isValid()).isTrue();
        assertThat(ok.destination()).containsEntry("ID", 1L);

        final BindingResult<Map<String, Object>> bad =
                binder.bind(query(""), ImmutableMap.of("id", "abc"), newMap());
        assertThat(bad.isValid()).isFalse();
        assertThat(bad.errors()).containsExactly(
                BindingError.of("id", "path", BindingErrorKind.MALFORMED_VALUE, "expected an int64 value"));
        assertThat(bad.destination()).isEmpty();

        final BindingResult<Map<String, Object>> missing = binder.bind(query(""), NO_ROUTE_PARAMS, newMap());
        assertThat(missing.errors()).extracting(BindingError::kind)
                                    .containsExactly(BindingErrorKind.MISSING_REQUIRED);
    }

    @Test
    void missingHeader() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.HEADER, "X-Required")
                               .type(ParamType.STRING)
                               .required(true)
                               .build(),
                ParamDescriptor.builder(ParamLocation.HEADER, "X-Optional")
                               .type(ParamType.STRING)
                               .build());

        final BindingResult<Map<String, Object>> result = binder.bind(query(""), NO_ROUTE_PARAMS, newMap());
        assertThat(result.errors()).containsExactly(
                BindingError.of("X-Required", "header", BindingErrorKind.MISSING_REQUIRED,
                                "required parameter is missing"));
        assertThat(result.destination()).isEmpty();
    }

    @Test
    void headerIsCaseInsensitive() {
        final RequestBinder<Invitation> binder = RequestBinder.of(
                INVITATION_FIELDS,
                ParamDescriptor.builder(ParamLocation.HEADER, "X-Trace-Id").field("TraceID")
                               .type(ParamType.STRING).build());
        final BindingRequest request = BindingRequest.builder()
                                                     .header("x-trace-id", "first")
                                                     .header("X-TRACE-ID", "second")
                                                     .build();
        assertThat(binder.bind(request, NO_ROUTE_PARAMS, new Invitation()).orElseThrow().traceId)
                .isEqualTo("first");
    }

    @Test
    void malformedBodyDoesNotStopOtherParameters() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "friend")
                               .schema(ValueSchema.object())
                               .required(true)
                               .build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "age")
                               .type(ParamType.INTEGER, ValueSchema.INT32)
                               .build());

        final BindingRequest request = BindingRequest.builder()
                                                     .contentType("application/json")
                                                     .query("age=32")
                                                     .content("{\"name\": \"foo\"")
                                                     .build();
        final BindingResult<Map<String, Object>> result = binder.bind(request, NO_ROUTE_PARAMS, newMap());
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).name()).isEqualTo("friend");
        assertThat(result.errors().get(0).kind()).isEqualTo(BindingErrorKind.DECODE_FAILURE);
        assertThat(result.destination()).containsEntry("age", 32).doesNotContainKey("friend");
    }

    @Test
    void errorsFollowDeclarationOrder() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.PATH, "id").type(ParamType.INTEGER).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "name").type(ParamType.STRING).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "active").type(ParamType.BOOLEAN).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "since")
                               .type(ParamType.STRING, ValueSchema.DATE).build(),
                ParamDescriptor.builder(ParamLocation.HEADER, "X-Token")
                               .type(ParamType.STRING).required(true).build());

        final BindingResult<Map<String, Object>> result = binder.bind(
                query("name=foo&active=maybe&since=2017-01-02"), ImmutableMap.of("id", "x"), newMap());

        assertThat(result.errors()).extracting(BindingError::name).containsExactly("id", "active", "X-Token");
        assertThat(result.errors()).extracting(BindingError::kind)
                                   .containsExactly(BindingErrorKind.MALFORMED_VALUE,
                                                    BindingErrorKind.MALFORMED_VALUE,
                                                    BindingErrorKind.MISSING_REQUIRED);
        assertThat(result.destination()).containsOnlyKeys("name", "since");
    }

    @Test
    void invalidConfigurationsAreReportedOnBind() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder("cookie", "session").type(ParamType.STRING).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "untyped").build(),
                ParamDescriptor.builder(ParamLocation.HEADER, "X-Tags")
                               .arrayOf(ValueSchema.of(ParamType.STRING), CollectionFormat.MULTI)
                               .build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "upload").type(ParamType.FILE).build(),
                ParamDescriptor.builder(ParamLocation.BODY, "first").schema(ValueSchema.object()).build(),
                ParamDescriptor.builder(ParamLocation.BODY, "second").schema(ValueSchema.object()).build());

        final BindingResult<Map<String, Object>> result = binder.bind(query(""), NO_ROUTE_PARAMS, newMap());

        assertThat(result.errors()).extracting(BindingError::name)
                                   .containsExactly("session", "untyped", "X-Tags", "upload", "second");
        assertThat(result.errors()).extracting(BindingError::kind)
                                   .containsExactly(BindingErrorKind.CONFIGURATION_ERROR,
                                                    BindingErrorKind.CONFIGURATION_ERROR,
                                                    BindingErrorKind.MALFORMED_COLLECTION,
                                                    BindingErrorKind.CONFIGURATION_ERROR,
                                                    BindingErrorKind.CONFIGURATION_ERROR);
        assertThat(result.errors().get(0).in()).isEqualTo("cookie");
    }

    @Test
    void emptyScalarIsAbsent() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "age")
                               .type(ParamType.INTEGER, ValueSchema.INT32).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "limit")
                               .type(ParamType.INTEGER, ValueSchema.INT32).defaultValue("10").build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "name")
                               .type(ParamType.STRING).required(true).build());

        final BindingResult<Map<String, Object>> result = binder.bind(query("age=&limit=&name="),
                                                                      NO_ROUTE_PARAMS, newMap());
        assertThat(result.errors()).extracting(BindingError::name).containsExactly("name");
        assertThat(result.destination()).containsOnlyKeys("limit").containsEntry("limit", 10);
    }

    @Test
    void presentButEmptyArray() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "tags")
                               .arrayOf(ValueSchema.of(ParamType.STRING), CollectionFormat.CSV)
                               .defaultValue("a,b")
                               .build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "ids")
                               .arrayOf(ValueSchema.of(ParamType.INTEGER), CollectionFormat.CSV)
                               .required(true)
                               .build());

        final BindingResult<Map<String, Object>> result = binder.bind(query("tags=&ids="),
                                                                      NO_ROUTE_PARAMS, newMap());
        assertThat(result.errors()).containsExactly(
                BindingError.of("ids", "query", BindingErrorKind.MISSING_REQUIRED,
                                "required parameter is empty"));
        assertThat(result.destination()).containsEntry("tags", ImmutableList.of());

        final BindingResult<Map<String, Object>> absent =
                binder.bind(query("ids=1"), NO_ROUTE_PARAMS, newMap());
        assertThat(absent.isValid()).isTrue();
        assertThat(absent.destination()).containsEntry("tags", ImmutableList.of("a", "b"))
                                        .containsEntry("ids", ImmutableList.of(1L));
    }

    @Test
    void multiUsesEveryOccurrence() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "id")
                               .arrayOf(ValueSchema.of(ParamType.INTEGER, ValueSchema.INT32),
                                        CollectionFormat.MULTI)
                               .build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "csv")
                               .arrayOf(ValueSchema.of(ParamType.INTEGER, ValueSchema.INT32),
                                        CollectionFormat.CSV)
                               .build());

        final BindingResult<Map<String, Object>> result =
                binder.bind(query("id=1&id=2&csv=3,4&csv=5"), NO_ROUTE_PARAMS, newMap());
        assertThat(result.destination()).containsEntry("id", ImmutableList.of(1, 2))
                                        .containsEntry("csv", ImmutableList.of(3, 4));
    }

    @Test
    void malformedQueryString() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "a").type(ParamType.STRING).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "b").type(ParamType.STRING).build(),
                ParamDescriptor.builder(ParamLocation.PATH, "id").type(ParamType.STRING).build());

        final BindingResult<Map<String, Object>> result =
                binder.bind(query("a=%zz&b=1"), ImmutableMap.of("id", "7"), newMap());
        assertThat(result.errors()).extracting(BindingError::name).containsExactly("a", "b");
        assertThat(result.errors()).extracting(BindingError::kind)
                                   .containsOnly(BindingErrorKind.MALFORMED_VALUE);
        assertThat(result.destination()).containsEntry("id", "7");
    }

    @Test
    void queryValuesAreDecoded() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "q").type(ParamType.STRING).build());
        assertThat(binder.bind(query("q=foo+bar%21"), NO_ROUTE_PARAMS, newMap()).destination())
                .containsEntry("q", "foo bar!");
    }

    @Test
    void bodyIntoObjectShape() {
        final RequestBinder<Invitation> binder = RequestBinder.of(
                INVITATION_FIELDS,
                ParamDescriptor.builder(ParamLocation.PATH, "id").type(ParamType.INTEGER).field("ID").build(),
                ParamDescriptor.builder(ParamLocation.BODY, "friend")
                               .schema(ValueSchema.objectOf(FRIEND))
                               .field("Friend")
                               .build());

        final Invitation invitation = binder.bind(json("{\"name\":\"foo\",\"age\":3,\"extra\":true}"),
                                                  ImmutableMap.of("id", "9"), new Invitation())
                                            .orElseThrow();
        assertThat(invitation.id).isEqualTo(9L);
        assertThat(invitation.friend.name).isEqualTo("foo");
        assertThat(invitation.friend.age).isEqualTo(3);
    }

    @Test
    void nestedErrorsArePaths() {
        final RequestBinder<Invitation> binder = RequestBinder.of(
                INVITATION_FIELDS,
                ParamDescriptor.builder(ParamLocation.BODY, "friends")
                               .schema(ValueSchema.arrayOf(ValueSchema.objectOf(FRIEND)))
                               .field("Friends")
                               .build());

        final BindingResult<Invitation> ok = binder.bind(
                json("[{\"name\":\"a\",\"age\":1},{\"name\":\"b\"}]"), NO_ROUTE_PARAMS, new Invitation());
        assertThat(ok.isValid()).isTrue();
        assertThat(ok.destination().friends).hasSize(2);
        final Friend second = (Friend) ok.destination().friends.get(1);
        assertThat(second.name).isEqualTo("b");
        assertThat(second.age).isNull();

        final BindingResult<Invitation> bad = binder.bind(
                json("[{\"name\":\"a\",\"age\":1},{\"age\":\"x\"},3]"), NO_ROUTE_PARAMS, new Invitation());
        assertThat(bad.errors()).extracting(BindingError::name)
                                .containsExactly("friends[1].name", "friends[1].age", "friends[2]");
        assertThat(bad.errors()).extracting(BindingError::kind)
                                .containsExactly(BindingErrorKind.MISSING_REQUIRED,
                                                 BindingErrorKind.MALFORMED_VALUE,
                                                 BindingErrorKind.MALFORMED_COLLECTION);
        assertThat(bad.errors()).extracting(BindingError::in).containsOnly("body");
        assertThat(bad.destination().friends).isNull();
    }

    @Test
    void bodyMediaTypes() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "payload")
                               .schema(ValueSchema.object())
                               .required(true)
                               .build());

        final BindingRequest plain = BindingRequest.builder().contentType("text/plain").content("{}").build();
        final BindingRequest untyped = BindingRequest.builder().content("{}").build();
        final BindingRequest malformed =
                BindingRequest.builder().contentType("application(").content("{}").build();
        final BindingRequest vendor = BindingRequest.builder()
                                                    .contentType("application/vnd.bindery+json")
                                                    .content("{\"a\":1}")
                                                    .build();
        final BindingRequest empty = BindingRequest.builder().contentType("application/json").build();

        assertThat(binder.bind(plain, NO_ROUTE_PARAMS, newMap()).errors()).extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE);
        assertThat(binder.bind(untyped, NO_ROUTE_PARAMS, newMap()).errors()).extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE);
        assertThat(binder.bind(malformed, NO_ROUTE_PARAMS, newMap()).errors()).extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.UNSUPPORTED_MEDIA_TYPE);
        assertThat(binder.bind(vendor, NO_ROUTE_PARAMS, newMap()).destination())
                .containsEntry("payload", ImmutableMap.of("a", 1));
        assertThat(binder.bind(empty, NO_ROUTE_PARAMS, newMap()).errors()).extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.MISSING_REQUIRED);
    }

    @Test
    void bodyDecoderIsInvokedOnce() throws Exception {
        final BodyDecoder decoder = mock(BodyDecoder.class);
        when(decoder.canDecode(any(MediaType.class))).thenReturn(true);
        when(decoder.decode(any(InputStream.class), any(MediaType.class)))
                .thenReturn(new ObjectMapper().readTree("{\"name\":\"foo\"}"));

        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "first").schema(ValueSchema.object()).build(),
                ParamDescriptor.builder(ParamLocation.BODY, "second").schema(ValueSchema.object()).build());

        final BindingResult<Map<String, Object>> result =
                binder.bind(json("{\"name\":\"foo\"}"), NO_ROUTE_PARAMS, decoder, newMap());
        assertThat(result.destination()).containsEntry("first", ImmutableMap.of("name", "foo"));
        assertThat(result.errors()).extracting(BindingError::kind)
                                   .containsExactly(BindingErrorKind.CONFIGURATION_ERROR);
        verify(decoder, times(1)).decode(any(InputStream.class), any(MediaType.class));

        final BodyDecoder unused = mock(BodyDecoder.class);
        binder.bind(json(""), NO_ROUTE_PARAMS, unused, newMap());
        verify(unused, never()).decode(any(InputStream.class), any(MediaType.class));
    }

    @Test
    void consumedBody() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "payload").schema(ValueSchema.object()).build());
        final RequestBody body = RequestBody.ofUtf8("{}");
        body.open();
        final BindingRequest request =
                BindingRequest.builder().contentType("application/json").body(body).build();

        assertThat(binder.bind(request, NO_ROUTE_PARAMS, newMap()).errors()).containsExactly(
                BindingError.of("payload", "body", BindingErrorKind.DECODE_FAILURE,
                                "request body has been consumed already"));
    }

    @Test
    void maxRequestLength() {
        final RequestBinder<Map<String, Object>> binder =
                RequestBinder.builder(FieldAssigners.ofMap())
                             .add(ParamDescriptor.builder(ParamLocation.BODY, "payload")
                                                 .schema(ValueSchema.object())
                                                 .build())
                             .maxRequestLength(8)
                             .build();

        assertThat(binder.bind(json("{\"a\":1}"), NO_ROUTE_PARAMS, newMap()).isValid()).isTrue();
        assertThat(binder.bind(json("{\"a\":100}"), NO_ROUTE_PARAMS, newMap()).errors())
                .extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.DECODE_FAILURE);

        final RequestBinder<Map<String, Object>> unlimited =
                RequestBinder.builder(FieldAssigners.ofMap())
                             .add(ParamDescriptor.builder(ParamLocation.BODY, "payload")
                                                 .schema(ValueSchema.object())
                                                 .build())
                             .maxRequestLength(Long.MAX_VALUE)
                             .build();
        final BindingResult<Map<String, Object>> result = unlimited.bind(json("{}"), NO_ROUTE_PARAMS, newMap());
        assertThat(result.isValid()).isTrue();
        assertThat(result.destination()).containsEntry("payload", ImmutableMap.of());
    }

    @Test
    void interruptedBody() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "payload").schema(ValueSchema.object()).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "lang").type(ParamType.STRING).build());
        final InputStream stream = new InputStream() {
            private int count;

            @Override
            public int read() throws IOException {
                if (count++ < 3) {
                    return '{';
                }
                throw new InterruptedIOException("client gone");
            }
        };
        final BindingRequest request = BindingRequest.builder()
                                                     .contentType("application/json")
                                                     .query("lang=en")
                                                     .body(RequestBody.of(stream))
                                                     .build();

        final BindingResult<Map<String, Object>> result = binder.bind(request, NO_ROUTE_PARAMS, newMap());
        assertThat(result.errors()).hasSize(1);
        final BindingError error = result.errors().get(0);
        assertThat(error.name()).isEqualTo("payload");
        assertThat(error.kind()).isEqualTo(BindingErrorKind.DECODE_FAILURE);
        assertThat(error.message()).contains("InterruptedIOException", "client gone");
        assertThat(result.destination()).containsOnlyKeys("lang");
    }

    @Test
    void tooManyQueryParameters() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.QUERY, "t")
                               .arrayOf(ValueSchema.of(ParamType.STRING), CollectionFormat.MULTI)
                               .build());

        final String atLimit = Joiner.on('&').join(Collections.nCopies(1024, "t=x"));
        final BindingResult<Map<String, Object>> accepted =
                binder.bind(query(atLimit), NO_ROUTE_PARAMS, newMap());
        assertThat(accepted.isValid()).isTrue();
        assertThat((List<?>) accepted.destination().get("t")).hasSize(1024);

        final String overLimit = Joiner.on('&').join(Collections.nCopies(1500, "t=x"));
        final BindingResult<Map<String, Object>> rejected =
                binder.bind(query(overLimit), NO_ROUTE_PARAMS, newMap());
        assertThat(rejected.errors()).hasSize(1);
        assertThat(rejected.errors().get(0).kind()).isEqualTo(BindingErrorKind.MALFORMED_VALUE);
        assertThat(rejected.errors().get(0).message()).contains("too many parameters");
        assertThat(rejected.destination()).isEmpty();

        final RequestBinder<Map<String, Object>> small =
                RequestBinder.builder(FieldAssigners.ofMap())
                             .add(ParamDescriptor.builder(ParamLocation.QUERY, "a")
                                                 .type(ParamType.STRING)
                                                 .build())
                             .maxNumParameters(2)
                             .build();
        assertThat(small.bind(query("a=1&b=2"), NO_ROUTE_PARAMS, newMap()).isValid()).isTrue();
        assertThat(small.bind(query("a=1&b=2&c=3"), NO_ROUTE_PARAMS, newMap()).errors())
                .extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.MALFORMED_VALUE);
    }

    @Test
    void concurrentBinds() throws Exception {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.PATH, "id").type(ParamType.INTEGER).build(),
                ParamDescriptor.builder(ParamLocation.QUERY, "name").type(ParamType.STRING).build(),
                ParamDescriptor.builder(ParamLocation.BODY, "payload").schema(ValueSchema.object()).build());

        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<BindingResult<Map<String, Object>>>> futures = new ArrayList<>();
            for (int i = 0; i < 2000; i++) {
                final int id = i;
                futures.add(executor.submit(() -> {
                    final BindingRequest request = BindingRequest.builder()
                                                                 .contentType("application/json")
                                                                 .query("name=n" + id)
                                                                 .content("{\"id\":" + id + '}')
                                                                 .build();
                    return binder.bind(request, ImmutableMap.of("id", String.valueOf(id)), newMap());
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                final BindingResult<Map<String, Object>> result = futures.get(i).get(10, TimeUnit.SECONDS);
                assertThat(result.isValid()).isTrue();
                assertThat(result.destination()).containsEntry("id", (long) i)
                                                .containsEntry("name", "n" + i)
                                                .containsEntry("payload", ImmutableMap.of("id", i));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void scalarBody() {
        final RequestBinder<Map<String, Object>> binder = RequestBinder.of(
                FieldAssigners.ofMap(),
                ParamDescriptor.builder(ParamLocation.BODY, "count")
                               .type(ParamType.INTEGER, ValueSchema.INT32)
                               .build());
        assertThat(binder.bind(json("42"), NO_ROUTE_PARAMS, newMap()).destination()).containsEntry("count", 42);
        assertThat(binder.bind(json("\"42\""), NO_ROUTE_PARAMS, newMap()).errors())
                .extracting(BindingError::kind)
                .containsExactly(BindingErrorKind.MALFORMED_VALUE);
        assertThat(binder.bind(json("null"), NO_ROUTE_PARAMS, newMap()).isValid()).isTrue();
    }

    @Test
    void descriptors() {
        final ParamDescriptor id = ParamDescriptor.builder(ParamLocation.PATH, "id")
                                                  .type(ParamType.INTEGER).build();
        final ParamDescriptor name = ParamDescriptor.builder(ParamLocation.QUERY, "name")
                                                    .type(ParamType.STRING).build();
        assertThat(RequestBinder.of(FieldAssigners.ofMap(), id, name).descriptors()).containsExactly(id, name);
    }
}
