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

import java.util.function.IntPredicate;
import java.util.function.LongPredicate;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;

/**
 * The system properties that affect Bindery's default behavior. Each flag is read once, when this
 * class is initialized, and the value in effect is logged.
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.bindery.";

    private static final long DEFAULT_MAX_REQUEST_LENGTH = 10 * 1024 * 1024; // 10 MiB

    private static final long MAX_REQUEST_LENGTH =
            getLong("maxRequestLength", DEFAULT_MAX_REQUEST_LENGTH, value -> value >= 0);

    private static final int DEFAULT_MAX_NUM_PARAMETERS = 1024;

    private static final int MAX_NUM_PARAMETERS =
            getInt("maxNumParameters", DEFAULT_MAX_NUM_PARAMETERS, value -> value > 0);

    private static final boolean VERBOSE_BINDING_ERRORS =
            getBoolean("verboseBindingErrors", false, value -> true);

    /**
     * Returns the default maximum length of a request body that is read for a body, form or file
     * parameter. Note that this flag has no effect if a user specified the value explicitly via
     * {@code RequestBinderBuilder.maxRequestLength(long)}.
     *
     * <p>The default value of this flag is {@value #DEFAULT_MAX_REQUEST_LENGTH}. Specify the
     * {@code -Dcom.linecorp.bindery.maxRequestLength=<long>} JVM option to override the default value.
     * {@code 0} disables the length limit.
     */
    public static long maxRequestLength() {
        return MAX_REQUEST_LENGTH;
    }

    /**
     * Returns the default maximum number of parameters decoded from a query string or a form body.
     * A request with more parameters than this fails to bind instead of losing the excess ones.
     * Note that this flag has no effect if a user specified the value explicitly via
     * {@code RequestBinderBuilder.maxNumParameters(int)}.
     *
     * <p>The default value of this flag is {@value #DEFAULT_MAX_NUM_PARAMETERS}. Specify the
     * {@code -Dcom.linecorp.bindery.maxNumParameters=<integer>} JVM option to override the default value.
     */
    public static int maxNumParameters() {
        return MAX_NUM_PARAMETERS;
    }

    /**
     * Returns whether the rejected raw value is included in the message of a binding error.
     * Note that this flag has no effect if a user specified the value explicitly via
     * {@code RequestBinderBuilder.verboseErrors(boolean)}.
     *
     * <p>This flag is disabled by default. Specify the
     * {@code -Dcom.linecorp.bindery.verboseBindingErrors=true} JVM option to enable it.
     */
    public static boolean verboseBindingErrors() {
        return VERBOSE_BINDING_ERRORS;
    }

    private static int getInt(String name, int defaultValue, IntPredicate validator) {
        return Integer.parseInt(getNormalized(name, String.valueOf(defaultValue), value -> {
            try {
                return validator.test(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                return false;
            }
        }));
    }

    private static long getLong(String name, long defaultValue, LongPredicate validator) {
        return Long.parseLong(getNormalized(name, String.valueOf(defaultValue), value -> {
            try {
                return validator.test(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return false;
            }
        }));
    }

    private static boolean getBoolean(String name, boolean defaultValue, Predicate<Boolean> validator) {
        return Boolean.parseBoolean(getNormalized(name, String.valueOf(defaultValue), value -> {
            if ("true".equals(value)) {
                return validator.test(true);
            }
            if ("false".equals(value)) {
                return validator.test(false);
            }
            return false;
        }));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value);
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", fullName, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", fullName, value);
        }
        logger.debug("{}: {} (default)", fullName, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
