/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stixproject.xmlns.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to the system properties configuring namespace resolution.
 * <p>
 * Reading a property is logged at TRACE, a value that does not parse or does
 * not pass the validator is ignored with an ERROR, and a value differing
 * from the default is logged at INFO.
 * <p>
 * The supported types are {@link Boolean} and {@link String}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;

    private final T defaultValue;

    private final Function<String, T> parser;

    private Logger log = LOG;

    private Predicate<T> validator = (v) -> true;

    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(String propName, T defaultValue) {
        this.propName = checkNotNull(propName, "propName must be non-null");
        this.defaultValue = checkNotNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    /**
     * Create it for a given property name and default value.
     *
     * @throws IllegalArgumentException if the type of {@code defaultValue} is
     *         not supported.
     */
    @NotNull
    public static <U> SystemPropertySupplier<U> create(@NotNull String propName, @NotNull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    /**
     * Log to {@code log} instead of the logger of this class.
     */
    @NotNull
    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    @NotNull
    public SystemPropertySupplier<T> validateWith(@NotNull Predicate<T> validator) {
        this.validator = checkNotNull(validator);
        return this;
    }

    /**
     * Read properties through {@code sysPropReader} instead of
     * {@link System#getProperty(String)}.
     */
    @NotNull
    public SystemPropertySupplier<T> usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
        this.sysPropReader = checkNotNull(sysPropReader);
        return this;
    }

    @Override
    public T get() {
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return defaultValue;
        }

        log.trace("System property {} set to '{}'", propName, value);
        T parsed = parser.apply(value);
        if (parsed == null || !validator.test(parsed)) {
            log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            return defaultValue;
        }
        if (!parsed.equals(defaultValue)) {
            log.info("System property {} found to be '{}'", propName, parsed);
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) parseBoolean(v);
        }
        checkArgument(defaultValue instanceof String,
                "expects a defaultValue of Boolean or String, but got: %s", defaultValue.getClass());
        return v -> (T) v;
    }

    // Boolean.valueOf() maps anything but "true" to false
    private static Boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
