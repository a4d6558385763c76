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
package org.stixproject.xmlns.id;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stixproject.xmlns.api.IdNamespace;
import org.stixproject.xmlns.util.SystemPropertySupplier;

/**
 * Factory for {@link IdNamespace} instances.
 * <p>
 * The default id namespace is {@code http://example.com} with prefix
 * {@code example}; it can be changed with the system properties
 * {@value #PROP_NAMESPACE} and {@value #PROP_PREFIX}.
 */
public final class IdNamespaces {

    private static final Logger LOG = LoggerFactory.getLogger(IdNamespaces.class);

    public static final String PROP_NAMESPACE = "stix.id.namespace";

    public static final String PROP_PREFIX = "stix.id.prefix";

    public static final String DEFAULT_NAMESPACE = "http://example.com";

    public static final String DEFAULT_PREFIX = "example";

    private IdNamespaces() {
    }

    /**
     * @return a fixed id namespace.
     * @throws IllegalArgumentException if {@code prefix} is not a valid prefix.
     */
    @NotNull
    public static IdNamespace of(@NotNull String namespace, @NotNull String prefix) {
        checkNotNull(namespace);
        checkArgument(isValidPrefix(checkNotNull(prefix)), "Invalid id namespace prefix '%s'", prefix);
        return new FixedIdNamespace(namespace, prefix);
    }

    /**
     * @return the id namespace configured through system properties, or the
     * {@code example} namespace if none is configured.
     */
    @NotNull
    public static IdNamespace getDefault() {
        return fromProperties(System::getProperty);
    }

    static IdNamespace fromProperties(Function<String, String> reader) {
        String namespace = SystemPropertySupplier.create(PROP_NAMESPACE, DEFAULT_NAMESPACE)
                .loggingTo(LOG)
                .usingSystemPropertyReader(reader)
                .validateWith(ns -> !ns.isEmpty())
                .get();
        String prefix = SystemPropertySupplier.create(PROP_PREFIX, DEFAULT_PREFIX)
                .loggingTo(LOG)
                .usingSystemPropertyReader(reader)
                .validateWith(IdNamespaces::isValidPrefix)
                .get();
        return new FixedIdNamespace(namespace, prefix);
    }

    static boolean isValidPrefix(String prefix) {
        return !prefix.isEmpty() && prefix.indexOf(':') == -1;
    }

    private static final class FixedIdNamespace implements IdNamespace {

        private final String namespace;

        private final String prefix;

        FixedIdNamespace(String namespace, String prefix) {
            this.namespace = namespace;
            this.prefix = prefix;
        }

        @NotNull
        @Override
        public String getNamespace() {
            return namespace;
        }

        @NotNull
        @Override
        public String getPrefix() {
            return prefix;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof FixedIdNamespace)) {
                return false;
            }
            FixedIdNamespace that = (FixedIdNamespace) other;
            return namespace.equals(that.namespace) && prefix.equals(that.prefix);
        }

        @Override
        public int hashCode() {
            return Objects.hash(namespace, prefix);
        }

        @Override
        public String toString() {
            return prefix + '=' + namespace;
        }
    }
}
