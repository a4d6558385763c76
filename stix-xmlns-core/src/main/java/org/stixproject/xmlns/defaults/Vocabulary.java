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
package org.stixproject.xmlns.defaults;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The namespaces defined by one XML vocabulary, each with its canonical
 * prefix and, where a schema is published, its schema location.
 */
public final class Vocabulary {

    private final String name;

    private final ImmutableList<Entry> entries;

    private Vocabulary(String name, ImmutableList<Entry> entries) {
        this.name = name;
        this.entries = entries;
    }

    @NotNull
    public static Builder builder(@NotNull String name) {
        return new Builder(checkNotNull(name));
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public String toString() {
        return name + entries;
    }

    /**
     * One namespace of a vocabulary.
     */
    public static final class Entry {

        private final String namespace;

        private final String prefix;

        private final String schemaLocation;

        Entry(String namespace, String prefix, String schemaLocation) {
            this.namespace = namespace;
            this.prefix = prefix;
            this.schemaLocation = schemaLocation;
        }

        @NotNull
        public String getNamespace() {
            return namespace;
        }

        @NotNull
        public String getPrefix() {
            return prefix;
        }

        @Nullable
        public String getSchemaLocation() {
            return schemaLocation;
        }

        @Override
        public String toString() {
            return prefix + '=' + namespace;
        }
    }

    public static final class Builder {

        private final String name;

        private final ImmutableList.Builder<Entry> entries = ImmutableList.builder();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Adds a namespace without published schema.
         */
        @NotNull
        public Builder add(@NotNull String namespace, @NotNull String prefix) {
            return add(namespace, prefix, null);
        }

        @NotNull
        public Builder add(@NotNull String namespace, @NotNull String prefix, @Nullable String schemaLocation) {
            checkNotNull(namespace);
            checkNotNull(prefix);
            checkArgument(prefix.indexOf(':') == -1, "Invalid prefix %s for namespace %s", prefix, namespace);
            entries.add(new Entry(namespace, prefix, schemaLocation));
            return this;
        }

        @NotNull
        public Vocabulary build() {
            return new Vocabulary(name, entries.build());
        }
    }
}
