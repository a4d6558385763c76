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
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_CYBOX;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_CYBOX_COMMON;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_CYBOX_VOCABS;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_STIX;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_STIX_COMMON;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_STIX_VOCABS;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_XSI;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable default tables of the supported vocabularies:
 * <ul>
 *     <li>namespace to canonical prefix, covering every namespace the
 *     vocabularies define (the <em>well-known</em> namespaces),</li>
 *     <li>namespace to schema location, covering every namespace with a
 *     published schema,</li>
 *     <li>the core XML infrastructure namespaces, which never get a schema
 *     location,</li>
 *     <li>the baseline prefixes declared in every output document.</li>
 * </ul>
 * Instances are built once and shared by all registries.
 */
public final class NamespaceDefaults {

    private static final NamespaceDefaults DEFAULT = builder()
            .addXmlVocabulary(Vocabularies.XML)
            .addVocabulary(Vocabularies.STIX)
            .addVocabulary(Vocabularies.CYBOX)
            .addVocabulary(Vocabularies.EXTENSIONS)
            .addBaseline("xsi", NAMESPACE_XSI)
            .addBaseline("stix", NAMESPACE_STIX)
            .addBaseline("stixCommon", NAMESPACE_STIX_COMMON)
            .addBaseline("stixVocabs", NAMESPACE_STIX_VOCABS)
            .addBaseline("cybox", NAMESPACE_CYBOX)
            .addBaseline("cyboxCommon", NAMESPACE_CYBOX_COMMON)
            .addBaseline("cyboxVocabs", NAMESPACE_CYBOX_VOCABS)
            .build();

    private final ImmutableMap<String, String> prefixes;

    private final ImmutableMap<String, String> schemaLocations;

    private final ImmutableSet<String> xmlNamespaces;

    private final ImmutableMap<String, String> baseline;

    private NamespaceDefaults(Builder builder) {
        this.prefixes = ImmutableMap.copyOf(builder.prefixes);
        this.schemaLocations = ImmutableMap.copyOf(builder.schemaLocations);
        this.xmlNamespaces = ImmutableSet.copyOf(builder.xmlNamespaces);
        this.baseline = ImmutableMap.copyOf(builder.baseline);
    }

    /**
     * @return the tables of the built-in XML, STIX, CybOX and extension
     * vocabularies.
     */
    @NotNull
    public static NamespaceDefaults getDefault() {
        return DEFAULT;
    }

    /**
     * @return an empty builder.
     */
    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with the built-in tables, to which
     * further extension vocabularies can be added.
     */
    @NotNull
    public static Builder builderWithDefaults() {
        Builder builder = new Builder();
        builder.prefixes.putAll(DEFAULT.prefixes);
        builder.schemaLocations.putAll(DEFAULT.schemaLocations);
        builder.xmlNamespaces.addAll(DEFAULT.xmlNamespaces);
        builder.baseline.putAll(DEFAULT.baseline);
        return builder;
    }

    /**
     * @return the canonical prefix of {@code namespace} or {@code null}.
     */
    @Nullable
    public String getPrefix(@NotNull String namespace) {
        return prefixes.get(namespace);
    }

    /**
     * @return the published schema location of {@code namespace} or
     * {@code null}.
     */
    @Nullable
    public String getSchemaLocation(@NotNull String namespace) {
        return schemaLocations.get(namespace);
    }

    /**
     * @return whether {@code namespace} is defined by one of the vocabularies.
     */
    public boolean isWellKnown(@NotNull String namespace) {
        return prefixes.containsKey(namespace);
    }

    /**
     * @return whether {@code namespace} is one of the core XML infrastructure
     * namespaces.
     */
    public boolean isXmlNamespace(@NotNull String namespace) {
        return xmlNamespaces.contains(namespace);
    }

    /**
     * @return namespace to prefix table
     */
    @NotNull
    public Map<String, String> getPrefixes() {
        return prefixes;
    }

    /**
     * @return namespace to schema location table
     */
    @NotNull
    public Map<String, String> getSchemaLocations() {
        return schemaLocations;
    }

    @NotNull
    public Set<String> getXmlNamespaces() {
        return xmlNamespaces;
    }

    /**
     * @return prefix to namespace map of the namespaces declared in every
     * document.
     */
    @NotNull
    public Map<String, String> getBaselineNamespaces() {
        return baseline;
    }

    public static final class Builder {

        private final Map<String, String> prefixes = new LinkedHashMap<>();

        private final Map<String, String> schemaLocations = new LinkedHashMap<>();

        private final Set<String> xmlNamespaces = new LinkedHashSet<>();

        private final Map<String, String> baseline = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds the namespaces of {@code vocabulary}. A schema location of a
         * later vocabulary replaces the one of an earlier vocabulary.
         *
         * @throws IllegalArgumentException if a namespace is already known
         *         under a different prefix.
         */
        @NotNull
        public Builder addVocabulary(@NotNull Vocabulary vocabulary) {
            for (Vocabulary.Entry entry : vocabulary.getEntries()) {
                String namespace = entry.getNamespace();
                String existing = prefixes.putIfAbsent(namespace, entry.getPrefix());
                checkArgument(existing == null || existing.equals(entry.getPrefix()),
                        "Vocabulary %s maps %s to prefix %s, already mapped to %s",
                        vocabulary.getName(), namespace, entry.getPrefix(), existing);
                if (entry.getSchemaLocation() != null) {
                    schemaLocations.put(namespace, entry.getSchemaLocation());
                }
            }
            return this;
        }

        /**
         * Adds the namespaces of {@code vocabulary} as core XML infrastructure
         * namespaces.
         */
        @NotNull
        public Builder addXmlVocabulary(@NotNull Vocabulary vocabulary) {
            addVocabulary(vocabulary);
            for (Vocabulary.Entry entry : vocabulary.getEntries()) {
                xmlNamespaces.add(entry.getNamespace());
            }
            return this;
        }

        /**
         * Declares {@code prefix} for {@code namespace} in every document.
         *
         * @throws IllegalArgumentException if {@code prefix} is already a
         *         baseline prefix of another namespace.
         */
        @NotNull
        public Builder addBaseline(@NotNull String prefix, @NotNull String namespace) {
            checkNotNull(namespace);
            String existing = baseline.putIfAbsent(checkNotNull(prefix), namespace);
            checkArgument(existing == null || existing.equals(namespace),
                    "Baseline prefix %s already mapped to %s", prefix, existing);
            return this;
        }

        @NotNull
        public NamespaceDefaults build() {
            return new NamespaceDefaults(this);
        }
    }
}
