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
package org.stixproject.xmlns;

import java.util.Collection;
import java.util.Map;

import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.TreeMultimap;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory checks of namespace declarations. Findings are logged and
 * returned, they never fail serialization.
 */
public final class NamespaceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(NamespaceValidator.class);

    private NamespaceValidator() {
    }

    /**
     * Finds prefixes used for more than one namespace in a namespace ->
     * prefix map. A document declaring such a map is invalid XML.
     *
     * @param namespacePrefixes namespace -> prefix
     * @return prefix -> namespaces, for every shared prefix only
     */
    @NotNull
    public static SetMultimap<String, String> findDuplicateAliases(@NotNull Map<String, String> namespacePrefixes) {
        SetMultimap<String, String> duplicates = duplicatesOf(namespacePrefixes);
        for (Map.Entry<String, Collection<String>> e : duplicates.asMap().entrySet()) {
            LOG.warn("Namespace alias '{}' mapped to {}", e.getKey(), e.getValue());
        }
        return duplicates;
    }

    /**
     * Finds namespaces declared under more than one prefix in a prefix ->
     * namespace map. The declarations are valid XML, so findings are only
     * logged at DEBUG.
     *
     * @param prefixNamespaces prefix -> namespace
     * @return namespace -> prefixes, for every namespace with several prefixes
     */
    @NotNull
    public static SetMultimap<String, String> checkAliases(@NotNull Map<String, String> prefixNamespaces) {
        SetMultimap<String, String> duplicates = duplicatesOf(prefixNamespaces);
        for (Map.Entry<String, Collection<String>> e : duplicates.asMap().entrySet()) {
            LOG.debug("Namespace '{}' declared under prefixes {}", e.getKey(), e.getValue());
        }
        return duplicates;
    }

    /**
     * Inverts {@code map} and keeps the values mapped from more than one key.
     */
    private static SetMultimap<String, String> duplicatesOf(Map<String, String> map) {
        TreeMultimap<String, String> inverse = Multimaps.invertFrom(
                Multimaps.forMap(map), TreeMultimap.<String, String>create());
        ImmutableSetMultimap.Builder<String, String> duplicates = ImmutableSetMultimap.builder();
        for (Map.Entry<String, Collection<String>> e : inverse.asMap().entrySet()) {
            if (e.getValue().size() > 1) {
                duplicates.putAll(e.getKey(), e.getValue());
            }
        }
        return duplicates.build();
    }
}
