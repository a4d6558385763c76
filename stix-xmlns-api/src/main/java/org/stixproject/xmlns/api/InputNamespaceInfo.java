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
package org.stixproject.xmlns.api;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

/**
 * Namespace declarations and schema locations present in a parsed XML
 * document.
 */
public final class InputNamespaceInfo {

    public static final InputNamespaceInfo EMPTY =
            new InputNamespaceInfo(ImmutableMap.<String, String>of(), ImmutableMap.<String, String>of());

    /**
     * prefix -> namespace URI
     */
    private final ImmutableMap<String, String> namespaces;

    /**
     * namespace URI -> schema location
     */
    private final ImmutableMap<String, String> schemaLocations;

    private InputNamespaceInfo(ImmutableMap<String, String> namespaces,
                               ImmutableMap<String, String> schemaLocations) {
        this.namespaces = namespaces;
        this.schemaLocations = schemaLocations;
    }

    /**
     * @param namespaces prefix to namespace URI declarations
     * @param schemaLocations namespace URI to schema location pairs
     */
    @NotNull
    public static InputNamespaceInfo of(@NotNull Map<String, String> namespaces,
                                        @NotNull Map<String, String> schemaLocations) {
        checkNotNull(namespaces);
        checkNotNull(schemaLocations);
        if (namespaces.isEmpty() && schemaLocations.isEmpty()) {
            return EMPTY;
        }
        return new InputNamespaceInfo(ImmutableMap.copyOf(namespaces), ImmutableMap.copyOf(schemaLocations));
    }

    /**
     * @return prefix to namespace URI declarations
     */
    @NotNull
    public Map<String, String> getNamespaces() {
        return namespaces;
    }

    /**
     * @return namespace URI to schema location pairs
     */
    @NotNull
    public Map<String, String> getSchemaLocations() {
        return schemaLocations;
    }

    public boolean isEmpty() {
        return namespaces.isEmpty() && schemaLocations.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InputNamespaceInfo)) {
            return false;
        }
        InputNamespaceInfo that = (InputNamespaceInfo) other;
        return namespaces.equals(that.namespaces) && schemaLocations.equals(that.schemaLocations);
    }

    @Override
    public int hashCode() {
        return 31 * namespaces.hashCode() + schemaLocations.hashCode();
    }

    @Override
    public String toString() {
        return "InputNamespaceInfo{namespaces=" + namespaces + ", schemaLocations=" + schemaLocations + '}';
    }
}
