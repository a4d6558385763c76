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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.base.Joiner;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stixproject.xmlns.api.Entity;
import org.stixproject.xmlns.api.EntityTypeProvider;
import org.stixproject.xmlns.api.IdNamespace;
import org.stixproject.xmlns.api.NamespaceResolutionException;
import org.stixproject.xmlns.defaults.NamespaceDefaults;
import org.stixproject.xmlns.id.IdNamespaces;
import org.stixproject.xmlns.walk.EntityWalker;

/**
 * Resolves the namespace declarations of the root element of a document:
 * walks the entity tree, collects every entity into a
 * {@link NamespaceRegistry}, finalizes it and renders the resulting
 * {@code xmlns:} declarations and {@code xsi:schemaLocation} attribute.
 *
 * <pre>
 * NamespaceResolver resolver = new NamespaceResolver(entityTypes);
 * NamespaceRegistry registry = resolver.resolve(stixPackage, null, null);
 * String declarations = NamespaceResolver.getNamespaceDefinitionString(
 *         registry.getFinalizedNamespaces(), registry.getFinalizedSchemaLocations());
 * </pre>
 */
public class NamespaceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(NamespaceResolver.class);

    private static final String SEPARATOR = "\n\t";

    private static final Joiner LINE_JOINER = Joiner.on(SEPARATOR);

    private static final Comparator<Map.Entry<String, String>> BY_NAMESPACE =
            Map.Entry.<String, String>comparingByValue().thenComparing(Map.Entry.<String, String>comparingByKey());

    private final NamespaceDefaults defaults;

    private final EntityTypeProvider entityTypes;

    private final IdNamespace idNamespace;

    /**
     * Resolver using the built-in vocabularies and the configured id
     * namespace.
     */
    public NamespaceResolver(@NotNull EntityTypeProvider entityTypes) {
        this(NamespaceDefaults.getDefault(), entityTypes, IdNamespaces.getDefault());
    }

    public NamespaceResolver(@NotNull NamespaceDefaults defaults,
                             @NotNull EntityTypeProvider entityTypes,
                             @NotNull IdNamespace idNamespace) {
        this.defaults = checkNotNull(defaults);
        this.entityTypes = checkNotNull(entityTypes);
        this.idNamespace = checkNotNull(idNamespace);
    }

    /**
     * @return a new, empty registry sharing the configuration of this resolver
     */
    @NotNull
    public NamespaceRegistry newRegistry() {
        return new NamespaceRegistry(defaults, entityTypes, idNamespace);
    }

    /**
     * Collects every entity of the tree rooted at {@code root}.
     *
     * @return the unfinalized registry
     */
    @NotNull
    public NamespaceRegistry collect(@NotNull Entity root) {
        NamespaceRegistry registry = newRegistry();
        int count = 0;
        for (Entity entity : EntityWalker.depthFirstPreOrder(root)) {
            registry.collect(entity);
            count++;
        }
        LOG.debug("Collected {} entities of {} types", count, registry.getVisitedTypes().size());
        return registry;
    }

    /**
     * Collects each of the independently built trees into its own registry and
     * merges these into one.
     *
     * @return the unfinalized, merged registry
     */
    @NotNull
    public NamespaceRegistry collectAll(@NotNull Iterable<? extends Entity> roots) {
        NamespaceRegistry merged = newRegistry();
        for (Entity root : roots) {
            merged.update(collect(root));
        }
        return merged;
    }

    /**
     * Collects and finalizes the namespaces of the tree rooted at {@code root}.
     *
     * @return the finalized registry
     * @throws NamespaceResolutionException if the namespaces can not be resolved
     */
    @NotNull
    public NamespaceRegistry resolve(@NotNull Entity root,
                                     @Nullable Map<String, String> prefixOverrides,
                                     @Nullable Map<String, String> schemaLocationOverrides)
            throws NamespaceResolutionException {
        NamespaceRegistry registry = collect(root);
        registry.finalizeMappings(prefixOverrides, schemaLocationOverrides);
        return registry;
    }

    /**
     * @return the prefix -> namespace declarations of the document rooted at
     * {@code root}
     * @throws NamespaceResolutionException if the namespaces can not be resolved
     */
    @NotNull
    public Map<String, String> getNamespaces(@NotNull Entity root,
                                             @Nullable Map<String, String> prefixOverrides)
            throws NamespaceResolutionException {
        return resolve(root, prefixOverrides, null).getFinalizedNamespaces();
    }

    /**
     * @return the namespace -> schema location pairs of the document rooted
     * at {@code root}
     * @throws NamespaceResolutionException if the namespaces can not be resolved
     */
    @NotNull
    public Map<String, String> getSchemaLocations(@NotNull Entity root,
                                                  @Nullable Map<String, String> prefixOverrides,
                                                  @Nullable Map<String, String> schemaLocationOverrides)
            throws NamespaceResolutionException {
        return resolve(root, prefixOverrides, schemaLocationOverrides).getFinalizedSchemaLocations();
    }

    /**
     * @return the rendered root element declarations of the document rooted
     * at {@code root}
     * @throws NamespaceResolutionException if the namespaces can not be resolved
     */
    @NotNull
    public String getNamespaceDefinitionString(@NotNull Entity root,
                                               @Nullable Map<String, String> prefixOverrides,
                                               @Nullable Map<String, String> schemaLocationOverrides)
            throws NamespaceResolutionException {
        NamespaceRegistry registry = resolve(root, prefixOverrides, schemaLocationOverrides);
        return getNamespaceDefinitionString(
                registry.getFinalizedNamespaces(), registry.getFinalizedSchemaLocations());
    }

    //----------------------------------------------------------< rendering >--

    /**
     * Renders {@code xmlns:prefix="namespace"} declarations sorted by
     * namespace, one per line.
     *
     * @param namespaces prefix -> namespace
     */
    @NotNull
    public static String getXmlnsString(@NotNull Map<String, String> namespaces) {
        List<String> declarations = namespaces.entrySet().stream()
                .sorted(BY_NAMESPACE)
                .map(e -> "xmlns:" + e.getKey() + "=\"" + e.getValue() + '"')
                .collect(Collectors.toList());
        return LINE_JOINER.join(declarations);
    }

    /**
     * Renders the {@code xsi:schemaLocation} attribute with one
     * {@code namespace location} pair per line, sorted by namespace.
     *
     * @param schemaLocations namespace -> schema location
     * @return the attribute, or an empty string if {@code schemaLocations} is
     * empty
     */
    @NotNull
    public static String getSchemaLocationString(@NotNull Map<String, String> schemaLocations) {
        if (schemaLocations.isEmpty()) {
            return "";
        }
        List<String> pairs = schemaLocations.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + ' ' + e.getValue())
                .collect(Collectors.toList());
        return "xsi:schemaLocation=\"" + SEPARATOR + LINE_JOINER.join(pairs) + '"';
    }

    /**
     * Renders the namespace declarations followed by the schema location
     * attribute, leaving out the attribute if there are no schema locations.
     *
     * @return the declarations, or an empty string if both maps are empty
     */
    @NotNull
    public static String getNamespaceDefinitionString(@NotNull Map<String, String> namespaces,
                                                      @NotNull Map<String, String> schemaLocations) {
        return LINE_JOINER.join(Stream.of(getXmlnsString(namespaces), getSchemaLocationString(schemaLocations))
                .filter(s -> !s.isEmpty())
                .iterator());
    }
}
