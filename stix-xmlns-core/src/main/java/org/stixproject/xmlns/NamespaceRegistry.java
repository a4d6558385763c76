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
import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stixproject.xmlns.api.Entity;
import org.stixproject.xmlns.api.EntityType;
import org.stixproject.xmlns.api.EntityTypeProvider;
import org.stixproject.xmlns.api.IdNamespace;
import org.stixproject.xmlns.api.InputNamespaceInfo;
import org.stixproject.xmlns.api.NamespaceResolutionException;
import org.stixproject.xmlns.api.PrefixConflictException;
import org.stixproject.xmlns.defaults.NamespaceDefaults;
import org.stixproject.xmlns.util.SystemPropertySupplier;

/**
 * Collects the namespaces used by the entities of one document and computes
 * the prefix and schema location declarations of that document.
 * <p>
 * A registry is populated by calling {@link #collect(Entity)} for every
 * entity of the document and then finalized exactly once with
 * {@link #finalizeMappings(Map, Map)}. Namespace bindings are merged in the
 * following order, a prefix bound to two different namespaces at any step
 * failing the finalization with a {@link PrefixConflictException}:
 * <ol>
 *     <li>the baseline prefixes and the id namespace,</li>
 *     <li>the prefixes declared by parsed input documents for namespaces
 *     not defined by the vocabularies,</li>
 *     <li>the default prefixes of namespaces whose types declare no prefix,</li>
 *     <li>the prefixes declared by the types (explicitly or through their
 *     qualified type name),</li>
 *     <li>the caller supplied prefixes.</li>
 * </ol>
 * <p>
 * Instances are not thread-safe. Sub-trees collected in parallel must use
 * one registry each, merged with {@link #update(NamespaceRegistry)} before
 * finalization.
 */
public class NamespaceRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(NamespaceRegistry.class);

    /**
     * Name of the system property enabling the duplicate alias check run
     * after finalization. Enabled by default.
     */
    public static final String PROP_VALIDATE_ALIASES = "stix.xmlns.validateAliases";

    private static final boolean VALIDATE_ALIASES = SystemPropertySupplier
            .create(PROP_VALIDATE_ALIASES, Boolean.TRUE).loggingTo(LOG).get();

    private static final Splitter QNAME_SPLITTER = Splitter.on(':');

    private final NamespaceDefaults defaults;

    private final EntityTypeProvider entityTypes;

    private final IdNamespace idNamespace;

    /**
     * Type ids of the collected entities. Sorted, so that conflicts are
     * reported independently of the traversal order.
     */
    private final Set<String> visitedTypes = new TreeSet<>();

    /**
     * prefix -> namespace declarations of parsed input documents
     */
    private final SetMultimap<String, String> inputNamespaces = LinkedHashMultimap.create();

    /**
     * namespace -> schema location pairs of parsed input documents
     */
    private final Map<String, String> inputSchemaLocations = new LinkedHashMap<>();

    private boolean validateAliases = VALIDATE_ALIASES;

    private boolean finalized;

    private ImmutableMap<String, String> finalizedNamespaces;

    private ImmutableMap<String, String> finalizedSchemaLocations;

    private ImmutableSet<String> unresolvedSchemaLocations;

    public NamespaceRegistry(@NotNull NamespaceDefaults defaults,
                             @NotNull EntityTypeProvider entityTypes,
                             @NotNull IdNamespace idNamespace) {
        this.defaults = checkNotNull(defaults);
        this.entityTypes = checkNotNull(entityTypes);
        this.idNamespace = checkNotNull(idNamespace);
    }

    /**
     * Enables or disables the duplicate alias check run after finalization.
     * The default is taken from the {@value #PROP_VALIDATE_ALIASES} system
     * property.
     */
    public void setValidateAliases(boolean validateAliases) {
        this.validateAliases = validateAliases;
    }

    //------------------------------------------------------------< collect >--

    /**
     * Records the type of {@code entity} and, if it was parsed from an XML
     * document, the namespace declarations and schema locations of that
     * document.
     *
     * @throws IllegalStateException if this registry is already finalized or
     *         its finalization failed
     */
    public void collect(@NotNull Entity entity) {
        checkState(!finalized, "Namespace registry already finalized or finalization failed");
        String typeId = entity.getTypeId();
        if (visitedTypes.add(typeId)) {
            LOG.trace("Collected entity type {}", typeId);
        }

        InputNamespaceInfo input = entity.getInputNamespaceInfo();
        if (input != null) {
            for (Map.Entry<String, String> e : input.getNamespaces().entrySet()) {
                inputNamespaces.put(e.getKey(), e.getValue());
            }
            addInputSchemaLocations(input.getSchemaLocations());
        }
    }

    /**
     * Merges the state collected by {@code other} into this registry.
     *
     * @throws IllegalStateException if either registry is already finalized
     *         or its finalization failed
     */
    public void update(@NotNull NamespaceRegistry other) {
        checkState(!finalized, "Namespace registry already finalized or finalization failed");
        checkState(!other.finalized, "Cannot merge a registry that was already finalized or failed finalization");
        visitedTypes.addAll(other.visitedTypes);
        inputNamespaces.putAll(other.inputNamespaces);
        addInputSchemaLocations(other.inputSchemaLocations);
    }

    private void addInputSchemaLocations(Map<String, String> schemaLocations) {
        for (Map.Entry<String, String> e : schemaLocations.entrySet()) {
            String previous = inputSchemaLocations.put(e.getKey(), e.getValue());
            if (previous != null && !previous.equals(e.getValue())) {
                LOG.debug("Input schema location of {} changed from {} to {}",
                        e.getKey(), previous, e.getValue());
            }
        }
    }

    //-----------------------------------------------------------< finalize >--

    /**
     * Same as {@code finalizeMappings(null, null)}.
     */
    public void finalizeMappings() throws NamespaceResolutionException {
        finalizeMappings(null, null);
    }

    /**
     * Computes the prefix and schema location declarations of the document.
     * A registry can be finalized only once, also if finalization failed.
     *
     * @param prefixOverrides caller supplied prefix -> namespace bindings, or
     *        {@code null}
     * @param schemaLocationOverrides caller supplied namespace -> schema
     *        location pairs, or {@code null}. Default schema locations of the
     *        vocabularies take precedence.
     * @throws PrefixConflictException if a prefix would be bound to two
     *         different namespaces
     * @throws NamespaceResolutionException if a collected namespace has no
     *         prefix
     * @throws IllegalStateException if this registry is already finalized
     */
    public void finalizeMappings(@Nullable Map<String, String> prefixOverrides,
                                 @Nullable Map<String, String> schemaLocationOverrides)
            throws NamespaceResolutionException {
        checkState(!finalized, "Namespace registry already finalized or finalization failed");
        finalized = true;

        CollectedNamespaces collected = deriveAliases();
        Map<String, String> namespaces = finalizeNamespaces(collected, prefixOverrides);
        Set<String> unresolved = new LinkedHashSet<>();
        Map<String, String> schemaLocations = finalizeSchemaLocations(
                namespaces, schemaLocationOverrides, unresolved);

        finalizedNamespaces = ImmutableMap.copyOf(namespaces);
        finalizedSchemaLocations = ImmutableMap.copyOf(schemaLocations);
        unresolvedSchemaLocations = ImmutableSet.copyOf(unresolved);
        LOG.debug("Finalized {} namespaces and {} schema locations",
                finalizedNamespaces.size(), finalizedSchemaLocations.size());

        if (validateAliases) {
            NamespaceValidator.checkAliases(finalizedNamespaces);
        }
    }

    public boolean isFinalized() {
        return finalizedNamespaces != null;
    }

    /**
     * @return prefix -> namespace declarations of the document
     * @throws IllegalStateException if this registry is not finalized
     */
    @NotNull
    public Map<String, String> getFinalizedNamespaces() {
        checkState(isFinalized(), "Namespace registry not finalized");
        return finalizedNamespaces;
    }

    /**
     * @return namespace -> schema location pairs of the document
     * @throws IllegalStateException if this registry is not finalized
     */
    @NotNull
    public Map<String, String> getFinalizedSchemaLocations() {
        checkState(isFinalized(), "Namespace registry not finalized");
        return finalizedSchemaLocations;
    }

    /**
     * @return the declared namespaces for which no schema location was found
     * @throws IllegalStateException if this registry is not finalized
     */
    @NotNull
    public Set<String> getUnresolvedSchemaLocations() {
        checkState(isFinalized(), "Namespace registry not finalized");
        return unresolvedSchemaLocations;
    }

    /**
     * @return the type ids collected so far
     */
    @NotNull
    public Set<String> getVisitedTypes() {
        return Collections.unmodifiableSet(visitedTypes);
    }

    /**
     * @return the prefix -> namespace declarations of the parsed input
     * documents collected so far
     */
    @NotNull
    public SetMultimap<String, String> getInputNamespaces() {
        return Multimaps.unmodifiableSetMultimap(inputNamespaces);
    }

    /**
     * @return the namespace -> schema location pairs of the parsed input
     * documents collected so far
     */
    @NotNull
    public Map<String, String> getInputSchemaLocations() {
        return Collections.unmodifiableMap(inputSchemaLocations);
    }

    //-----------------------------------------------------------< internal >--

    private CollectedNamespaces deriveAliases() {
        CollectedNamespaces collected = new CollectedNamespaces();
        for (String typeId : visitedTypes) {
            EntityType type = entityTypes.getEntityType(typeId);
            if (type == null) {
                LOG.debug("No namespace metadata for entity type {}", typeId);
                continue;
            }
            String namespace = type.getNamespace();
            if (namespace == null) {
                continue;
            }
            String alias = getAlias(type);
            if (alias != null) {
                collected.aliased.put(alias, namespace);
            } else {
                collected.unaliased.add(namespace);
            }
        }
        return collected;
    }

    /**
     * The prefix a type declares for its namespace: the explicit prefix if
     * any, otherwise the prefix part of its qualified type name.
     */
    @Nullable
    static String getAlias(@NotNull EntityType type) {
        String prefix = type.getPrefix();
        if (prefix != null && !prefix.isEmpty()) {
            return prefix;
        }
        String qualifiedName = type.getQualifiedName();
        if (qualifiedName == null) {
            return null;
        }
        List<String> parts = QNAME_SPLITTER.splitToList(qualifiedName);
        if (parts.size() == 2 && !parts.get(0).isEmpty()) {
            return parts.get(0);
        }
        return null;
    }

    private Map<String, String> finalizeNamespaces(CollectedNamespaces collected,
                                                   Map<String, String> prefixOverrides)
            throws NamespaceResolutionException {
        Map<String, String> working = new LinkedHashMap<>(defaults.getBaselineNamespaces());
        checkAndInsert(working, idNamespace.getPrefix(), idNamespace.getNamespace());

        SetMultimap<String, String> input = LinkedHashMultimap.create(inputNamespaces);
        fixIdNamespace(working, input);

        for (Map.Entry<String, String> e : input.entries()) {
            if (!defaults.isWellKnown(e.getValue())) {
                checkAndInsert(working, e.getKey(), e.getValue());
            }
        }

        for (String namespace : collected.unaliased) {
            String prefix = defaults.getPrefix(namespace);
            if (prefix == null) {
                throw new NamespaceResolutionException("No prefix known for namespace " + namespace);
            }
            checkAndInsert(working, prefix, namespace);
        }

        for (Map.Entry<String, String> e : collected.aliased.entries()) {
            checkAndInsert(working, e.getKey(), e.getValue());
        }

        Map<String, String> result = new LinkedHashMap<>();
        if (prefixOverrides != null) {
            result.putAll(prefixOverrides);
        }
        for (Map.Entry<String, String> e : working.entrySet()) {
            checkAndInsert(result, e.getKey(), e.getValue());
        }
        return result;
    }

    /**
     * Documents often declare the id namespace with a trailing slash under
     * the prefix that is bound to the id namespace without trailing slash.
     * Such declarations are dropped from {@code input}.
     */
    private void fixIdNamespace(Map<String, String> working, SetMultimap<String, String> input) {
        String namespace = idNamespace.getNamespace();
        String prefix = idNamespace.getPrefix();
        if (namespace.endsWith("/") || !namespace.equals(working.get(prefix))) {
            return;
        }
        String slashed = namespace + '/';
        if (input.remove(prefix, slashed)) {
            LOG.debug("Ignoring input namespace {} declared as '{}', id namespace is {}",
                    slashed, prefix, namespace);
        }
    }

    private Map<String, String> finalizeSchemaLocations(Map<String, String> namespaces,
                                                        Map<String, String> schemaLocationOverrides,
                                                        Set<String> unresolved) {
        Map<String, String> result = new LinkedHashMap<>();
        if (schemaLocationOverrides != null) {
            result.putAll(schemaLocationOverrides);
        }
        for (Map.Entry<String, String> e : inputSchemaLocations.entrySet()) {
            result.putIfAbsent(e.getKey(), e.getValue());
        }

        for (String namespace : new LinkedHashSet<>(namespaces.values())) {
            String location = defaults.getSchemaLocation(namespace);
            if (location != null) {
                result.put(namespace, location);
            } else if (!result.containsKey(namespace) && !isWithoutSchema(namespace)) {
                LOG.warn("Unable to map namespace '{}' to schemaLocation", namespace);
                unresolved.add(namespace);
            }
        }
        return result;
    }

    // no schema location is expected for these
    private boolean isWithoutSchema(String namespace) {
        return namespace.equals(idNamespace.getNamespace()) || defaults.isXmlNamespace(namespace);
    }

    /**
     * Binds {@code prefix} to {@code namespace} in {@code namespaces} unless
     * it is already bound.
     *
     * @throws PrefixConflictException if {@code prefix} is bound to another
     *         namespace
     */
    static void checkAndInsert(Map<String, String> namespaces, String prefix, String namespace)
            throws PrefixConflictException {
        String current = namespaces.get(prefix);
        if (current == null) {
            namespaces.put(prefix, namespace);
        } else if (!current.equals(namespace)) {
            throw new PrefixConflictException(prefix, current, namespace);
        }
    }

    /**
     * Namespaces derived from the visited types.
     */
    private static final class CollectedNamespaces {

        /**
         * prefix -> namespace
         */
        final SetMultimap<String, String> aliased = LinkedHashMultimap.create();

        /**
         * namespaces of types declaring no prefix
         */
        final Set<String> unaliased = new LinkedHashSet<>();

    }
}
