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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.stixproject.xmlns.NamespaceRegistryTest.CUSTOM_NS;
import static org.stixproject.xmlns.NamespaceRegistryTest.INDICATOR_NS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import org.junit.Test;
import org.stixproject.xmlns.api.PrefixConflictException;
import org.stixproject.xmlns.id.IdNamespaces;

/**
 * Merging registries collected from independent sub-trees.
 */
public class NamespaceRegistryMergeTest {

    private static final String[] PREFIXES = {"a", "b", "c", "d"};

    private static final String[] NAMESPACES = {"urn:ns:1", "urn:ns:2", "urn:ns:3", "urn:ns:4"};

    private static NamespaceRegistry newRegistry() {
        NamespaceRegistry registry = NamespaceRegistryTest.newRegistry(
                IdNamespaces.of("http://example.com", "example"));
        registry.setValidateAliases(false);
        return registry;
    }

    private static NamespaceRegistry collect(List<Map<String, String>> documents) {
        NamespaceRegistry registry = newRegistry();
        for (Map<String, String> namespaces : documents) {
            registry.collect(new TestEntity("Hash").parsedWith(namespaces, Collections.<String, String>emptyMap()));
        }
        return registry;
    }

    @Test
    public void mergeEqualsSingleCollection() throws Exception {
        TestEntity indicator = new TestEntity("Indicator");
        TestEntity custom = new TestEntity("Custom").parsedWith(
                ImmutableMap.of("acme", "urn:acme"), ImmutableMap.of(CUSTOM_NS, "custom.xsd"));

        NamespaceRegistry left = newRegistry();
        left.collect(indicator);
        NamespaceRegistry right = newRegistry();
        right.collect(custom);
        left.update(right);
        left.finalizeMappings();

        NamespaceRegistry single = newRegistry();
        single.collect(indicator);
        single.collect(custom);
        single.finalizeMappings();

        assertEquals(single.getFinalizedNamespaces(), left.getFinalizedNamespaces());
        assertEquals(single.getFinalizedSchemaLocations(), left.getFinalizedSchemaLocations());
        assertEquals(single.getVisitedTypes(), left.getVisitedTypes());
    }

    @Test
    public void mergeIsCommutative() throws Exception {
        List<Map<String, String>> first = Collections.singletonList(
                ImmutableMap.of("a", "urn:ns:1", "b", "urn:ns:2"));
        List<Map<String, String>> second = Collections.singletonList(
                ImmutableMap.of("c", "urn:ns:3"));

        NamespaceRegistry ab = collect(first);
        ab.update(collect(second));
        ab.finalizeMappings();

        NamespaceRegistry ba = collect(second);
        ba.update(collect(first));
        ba.finalizeMappings();

        assertEquals(ab.getFinalizedNamespaces(), ba.getFinalizedNamespaces());
        assertEquals(ab.getFinalizedSchemaLocations(), ba.getFinalizedSchemaLocations());
    }

    @Test
    public void mergeMatchesSeparateFinalization() throws Exception {
        NamespaceRegistry left = newRegistry();
        left.collect(new TestEntity("Indicator"));
        NamespaceRegistry right = newRegistry();
        right.collect(new TestEntity("Address"));

        NamespaceRegistry leftCopy = newRegistry();
        leftCopy.update(left);
        leftCopy.finalizeMappings();
        NamespaceRegistry rightCopy = newRegistry();
        rightCopy.update(right);
        rightCopy.finalizeMappings();

        left.update(right);
        left.finalizeMappings();

        Map<String, String> union = new HashMap<>(leftCopy.getFinalizedNamespaces());
        union.putAll(rightCopy.getFinalizedNamespaces());
        assertEquals(union, left.getFinalizedNamespaces());
        assertEquals(INDICATOR_NS, left.getFinalizedNamespaces().get("indicator"));
    }

    @Test
    public void conflictingSubTrees() throws Exception {
        NamespaceRegistry left = collect(Collections.singletonList(ImmutableMap.of("a", "urn:ns:1")));
        left.update(collect(Collections.singletonList(ImmutableMap.of("a", "urn:ns:2"))));
        try {
            left.finalizeMappings();
            fail("Expected PrefixConflictException");
        } catch (PrefixConflictException e) {
            assertEquals("a", e.getPrefix());
        }
    }

    @Test
    public void mergeUnionsInputDeclarations() {
        NamespaceRegistry left = newRegistry();
        left.collect(new TestEntity("Hash").parsedWith(
                ImmutableMap.of("a", "urn:ns:1"), ImmutableMap.of("urn:ns:1", "left.xsd")));
        NamespaceRegistry right = newRegistry();
        right.collect(new TestEntity("Indicator").parsedWith(
                ImmutableMap.of("a", "urn:ns:2", "b", "urn:ns:2"),
                ImmutableMap.of("urn:ns:1", "right.xsd", "urn:ns:2", "two.xsd")));

        left.update(right);

        assertEquals(ImmutableSet.of("Hash", "Indicator"), left.getVisitedTypes());
        assertEquals(ImmutableSet.of("urn:ns:1", "urn:ns:2"), left.getInputNamespaces().get("a"));
        assertEquals(ImmutableSet.of("urn:ns:2"), left.getInputNamespaces().get("b"));
        assertEquals(ImmutableMap.of("urn:ns:1", "right.xsd", "urn:ns:2", "two.xsd"),
                left.getInputSchemaLocations());
        assertEquals(2, right.getInputNamespaces().size());
    }

    @Test(expected = IllegalStateException.class)
    public void mergeFinalizedRegistry() throws Exception {
        NamespaceRegistry other = newRegistry();
        other.finalizeMappings();
        newRegistry().update(other);
    }

    @Test(expected = IllegalStateException.class)
    public void mergeIntoFinalizedRegistry() throws Exception {
        NamespaceRegistry registry = newRegistry();
        registry.finalizeMappings();
        registry.update(newRegistry());
    }

    /**
     * Random input declarations spread over several registries either
     * finalize to a mapping that keeps every declaration, or fail with a
     * conflict exactly when some prefix was declared for two namespaces.
     */
    @Test
    public void randomMerges() throws Exception {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            SetMultimap<String, String> declared = LinkedHashMultimap.create();
            List<NamespaceRegistry> registries = new ArrayList<>();
            int registryCount = 2 + random.nextInt(3);
            for (int i = 0; i < registryCount; i++) {
                List<Map<String, String>> documents = new ArrayList<>();
                int documentCount = 1 + random.nextInt(2);
                for (int j = 0; j < documentCount; j++) {
                    Map<String, String> namespaces = new HashMap<>();
                    int bindings = 1 + random.nextInt(2);
                    for (int k = 0; k < bindings; k++) {
                        namespaces.put(PREFIXES[random.nextInt(PREFIXES.length)],
                                NAMESPACES[random.nextInt(NAMESPACES.length)]);
                    }
                    declared.putAll(Multimaps.forMap(namespaces));
                    documents.add(namespaces);
                }
                registries.add(collect(documents));
            }

            NamespaceRegistry merged = newRegistry();
            for (NamespaceRegistry registry : registries) {
                merged.update(registry);
            }

            boolean conflicting = false;
            for (String prefix : declared.keySet()) {
                conflicting |= declared.get(prefix).size() > 1;
            }

            try {
                merged.finalizeMappings();
                assertFalse("Run " + run + " should have failed: " + declared, conflicting);
                Map<String, String> namespaces = merged.getFinalizedNamespaces();
                for (Map.Entry<String, String> e : declared.entries()) {
                    assertEquals(e.getValue(), namespaces.get(e.getKey()));
                }
                assertEquals("http://example.com", namespaces.get("example"));
            } catch (PrefixConflictException e) {
                assertTrue("Run " + run + " failed unexpectedly: " + declared, conflicting);
                assertTrue(declared.get(e.getPrefix()).contains(e.getNamespace()));
                assertTrue(declared.get(e.getPrefix()).contains(e.getExistingNamespace()));
            }
        }
    }
}
