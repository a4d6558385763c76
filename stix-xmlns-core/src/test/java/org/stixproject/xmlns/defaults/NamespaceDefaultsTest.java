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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_STIX;
import static org.stixproject.xmlns.defaults.Vocabularies.NAMESPACE_XSI;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.stixproject.xmlns.NamespaceRegistry;
import org.stixproject.xmlns.TestEntity;
import org.stixproject.xmlns.api.Entity;
import org.stixproject.xmlns.api.EntityType;
import org.stixproject.xmlns.api.EntityTypes;
import org.stixproject.xmlns.id.IdNamespaces;

public class NamespaceDefaultsTest {

    private static final String MAEC_NS = "http://maec.mitre.org/XMLSchema/maec-core-2";

    private final NamespaceDefaults defaults = NamespaceDefaults.getDefault();

    @Test
    public void prefixes() {
        assertEquals("stix", defaults.getPrefix(NAMESPACE_STIX));
        assertEquals("indicator", defaults.getPrefix("http://stix.mitre.org/Indicator-2"));
        assertEquals("AddressObj", defaults.getPrefix("http://cybox.mitre.org/objects#AddressObject-2"));
        assertEquals("xsi", defaults.getPrefix(NAMESPACE_XSI));
        assertNull(defaults.getPrefix("urn:unknown"));
    }

    @Test
    public void schemaLocations() {
        assertEquals("http://stix.mitre.org/XMLSchema/core/1.1.1/stix_core.xsd",
                defaults.getSchemaLocation(NAMESPACE_STIX));
        assertNull(defaults.getSchemaLocation(NAMESPACE_XSI));
        assertNull(defaults.getSchemaLocation("urn:unknown"));
    }

    @Test
    public void xmlNamespaces() {
        assertTrue(defaults.isXmlNamespace(NAMESPACE_XSI));
        assertTrue(defaults.isWellKnown(NAMESPACE_XSI));
        assertFalse(defaults.isXmlNamespace(NAMESPACE_STIX));
        for (String namespace : defaults.getXmlNamespaces()) {
            assertFalse(defaults.getSchemaLocations().containsKey(namespace));
        }
    }

    @Test
    public void baselineIsWellKnown() {
        Map<String, String> baseline = defaults.getBaselineNamespaces();
        assertEquals(7, baseline.size());
        assertEquals(NAMESPACE_XSI, baseline.get("xsi"));
        for (Map.Entry<String, String> e : baseline.entrySet()) {
            assertEquals(e.getKey(), defaults.getPrefix(e.getValue()));
        }
    }

    @Test
    public void schemaLocationsOnlyForWellKnownNamespaces() {
        for (String namespace : defaults.getSchemaLocations().keySet()) {
            assertTrue(namespace, defaults.isWellKnown(namespace));
        }
    }

    @Test
    public void addVocabulary() {
        Vocabulary maec = Vocabulary.builder("MAEC")
                .add(MAEC_NS, "maecCore", "http://maec.mitre.org/language/version4.1/maec_core_schema.xsd")
                .build();
        NamespaceDefaults extended = NamespaceDefaults.builderWithDefaults()
                .addVocabulary(maec)
                .build();

        assertTrue(extended.isWellKnown(MAEC_NS));
        assertNotNull(extended.getSchemaLocation(MAEC_NS));
        assertEquals(defaults.getBaselineNamespaces(), extended.getBaselineNamespaces());
        assertFalse(defaults.isWellKnown(MAEC_NS));
    }

    @Test
    public void laterSchemaLocationWins() {
        NamespaceDefaults tables = NamespaceDefaults.builder()
                .addVocabulary(Vocabulary.builder("a").add("urn:a", "a", "first.xsd").build())
                .addVocabulary(Vocabulary.builder("b").add("urn:a", "a", "second.xsd").build())
                .build();

        assertEquals("second.xsd", tables.getSchemaLocation("urn:a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflictingPrefix() {
        NamespaceDefaults.builderWithDefaults()
                .addVocabulary(Vocabulary.builder("broken").add(NAMESPACE_STIX, "stix2").build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflictingBaseline() {
        NamespaceDefaults.builderWithDefaults().addBaseline("stix", "urn:other");
    }

    @Test(expected = IllegalArgumentException.class)
    public void qualifiedPrefix() {
        Vocabulary.builder("broken").add("urn:a", "a:b");
    }

    @Test
    public void everyCyboxObjectNamespaceResolves() throws Exception {
        EntityTypes.Builder types = EntityTypes.builder();
        List<Entity> entities = new ArrayList<>();
        for (Vocabulary.Entry entry : Vocabularies.CYBOX.getEntries()) {
            String typeId = "type:" + entry.getNamespace();
            types.add(EntityType.of(typeId, entry.getNamespace()));
            entities.add(new TestEntity(typeId));
        }
        NamespaceRegistry registry = new NamespaceRegistry(
                defaults, types.build(), IdNamespaces.of("http://example.com", "example"));
        for (Entity entity : entities) {
            registry.collect(entity);
        }
        registry.finalizeMappings();

        Map<String, String> namespaces = registry.getFinalizedNamespaces();
        for (Vocabulary.Entry entry : Vocabularies.CYBOX.getEntries()) {
            assertEquals(entry.getNamespace(), namespaces.get(entry.getPrefix()));
            assertNotNull(entry.getNamespace(), registry.getFinalizedSchemaLocations().get(entry.getNamespace()));
        }
        assertTrue(registry.getUnresolvedSchemaLocations().isEmpty());
        assertEquals("WinFileObj", defaults.getPrefix("http://cybox.mitre.org/objects#WinFileObject-2"));
        assertEquals("PacketObj", defaults.getPrefix("http://cybox.mitre.org/objects#NetworkPacketObject-2"));
        assertTrue(defaults.isWellKnown("http://cybox.mitre.org/objects#WhoisObject-2"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void immutableTables() {
        defaults.getPrefixes().put("urn:a", "a");
    }
}
