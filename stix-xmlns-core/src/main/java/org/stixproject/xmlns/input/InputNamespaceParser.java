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
package org.stixproject.xmlns.input;

import java.io.InputStream;
import java.io.Reader;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stixproject.xmlns.api.InputNamespaceInfo;
import org.stixproject.xmlns.defaults.Vocabularies;

/**
 * Reads the namespace declarations and the {@code xsi:schemaLocation}
 * attribute of the root element of an XML document. Only the start of the
 * document is read.
 */
public class InputNamespaceParser {

    private static final Logger LOG = LoggerFactory.getLogger(InputNamespaceParser.class);

    private static final Splitter WHITESPACE_SPLITTER =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final XMLInputFactory factory;

    public InputNamespaceParser() {
        factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    }

    /**
     * @throws XMLStreamException if the document is not well-formed up to the
     *         end of its root start tag
     */
    @NotNull
    public InputNamespaceInfo parse(@NotNull InputStream in) throws XMLStreamException {
        XMLStreamReader reader = factory.createXMLStreamReader(in);
        try {
            return parse(reader);
        } finally {
            reader.close();
        }
    }

    /**
     * @throws XMLStreamException if the document is not well-formed up to the
     *         end of its root start tag
     */
    @NotNull
    public InputNamespaceInfo parse(@NotNull Reader in) throws XMLStreamException {
        XMLStreamReader reader = factory.createXMLStreamReader(in);
        try {
            return parse(reader);
        } finally {
            reader.close();
        }
    }

    private static InputNamespaceInfo parse(XMLStreamReader reader) throws XMLStreamException {
        while (reader.hasNext()) {
            if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                return readRootElement(reader);
            }
        }
        throw new XMLStreamException("Document has no root element");
    }

    private static InputNamespaceInfo readRootElement(XMLStreamReader reader) {
        Map<String, String> namespaces = new LinkedHashMap<>();
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            String prefix = reader.getNamespacePrefix(i);
            String uri = reader.getNamespaceURI(i);
            if (prefix == null || prefix.isEmpty()) {
                LOG.debug("Skipping default namespace declaration {}", uri);
            } else {
                namespaces.put(prefix, uri);
            }
        }

        String schemaLocation = reader.getAttributeValue(Vocabularies.NAMESPACE_XSI, "schemaLocation");
        Map<String, String> schemaLocations = schemaLocation == null
                ? new LinkedHashMap<String, String>()
                : parseSchemaLocation(schemaLocation);
        LOG.debug("Root element {} declares {} namespaces and {} schema locations",
                reader.getName(), namespaces.size(), schemaLocations.size());
        return InputNamespaceInfo.of(namespaces, schemaLocations);
    }

    /**
     * Splits the value of an {@code xsi:schemaLocation} attribute into
     * namespace -> location pairs. A trailing namespace without location is
     * ignored.
     */
    @NotNull
    public static Map<String, String> parseSchemaLocation(@NotNull String value) {
        Map<String, String> pairs = new LinkedHashMap<>();
        Iterator<String> tokens = WHITESPACE_SPLITTER.split(value).iterator();
        while (tokens.hasNext()) {
            String namespace = tokens.next();
            if (!tokens.hasNext()) {
                LOG.warn("Ignoring namespace {} without schema location", namespace);
                break;
            }
            pairs.put(namespace, tokens.next());
        }
        return pairs;
    }
}
