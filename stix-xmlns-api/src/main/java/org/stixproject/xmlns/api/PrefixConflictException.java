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

import static java.lang.String.format;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a namespace prefix would be bound to two different namespace
 * URIs in one document.
 */
public class PrefixConflictException extends NamespaceResolutionException {

    /**
     * Serial version UID
     */
    private static final long serialVersionUID = 6580393813307914722L;

    private final String prefix;

    private final String existingNamespace;

    private final String namespace;

    /**
     * @param prefix the contested prefix
     * @param existingNamespace the namespace {@code prefix} is already bound to
     * @param namespace the namespace that was about to be bound to {@code prefix}
     */
    public PrefixConflictException(@NotNull String prefix, @NotNull String existingNamespace,
                                   @NotNull String namespace) {
        super(format("Cannot map namespace prefix '%s' to '%s': prefix already mapped to '%s'.",
                prefix, namespace, existingNamespace));
        this.prefix = prefix;
        this.existingNamespace = existingNamespace;
        this.namespace = namespace;
    }

    @NotNull
    public String getPrefix() {
        return prefix;
    }

    @NotNull
    public String getExistingNamespace() {
        return existingNamespace;
    }

    @NotNull
    public String getNamespace() {
        return namespace;
    }

}
