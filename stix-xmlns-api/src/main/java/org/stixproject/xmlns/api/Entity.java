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

import java.util.Collections;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A node of a STIX/CybOX document tree as seen by namespace resolution.
 * <p>
 * Namespace information attached to the <em>type</em> of an entity is looked
 * up through an {@link EntityTypeProvider} using {@link #getTypeId()}.
 * Information attached to the <em>instance</em> is only present when the
 * entity was produced by parsing an existing XML document, see
 * {@link #getInputNamespaceInfo()}.
 */
public interface Entity {

    /**
     * @return the type tag of this entity, used as key into the entity type
     * metadata table.
     */
    @NotNull
    String getTypeId();

    /**
     * The direct children of this entity. The default implementation returns
     * an empty iterable.
     *
     * @return child entities, never {@code null}
     */
    @NotNull
    default Iterable<? extends Entity> getChildren() {
        return Collections.emptyList();
    }

    /**
     * The prefix and schema location declarations found in the XML document
     * this entity was parsed from.
     *
     * @return the input declarations or {@code null} if this entity was not
     * parsed from XML.
     */
    @Nullable
    default InputNamespaceInfo getInputNamespaceInfo() {
        return null;
    }

}
