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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Static namespace metadata of an entity type.
 * <p>
 * A type may declare its home namespace, an explicit prefix for that
 * namespace and a qualified name of the form {@code prefix:LocalName} (the
 * {@code xsi:type} of the type) from which a prefix can be derived. All three
 * are optional.
 */
public final class EntityType {

    private final String typeId;

    private final String namespace;

    private final String prefix;

    private final String qualifiedName;

    private EntityType(String typeId, String namespace, String prefix, String qualifiedName) {
        checkArgument(!typeId.isEmpty(), "Type id must not be empty");
        this.typeId = typeId;
        this.namespace = namespace;
        this.prefix = prefix;
        this.qualifiedName = qualifiedName;
    }

    /**
     * A type that does not declare a home namespace. It contributes nothing
     * to namespace collection.
     */
    @NotNull
    public static EntityType withoutNamespace(@NotNull String typeId) {
        return new EntityType(checkNotNull(typeId), null, null, null);
    }

    /**
     * A type with a home namespace but neither prefix nor qualified name. Its
     * prefix is looked up in the default prefix table.
     */
    @NotNull
    public static EntityType of(@NotNull String typeId, @NotNull String namespace) {
        return new EntityType(checkNotNull(typeId), checkNotNull(namespace), null, null);
    }

    /**
     * A type with a home namespace and an explicit prefix for it.
     */
    @NotNull
    public static EntityType withPrefix(@NotNull String typeId, @NotNull String namespace,
                                        @NotNull String prefix) {
        return new EntityType(checkNotNull(typeId), checkNotNull(namespace), checkNotNull(prefix), null);
    }

    /**
     * A type with a home namespace and a {@code prefix:LocalName} qualified
     * type name.
     */
    @NotNull
    public static EntityType withQualifiedName(@NotNull String typeId, @NotNull String namespace,
                                               @NotNull String qualifiedName) {
        return new EntityType(checkNotNull(typeId), checkNotNull(namespace), null, checkNotNull(qualifiedName));
    }

    /**
     * A type declaring every piece of metadata, any of which may be absent.
     */
    @NotNull
    public static EntityType create(@NotNull String typeId, @Nullable String namespace,
                                    @Nullable String prefix, @Nullable String qualifiedName) {
        return new EntityType(checkNotNull(typeId), namespace, prefix, qualifiedName);
    }

    @NotNull
    public String getTypeId() {
        return typeId;
    }

    @Nullable
    public String getNamespace() {
        return namespace;
    }

    @Nullable
    public String getPrefix() {
        return prefix;
    }

    @Nullable
    public String getQualifiedName() {
        return qualifiedName;
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EntityType)) {
            return false;
        }
        EntityType that = (EntityType) other;
        return typeId.equals(that.typeId)
                && Objects.equals(namespace, that.namespace)
                && Objects.equals(prefix, that.prefix)
                && Objects.equals(qualifiedName, that.qualifiedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeId, namespace, prefix, qualifiedName);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("typeId", typeId)
                .add("namespace", namespace)
                .add("prefix", prefix)
                .add("qualifiedName", qualifiedName)
                .toString();
    }
}
