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

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable table of entity type metadata, populated once at startup.
 *
 * <pre>
 * EntityTypeProvider types = EntityTypes.builder()
 *         .add(EntityType.withQualifiedName("Indicator", "http://stix.mitre.org/Indicator-2",
 *                 "indicator:IndicatorType"))
 *         .add(EntityType.of("Observable", "http://cybox.mitre.org/cybox-2"))
 *         .build();
 * </pre>
 */
public final class EntityTypes implements EntityTypeProvider {

    private static final EntityTypes EMPTY = new EntityTypes(ImmutableMap.<String, EntityType>of());

    private final ImmutableMap<String, EntityType> types;

    private EntityTypes(ImmutableMap<String, EntityType> types) {
        this.types = types;
    }

    /**
     * @return a table without any registered type.
     */
    @NotNull
    public static EntityTypes empty() {
        return EMPTY;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    @Override
    public EntityType getEntityType(@NotNull String typeId) {
        return types.get(typeId);
    }

    /**
     * @return all registered types keyed by type id, in registration order.
     */
    @NotNull
    public Map<String, EntityType> getEntityTypes() {
        return types;
    }

    @Override
    public String toString() {
        return "EntityTypes" + types.keySet();
    }

    public static final class Builder {

        private final Map<String, EntityType> types = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers {@code type}.
         *
         * @throws IllegalArgumentException if a type with the same id is
         *         already registered.
         */
        @NotNull
        public Builder add(@NotNull EntityType type) {
            checkNotNull(type);
            EntityType existing = types.putIfAbsent(type.getTypeId(), type);
            checkArgument(existing == null, "Entity type %s already registered as %s", type.getTypeId(), existing);
            return this;
        }

        @NotNull
        public Builder addAll(@NotNull Iterable<EntityType> types) {
            for (EntityType type : types) {
                add(type);
            }
            return this;
        }

        @NotNull
        public EntityTypes build() {
            return new EntityTypes(ImmutableMap.copyOf(types));
        }
    }
}
