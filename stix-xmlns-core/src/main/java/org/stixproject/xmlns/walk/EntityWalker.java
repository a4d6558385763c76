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
package org.stixproject.xmlns.walk;

import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;
import org.jetbrains.annotations.NotNull;
import org.stixproject.xmlns.api.Entity;

/**
 * Walks an entity tree. Every entity reachable from the root is returned
 * exactly once, also when a sub-tree is shared by several parents.
 */
public class EntityWalker {

    private static final SuccessorsFunction<Entity> CHILDREN = new EntityChildren();

    private EntityWalker() {
    }

    /**
     * @return {@code root} followed by all its descendants, parents before
     * children.
     */
    @NotNull
    public static Iterable<Entity> depthFirstPreOrder(@NotNull Entity root) {
        return Traverser.forGraph(CHILDREN).depthFirstPreOrder(root);
    }

    /**
     * Stream version of {@link #depthFirstPreOrder(Entity)}.
     */
    @NotNull
    public static Stream<Entity> walk(@NotNull Entity root) {
        return StreamSupport.stream(depthFirstPreOrder(root).spliterator(), false);
    }

    private static class EntityChildren implements SuccessorsFunction<Entity> {
        @Override
        public @NotNull Iterable<? extends Entity> successors(Entity entity) {
            return entity.getChildren();
        }
    }
}
