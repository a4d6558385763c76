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

import static org.junit.Assert.assertEquals;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Test;
import org.stixproject.xmlns.TestEntity;
import org.stixproject.xmlns.api.Entity;

public class EntityWalkerTest {

    private static List<String> typeIds(Iterable<Entity> entities) {
        return Lists.newArrayList(entities).stream().map(Entity::getTypeId).collect(Collectors.toList());
    }

    @Test
    public void preOrder() {
        TestEntity root = new TestEntity("package",
                new TestEntity("indicator", new TestEntity("observable"), new TestEntity("sighting")),
                new TestEntity("ttp"));

        assertEquals(ImmutableList.of("package", "indicator", "observable", "sighting", "ttp"),
                typeIds(EntityWalker.depthFirstPreOrder(root)));
    }

    @Test
    public void sharedChildVisitedOnce() {
        TestEntity shared = new TestEntity("observable", new TestEntity("object"));
        TestEntity root = new TestEntity("package",
                new TestEntity("indicator", shared), new TestEntity("incident", shared));

        assertEquals(ImmutableList.of("package", "indicator", "observable", "object", "incident"),
                typeIds(EntityWalker.depthFirstPreOrder(root)));
    }

    @Test
    public void cycle() {
        TestEntity indicator = new TestEntity("indicator");
        TestEntity root = new TestEntity("package", indicator);
        indicator.add(root);

        assertEquals(2, EntityWalker.walk(root).count());
    }

    @Test
    public void leaf() {
        assertEquals(ImmutableList.of("hash"), typeIds(EntityWalker.depthFirstPreOrder(new TestEntity("hash"))));
    }
}
