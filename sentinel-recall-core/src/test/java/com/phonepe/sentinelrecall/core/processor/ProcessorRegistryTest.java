/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sentinelrecall.core.processor;

import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.model.ModelRepositoryFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorRegistryTest {

    @Test
    void testContextsCreatedLazily() {
        final var registry = ProcessorRegistry.builder().build();
        assertTrue(registry.contextIds().isEmpty());

        final var context = registry.context("ctx");
        assertSame(context, registry.context("ctx"));
        assertEquals(Set.of("ctx"), registry.contextIds());
        assertEquals("ctx", context.modelStore().getNamespace());
        assertEquals(registry.getDefaultConfig(), context.config());

        assertThrows(IllegalArgumentException.class, () -> registry.context(""));
        assertThrows(IllegalArgumentException.class, () -> registry.context(null));
    }

    @Test
    void testStoresOpenedOncePerNamespace() {
        final var created = new ArrayList<String>();
        final var registry = ProcessorRegistry.builder()
                .repositoryFactory(namespace -> {
                    created.add(namespace);
                    return ModelRepositoryFactory.inMemory().create(namespace);
                })
                .build();
        final var shared = ProcessorConfig.defaults().withNamespace("shared");
        registry.configure("one", shared);
        registry.configure("two", shared);

        assertSame(registry.context("one").modelStore(), registry.context("two").modelStore());
        assertEquals(List.of("one", "shared", "two"), created);
    }

    @Test
    void testReconfigureKeepsWorkingMemory() {
        final var registry = ProcessorRegistry.builder().build();
        final var context = registry.context("ctx");
        context.append(Event.of("a"));
        context.append(Event.of("b"));
        context.append(Event.of("c"));

        registry.configure("ctx", ProcessorConfig.defaults().withWorkingMemoryCapacity(2));
        assertEquals(List.of(Event.of("b"), Event.of("c")), context.workingMemory());
        assertEquals(2, context.config().getWorkingMemoryCapacity());
    }
}
