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

package com.phonepe.sentinelrecall.filesystem.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.events.Observation;
import com.phonepe.sentinelrecall.core.model.ModelHasher;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import com.phonepe.sentinelrecall.core.processor.ProcessorConfig;
import com.phonepe.sentinelrecall.core.processor.ProcessorRegistry;
import com.phonepe.sentinelrecall.core.processor.RecallService;
import com.phonepe.sentinelrecall.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileSystemModelRepository}
 */
class FileSystemModelRepositoryTest {
    @TempDir
    Path tempDir;

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = JsonUtils.createMapper();
    }

    private FileSystemModelRepository open() {
        return new FileSystemModelRepository(tempDir.toString(), mapper);
    }

    @Test
    void testModelsSurviveRestart() {
        final var sequence = List.of(Event.builder()
                                             .strings(List.of("hello"))
                                             .emotives(Map.of("joy", 0.5))
                                             .build(),
                                     Event.of("world"));
        final var store = new ModelStore("test", open(), new ModelHasher());
        final var id = store.learn(sequence);
        store.learn(sequence);
        final var saved = store.get(id);

        final var reopened = open();
        assertEquals(1, reopened.count());
        final var loaded = reopened.get(id).orElseThrow();
        assertEquals(saved, loaded);
        assertEquals(2, loaded.getFrequency());
        assertEquals(0.5, loaded.getStats().getEmotives().get(0).get("joy").getMean(), 1e-9);

        final var reopenedStore = new ModelStore("test", reopened, new ModelHasher());
        assertEquals(Set.of(id), reopenedStore.candidates(Set.of(reopenedStore.getHasher()
                                                                         .signature(Event.of("world")))));
        assertEquals(id, reopenedStore.learn(sequence));
        assertEquals(3, open().get(id).orElseThrow().getFrequency());
    }

    @Test
    @SneakyThrows
    void testOneFilePerModel() {
        final var store = new ModelStore("test", open(), new ModelHasher());
        final var first = store.learn(List.of(Event.of("a")));
        final var second = store.learn(List.of(Event.of("b"), Event.of("c")));
        store.learn(List.of(Event.of("a")));

        try (final var files = Files.list(tempDir)) {
            assertEquals(Set.of(first.getHash() + ".json", second.getHash() + ".json"),
                         files.map(path -> path.getFileName().toString()).collect(Collectors.toSet()));
        }
    }

    @Test
    @SneakyThrows
    void testBrokenFilesAreSkipped() {
        final var store = new ModelStore("test", open(), new ModelHasher());
        final var id = store.learn(List.of(Event.of("a")));

        Files.writeString(tempDir.resolve("garbage.json"), "{not json");
        Files.copy(tempDir.resolve(id.getHash() + ".json"), tempDir.resolve("0000.json"));
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        final var reopened = open();
        assertEquals(1, reopened.count());
        assertTrue(reopened.get(id).isPresent());
    }

    @Test
    void testIterateReturnsSnapshot() {
        final var repository = open();
        final var store = new ModelStore("test", repository, new ModelHasher());
        store.learn(List.of(Event.of("a")));
        try (final var models = repository.iterate()) {
            store.learn(List.of(Event.of("b")));
            assertEquals(1, models.count());
        }
        assertEquals(2, repository.count());
    }

    @Test
    void testFactoryUsesOneDirectoryPerNamespace() {
        final var factory = FileSystemModelRepository.factory(tempDir.toString(), mapper);
        new ModelStore("alpha", factory.create("alpha"), new ModelHasher()).learn(List.of(Event.of("a")));
        new ModelStore("beta/../gamma", factory.create("beta/../gamma"), new ModelHasher())
                .learn(List.of(Event.of("b")));

        assertTrue(Files.isDirectory(tempDir.resolve("alpha")));
        assertTrue(Files.isDirectory(tempDir.resolve("beta%2F%2E%2E%2Fgamma")));
        assertEquals(1, factory.create("alpha").count());
        assertEquals(0, factory.create("delta").count());
    }

    @Test
    void testSimilarNamespacesStayApartAcrossRestarts() {
        final var first = service();
        first.observe("user/1", Observation.ofStrings("secret"));
        first.observe("user/1", Observation.ofStrings("data"));
        final var id = first.learn("user/1");

        final var second = service();
        for (final var contextId : List.of("user_1", "user:1", "user%2F1")) {
            second.observe(contextId, Observation.ofStrings("secret"));
            assertTrue(second.predict(contextId).isEmpty(), contextId);
        }
        second.observe("user/1", Observation.ofStrings("secret"));
        assertEquals(id, second.predict("user/1").get(0).getModelId());
    }

    private RecallService service() {
        return RecallService.builder()
                .registry(ProcessorRegistry.builder()
                                  .repositoryFactory(FileSystemModelRepository.factory(tempDir.toString(), mapper))
                                  .defaultConfig(ProcessorConfig.defaults().withRecallThreshold(0.5))
                                  .build())
                .build();
    }

    @Test
    void testServiceOverFileSystem() {
        final var config = ProcessorConfig.defaults().withRecallThreshold(0.5);
        final var first = RecallService.builder()
                .registry(ProcessorRegistry.builder()
                                  .repositoryFactory(FileSystemModelRepository.factory(tempDir.toString(), mapper))
                                  .defaultConfig(config)
                                  .build())
                .build();
        first.observe("ctx", Observation.ofStrings("hello"));
        first.observe("ctx", Observation.ofStrings("world"));
        final var id = first.learn("ctx");

        final var second = RecallService.builder()
                .registry(ProcessorRegistry.builder()
                                  .repositoryFactory(FileSystemModelRepository.factory(tempDir.toString(), mapper))
                                  .defaultConfig(config)
                                  .build())
                .build();
        second.observe("ctx", Observation.ofStrings("hello"));
        final var predictions = second.predict("ctx");

        assertEquals(1, predictions.size());
        assertEquals(id, predictions.get(0).getModelId());
        assertEquals(List.of(Event.of("world")), predictions.get(0).getFuture());
    }
}
