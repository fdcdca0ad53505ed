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

package com.phonepe.sentinelrecall.core.recall;

import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.model.InMemoryModelRepository;
import com.phonepe.sentinelrecall.core.model.Model;
import com.phonepe.sentinelrecall.core.model.ModelHasher;
import com.phonepe.sentinelrecall.core.model.ModelId;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FullScanRecallEngine}
 */
class FullScanRecallEngineTest {

    private ModelStore store;
    private final FullScanRecallEngine engine = new FullScanRecallEngine();

    @BeforeEach
    void setUp() {
        store = new ModelStore("test", new InMemoryModelRepository(), new ModelHasher());
    }

    private static List<Event> events(String... symbols) {
        return Arrays.stream(symbols).map(Event::of).toList();
    }

    private ModelId learn(int times, String... symbols) {
        ModelId id = null;
        for (int i = 0; i < times; i++) {
            id = store.learn(events(symbols));
        }
        return id;
    }

    private static List<ModelId> ids(List<RecallMatch> matches) {
        return matches.stream().map(match -> match.getModel().getId()).toList();
    }

    @Test
    void testThresholdOneKeepsOnlyFullyMatchedModels() {
        final var exact = learn(1, "a", "b");
        learn(1, "a", "c");
        learn(1, "x", "b");
        final var containing = learn(1, "z", "a", "b", "w");

        final var matches = engine.recall(events("a", "b"), store, 1.0, 100);
        assertEquals(Set.of(exact, containing), Set.copyOf(ids(matches)));
        assertTrue(matches.stream().allMatch(match -> match.getSimilarity() == 1.0));
    }

    @Test
    void testPartialMatchesRankedBySimilarity() {
        final var full = learn(1, "a", "b");
        final var half = learn(5, "a", "c");
        learn(1, "x", "y");

        final var matches = engine.recall(events("a", "b"), store, 0.5, 100);
        assertEquals(List.of(full, half), ids(matches));
        assertEquals(0.5, matches.get(1).getSimilarity(), 1e-9);
    }

    @Test
    void testThresholdZeroReturnsEverythingByFrequency() {
        final var rare = learn(1, "a");
        final var common = learn(3, "b");

        final var matches = engine.recall(List.of(), store, 0.0, 100);
        assertEquals(List.of(common, rare), ids(matches));
        assertTrue(matches.stream().allMatch(match -> match.getSimilarity() == 0.0));
        assertTrue(matches.stream().allMatch(match -> match.getSpan().isEmpty()));

        assertEquals(2, engine.recall(events("q"), store, 0.0, 100).size());
    }

    @Test
    void testEmptyQueryWithPositiveThreshold() {
        learn(1, "a");
        assertTrue(engine.recall(List.of(), store, 0.1, 100).isEmpty());
    }

    @Test
    void testTiesBrokenById() {
        final var first = learn(1, "a", "x");
        final var second = learn(1, "a", "y");

        final var expected = List.of(first, second).stream().sorted().toList();
        assertEquals(expected, ids(engine.recall(events("a"), store, 1.0, 100)));
    }

    @Test
    void testTruncation() {
        for (int i = 0; i < 50; i++) {
            learn(i % 5 + 1, "shared", "unique" + i);
        }
        final var matches = engine.recall(events("shared"), store, 0.5, 10);
        assertEquals(10, matches.size());

        final List<ModelId> expected;
        try (final var models = store.iterate()) {
            expected = models
                    .sorted(Comparator.comparingLong(Model::getFrequency)
                                    .reversed()
                                    .thenComparing(Model::getId))
                    .limit(10)
                    .map(Model::getId)
                    .collect(Collectors.toList());
        }
        assertEquals(expected, ids(matches));
        assertTrue(matches.stream().allMatch(match -> match.getModel().getFrequency() == 5));
    }

    @Test
    void testEmptyStore() {
        assertTrue(engine.recall(events("a"), store, 0.0, 10).isEmpty());
    }
}
