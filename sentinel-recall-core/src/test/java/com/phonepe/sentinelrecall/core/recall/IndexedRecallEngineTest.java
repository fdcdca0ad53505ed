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
import com.phonepe.sentinelrecall.core.model.ModelHasher;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link IndexedRecallEngine}. Results must be identical to a full scan.
 */
class IndexedRecallEngineTest {
    private static final String[] ALPHABET = {"a", "b", "c", "d", "e"};
    private static final double[] THRESHOLDS = {0.0, 0.2, 1.0 / 3, 0.5, 0.75, 1.0};
    private static final int[] LIMITS = {1, 5, 100};

    private final FullScanRecallEngine fullScan = new FullScanRecallEngine();
    private final IndexedRecallEngine indexed = new IndexedRecallEngine();

    private static List<Event> randomSequence(Random random, int minLength, int maxLength) {
        final var length = minLength + random.nextInt(maxLength - minLength + 1);
        final var events = new ArrayList<Event>(length);
        for (int i = 0; i < length; i++) {
            events.add(Event.of(ALPHABET[random.nextInt(ALPHABET.length)]));
        }
        return events;
    }

    @Test
    void testSameResultsAsFullScan() {
        for (long seed = 0; seed < 20; seed++) {
            final var random = new Random(seed);
            final var store = new ModelStore("seed-" + seed, new InMemoryModelRepository(), new ModelHasher());
            for (int i = 0; i < 30; i++) {
                store.learn(randomSequence(random, 1, 6));
            }
            for (int q = 0; q < 10; q++) {
                final var query = randomSequence(random, 0, 5);
                for (final var threshold : THRESHOLDS) {
                    for (final var limit : LIMITS) {
                        assertEquals(fullScan.recall(query, store, threshold, limit),
                                     indexed.recall(query, store, threshold, limit),
                                     "seed " + seed + " query " + query + " threshold " + threshold);
                    }
                }
            }
        }
    }

    @Test
    void testOnlySharedModelsAreScored() {
        final var store = new ModelStore("test", new InMemoryModelRepository(), new ModelHasher());
        final var shared = store.learn(List.of(Event.of("a"), Event.of("b")));
        store.learn(List.of(Event.of("x"), Event.of("y")));

        final var matches = indexed.recall(List.of(Event.of("b")), store, 0.5, 10);
        assertEquals(1, matches.size());
        assertEquals(shared, matches.get(0).getModel().getId());
        assertTrue(indexed.recall(List.of(Event.of("z")), store, 0.1, 10).isEmpty());
        assertEquals(2, indexed.recall(List.of(Event.of("z")), store, 0.0, 10).size());
    }
}
