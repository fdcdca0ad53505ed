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

package com.phonepe.sentinelrecall.core.model;

import com.phonepe.sentinelrecall.core.events.Event;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable side of a model, replaced as a whole every time the model is learned again.
 */
@Value
@With
public class ModelStats {
    /**
     * How many times the model has been learned
     */
    long frequency;

    /**
     * Running means of emotives, one map per model position
     */
    List<Map<String, EmotiveStats>> emotives;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;

    @Builder
    @Jacksonized
    public ModelStats(long frequency,
                      List<Map<String, EmotiveStats>> emotives,
                      LocalDateTime createdAt,
                      LocalDateTime updatedAt) {
        this.frequency = frequency;
        this.emotives = emotives == null
                        ? List.of()
                        : emotives.stream()
                                .map(ModelStats::sorted)
                                .toList();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static ModelStats first(final List<Event> sequence, final LocalDateTime now) {
        final var emotives = sequence.stream()
                .map(event -> {
                    final var stats = new TreeMap<String, EmotiveStats>();
                    event.getEmotives().forEach((name, value) -> stats.put(name, EmotiveStats.of(value)));
                    return (Map<String, EmotiveStats>) stats;
                })
                .toList();
        return new ModelStats(1, emotives, now, now);
    }

    /**
     * Folds one more occurrence of the same sequence into the statistics. Emotives are aligned by position.
     */
    public ModelStats recordOccurrence(final List<Event> sequence, final LocalDateTime now) {
        final var updated = new ArrayList<Map<String, EmotiveStats>>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            final var current = new TreeMap<String, EmotiveStats>(i < emotives.size() ? emotives.get(i) : Map.of());
            sequence.get(i)
                    .getEmotives()
                    .forEach((name, value) -> current.merge(name,
                                                            EmotiveStats.of(value),
                                                            (existing, ignored) -> existing.add(value)));
            updated.add(current);
        }
        return new ModelStats(frequency + 1, updated, createdAt, now);
    }

    /**
     * Mean of the per position means for every emotive seen anywhere in the model
     */
    public Map<String, Double> averageEmotives() {
        final var sums = new TreeMap<String, double[]>();
        emotives.forEach(position -> position.forEach((name, stats) -> {
            final var acc = sums.computeIfAbsent(name, k -> new double[2]);
            acc[0] += stats.getMean();
            acc[1] += 1;
        }));
        final var averages = new TreeMap<String, Double>();
        sums.forEach((name, acc) -> averages.put(name, acc[0] / acc[1]));
        return Collections.unmodifiableMap(averages);
    }

    private static Map<String, EmotiveStats> sorted(Map<String, EmotiveStats> stats) {
        return stats == null || stats.isEmpty()
               ? Collections.emptySortedMap()
               : Collections.unmodifiableSortedMap(new TreeMap<>(stats));
    }
}
