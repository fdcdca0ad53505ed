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

package com.phonepe.sentinelrecall.core.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One canonicalized observation. Strings are sorted, vectors keep their positions and emotives are keyed by name in
 * sorted order. Instances are normally produced by {@link EventCanonicalizer}.
 * <p>
 * Strings and vectors make up the signature of the event. Emotives are carried along but do not take part in matching
 * or model identity.
 */
@Value
public class Event {
    List<String> strings;
    List<List<Double>> vectors;
    Map<String, Double> emotives;

    @Builder
    @Jacksonized
    public Event(List<String> strings, List<List<Double>> vectors, Map<String, Double> emotives) {
        this.strings = strings == null ? List.of() : List.copyOf(strings);
        this.vectors = vectors == null
                       ? List.of()
                       : vectors.stream()
                               .map(List::copyOf)
                               .toList();
        this.emotives = emotives == null || emotives.isEmpty()
                        ? Collections.emptySortedMap()
                        : Collections.unmodifiableSortedMap(new TreeMap<>(emotives));
    }

    /**
     * Event carrying only the given strings, sorted
     */
    public static Event of(String... strings) {
        return new Event(Arrays.stream(strings).sorted().toList(), List.of(), Map.of());
    }

    /**
     * @return true if the event carries neither strings nor vectors
     */
    @JsonIgnore
    public boolean isEmpty() {
        return strings.isEmpty() && vectors.isEmpty();
    }

    /**
     * @return same symbolic content with the emotives dropped
     */
    public Event withoutEmotives() {
        return emotives.isEmpty() ? this : new Event(strings, vectors, Map.of());
    }

    /**
     * Compares only the signature (strings and vectors) of two events
     */
    public boolean sameSignature(Event other) {
        return other != null
                && strings.equals(other.strings)
                && vectors.equals(other.vectors);
    }
}
