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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import com.phonepe.sentinelrecall.core.utils.JsonUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Turns raw observations into canonical {@link Event}s and produces the byte encodings that model hashes are computed
 * over.
 * <p>
 * Rules:
 * <ul>
 *     <li>Strings are sorted in natural order. Duplicates are kept</li>
 *     <li>Vectors keep the order in which they were given. {@code -0.0} is stored as {@code 0.0}</li>
 *     <li>Emotives with the same name collapse to the last reading</li>
 * </ul>
 * The class is stateless and thread safe.
 */
public class EventCanonicalizer {

    private record Signature(List<String> strings, List<List<Double>> vectors) {
    }

    private final ObjectMapper canonicalMapper;

    public EventCanonicalizer() {
        this.canonicalMapper = JsonUtils.createCanonicalMapper();
    }

    public Event canonicalize(final Observation observation) {
        if (observation == null) {
            throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION, "observation is null");
        }
        final var strings = new ArrayList<String>(observation.getStrings().size());
        for (final var string : observation.getStrings()) {
            if (string == null) {
                throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION, "null string");
            }
            strings.add(string);
        }
        strings.sort(null);

        final var vectors = new ArrayList<List<Double>>(observation.getVectors().size());
        for (final var vector : observation.getVectors()) {
            vectors.add(normalizeVector(vector));
        }

        final var emotives = new TreeMap<String, Double>();
        for (final var emotive : observation.getEmotives()) {
            if (emotive == null || emotive.getName() == null) {
                throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION, "emotive without a name");
            }
            if (!Double.isFinite(emotive.getValue())) {
                throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION,
                                                    "emotive " + emotive.getName() + " is not finite");
            }
            emotives.put(emotive.getName(), emotive.getValue());
        }
        return new Event(strings, vectors, emotives);
    }

    /**
     * Canonical byte encoding of the signature of one event. Emotives are not part of it.
     */
    public byte[] encode(final Event event) {
        return write(toSignature(event));
    }

    /**
     * Canonical byte encoding of an ordered sequence of event signatures
     */
    public byte[] encodeSequence(final List<Event> events) {
        return write(events.stream()
                             .map(EventCanonicalizer::toSignature)
                             .toList());
    }

    private static Signature toSignature(Event event) {
        return new Signature(event.getStrings(), event.getVectors());
    }

    private byte[] write(Object value) {
        try {
            return canonicalMapper.writeValueAsBytes(value);
        }
        catch (JsonProcessingException e) {
            throw SentinelRecallException.error(e, ErrorType.INVALID_OBSERVATION, e.getOriginalMessage());
        }
    }

    private static List<Double> normalizeVector(List<Double> vector) {
        if (vector == null) {
            throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION, "null vector");
        }
        final var normalized = new ArrayList<Double>(vector.size());
        for (final var component : vector) {
            if (component == null || !Double.isFinite(component)) {
                throw SentinelRecallException.error(ErrorType.INVALID_OBSERVATION,
                                                    "vector component " + component + " is not a finite number");
            }
            normalized.add(component == 0.0 ? 0.0 : component);
        }
        return normalized;
    }
}
