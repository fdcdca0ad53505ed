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

package com.phonepe.sentinelrecall.core.prediction;

import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.recall.EventMatcher;
import com.phonepe.sentinelrecall.core.recall.RecallMatch;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a matched model into past, present, future, missing and extras. Pure function of the match and the query.
 */
public class Predictor {
    private final EventMatcher matcher;

    public Predictor(@NonNull EventMatcher matcher) {
        this.matcher = matcher;
    }

    public PredictionEntry predict(@NonNull RecallMatch match, @NonNull List<Event> query) {
        final var model = match.getModel();
        final var events = model.getEvents();
        final var alignment = match.getAlignment();
        final var span = alignment.getSpan();

        final var missing = new ArrayList<Event>();
        for (int position = span.getStart(); position < events.size(); position++) {
            final var queryPosition = position - alignment.getOffset();
            if (queryPosition >= 0
                    && queryPosition < query.size()
                    && !matcher.matches(events.get(position), query.get(queryPosition))) {
                missing.add(events.get(position));
            }
        }

        final var extras = new ArrayList<Event>();
        for (int i = 0; i < query.size(); i++) {
            final var position = alignment.modelPosition(i);
            final var accounted = position >= 0
                    && position < events.size()
                    && matcher.matches(events.get(position), query.get(i));
            if (!accounted) {
                extras.add(query.get(i));
            }
        }

        final var matches = alignment.getMatches();
        final var present = events.subList(span.getStart(), span.getEnd());
        final var noise = 2.0 * matches + extras.size();
        final var evidence = events.isEmpty() ? 0.0 : (double) matches / events.size();
        final var confidence = present.isEmpty() ? 0.0 : (double) matches / present.size();
        final var snr = noise > 0 ? (2.0 * matches - extras.size()) / noise : 0.0;
        final var fragmentation = matches > 0 ? alignment.getBlocks() - 1.0 : 0.0;
        return PredictionEntry.builder()
                .modelId(model.getId())
                .similarity(match.getSimilarity())
                .frequency(model.getFrequency())
                .past(List.copyOf(events.subList(0, span.getStart())))
                .present(List.copyOf(present))
                .future(List.copyOf(events.subList(span.getEnd(), events.size())))
                .missing(List.copyOf(missing))
                .extras(List.copyOf(extras))
                .matches(matches)
                .evidence(evidence)
                .confidence(confidence)
                .snr(snr)
                .fragmentation(fragmentation)
                .potential(potential(evidence, confidence, snr, fragmentation, matches))
                .emotives(model.getStats().averageEmotives())
                .build();
    }

    private static double potential(double evidence, double confidence, double snr, double fragmentation, int matches) {
        final var fragmentationTerm = matches > 0 ? 1.0 / (fragmentation + 1.0) : 0.0;
        return (evidence + confidence) * snr + fragmentationTerm;
    }
}
