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

import com.google.common.collect.Ordering;
import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.model.Model;
import lombok.NonNull;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Scoring and ranking shared by the engines. Subclasses only decide which models get scored.
 */
public abstract class AbstractRecallEngine implements RecallEngine {
    private static final Ordering<RecallMatch> RANKING = Ordering.from(RecallMatch.RANKING);

    private final EventMatcher matcher;

    protected AbstractRecallEngine(@NonNull EventMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public EventMatcher matcher() {
        return matcher;
    }

    /**
     * Similarity is the share of query events matched by the best alignment. An empty query scores 0.
     */
    public RecallMatch score(final Model model, final List<Event> query) {
        final var alignment = Aligner.align(model.getEvents(), query, matcher);
        final var similarity = query.isEmpty() ? 0.0 : (double) alignment.getMatches() / query.size();
        return new RecallMatch(model, similarity, alignment);
    }

    protected List<RecallMatch> rank(final Stream<Model> candidates,
                                     final List<Event> query,
                                     final double recallThreshold,
                                     final int maxResults) {
        try (candidates) {
            final var passed = candidates
                    .filter(Objects::nonNull)
                    .map(model -> score(model, query))
                    .filter(match -> match.getSimilarity() >= recallThreshold)
                    .iterator();
            return RANKING.leastOf(passed, maxResults);
        }
    }
}
