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
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Positional alignment of a query against the events of a model.
 * <p>
 * Every offset at which the query overlaps the model is tried. The winner has the most matching pairs; ties go to the
 * offset with the shortest matched span and then to the smallest offset. When nothing matches the alignment is
 * {@link Alignment#none()}.
 */
@UtilityClass
public class Aligner {

    public static Alignment align(final List<Event> model, final List<Event> query, final EventMatcher matcher) {
        final var modelLength = model.size();
        final var queryLength = query.size();
        if (modelLength == 0 || queryLength == 0) {
            return Alignment.none();
        }
        Alignment best = null;
        for (int offset = -(queryLength - 1); offset < modelLength; offset++) {
            final var candidate = alignAt(model, query, matcher, offset);
            if (candidate != null && isBetter(candidate, best)) {
                best = candidate;
            }
        }
        return best == null ? Alignment.none() : best;
    }

    private static Alignment alignAt(List<Event> model, List<Event> query, EventMatcher matcher, int offset) {
        final var from = Math.max(0, -offset);
        final var to = Math.min(query.size(), model.size() - offset);
        int matches = 0;
        int first = -1;
        int last = -1;
        int blocks = 0;
        var previousMatched = false;
        for (int i = from; i < to; i++) {
            final var position = offset + i;
            if (matcher.matches(model.get(position), query.get(i))) {
                matches++;
                if (first < 0) {
                    first = position;
                }
                last = position;
                if (!previousMatched) {
                    blocks++;
                }
                previousMatched = true;
            }
            else {
                previousMatched = false;
            }
        }
        if (matches == 0) {
            return null;
        }
        return new Alignment(offset, matches, new MatchSpan(first, last + 1), blocks);
    }

    //Offsets are visited in increasing order, so keeping the incumbent on a full tie prefers the smaller offset
    private static boolean isBetter(Alignment candidate, Alignment best) {
        if (best == null) {
            return true;
        }
        if (candidate.getMatches() != best.getMatches()) {
            return candidate.getMatches() > best.getMatches();
        }
        return candidate.getSpan().length() < best.getSpan().length();
    }
}
