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
import com.phonepe.sentinelrecall.core.model.ModelStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Uses the signature index of the store to score only models sharing at least one event with the query.
 * <p>
 * A model without any shared event scores 0, so it can only pass a threshold of 0. For that threshold, and for an
 * empty query, the engine scans everything instead. Matching is always exact on signatures since the index is built on
 * them.
 */
@Slf4j
public class IndexedRecallEngine extends AbstractRecallEngine {

    public IndexedRecallEngine() {
        super(SignatureEventMatcher.INSTANCE);
    }

    @Override
    public List<RecallMatch> recall(List<Event> query, ModelStore store, double recallThreshold, int maxResults) {
        if (query.isEmpty() || recallThreshold <= 0.0) {
            return rank(store.iterate(), query, recallThreshold, maxResults);
        }
        final var hasher = store.getHasher();
        final var signatures = query.stream()
                .map(hasher::signature)
                .collect(Collectors.toSet());
        final var candidates = store.candidates(signatures);
        log.debug("Index narrowed {} models to {} candidates in namespace {}",
                  store.size(), candidates.size(), store.getNamespace());
        return rank(candidates.stream()
                            .map(store::find)
                            .flatMap(Optional::stream),
                    query,
                    recallThreshold,
                    maxResults);
    }
}
