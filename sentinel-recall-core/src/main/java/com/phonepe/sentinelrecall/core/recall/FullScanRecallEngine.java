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

/**
 * Scores every model in the store. Works with any {@link EventMatcher}.
 */
@Slf4j
public class FullScanRecallEngine extends AbstractRecallEngine {

    public FullScanRecallEngine() {
        this(SignatureEventMatcher.INSTANCE);
    }

    public FullScanRecallEngine(EventMatcher matcher) {
        super(matcher);
    }

    @Override
    public List<RecallMatch> recall(List<Event> query, ModelStore store, double recallThreshold, int maxResults) {
        final var matches = rank(store.iterate(), query, recallThreshold, maxResults);
        log.debug("Full scan of {} models in namespace {} returned {} matches",
                  store.size(), store.getNamespace(), matches.size());
        return matches;
    }
}
