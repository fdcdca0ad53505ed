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

import java.util.List;

/**
 * Finds and ranks the models of a store that best explain a query.
 * All implementations must return exactly what a full scan with the same matcher would return.
 */
public interface RecallEngine {

    /**
     * @param query           Working memory snapshot
     * @param store           Models to search
     * @param recallThreshold Minimum similarity in [0,1]
     * @param maxResults      Upper bound on the number of matches returned
     * @return Matches ordered by {@link RecallMatch#RANKING}
     */
    List<RecallMatch> recall(List<Event> query, ModelStore store, double recallThreshold, int maxResults);

    /**
     * Matcher used for alignment. Prediction segmentation must use the same one.
     */
    EventMatcher matcher();
}
