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

import com.phonepe.sentinelrecall.core.model.Model;
import lombok.Value;

import java.util.Comparator;

/**
 * A model that passed the recall threshold along with how it aligned with the query
 */
@Value
public class RecallMatch {
    /**
     * Similarity desc, frequency desc, model id asc
     */
    public static final Comparator<RecallMatch> RANKING = Comparator
            .comparingDouble(RecallMatch::getSimilarity).reversed()
            .thenComparing(Comparator.comparingLong((RecallMatch match) -> match.getModel().getFrequency()).reversed())
            .thenComparing(match -> match.getModel().getId());

    Model model;
    double similarity;
    Alignment alignment;

    public MatchSpan getSpan() {
        return alignment.getSpan();
    }
}
