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

import lombok.Value;

/**
 * Best placement of a query against a model.
 */
@Value
public class Alignment {
    /**
     * Query event {@code i} sits against model event {@code offset + i}. Can be negative when the query starts before
     * the model.
     */
    int offset;

    /**
     * Number of aligned pairs that matched
     */
    int matches;

    /**
     * From the first to the last matched model position
     */
    MatchSpan span;

    /**
     * Number of runs of consecutive matched positions
     */
    int blocks;

    public static Alignment none() {
        return new Alignment(0, 0, MatchSpan.empty(), 0);
    }

    /**
     * Model position aligned with the given query position
     */
    public int modelPosition(int queryPosition) {
        return offset + queryPosition;
    }
}
