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

package com.phonepe.sentinelrecall.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Running mean of one emotive at one position of a model
 */
@Value
@Builder
@Jacksonized
public class EmotiveStats {
    double mean;
    long count;

    public static EmotiveStats of(double value) {
        return new EmotiveStats(value, 1);
    }

    public EmotiveStats add(double value) {
        final var newCount = count + 1;
        return new EmotiveStats(mean + (value - mean) / newCount, newCount);
    }
}
