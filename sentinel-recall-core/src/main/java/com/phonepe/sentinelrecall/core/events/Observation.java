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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw observation as received from the caller. Nothing here is normalized yet, see {@link EventCanonicalizer}.
 */
@Value
@Builder
@Jacksonized
public class Observation {
    /**
     * Symbols seen in this observation. Order does not matter, repeats do.
     */
    @Singular
    List<String> strings;

    /**
     * Opaque numeric vectors, kept in the order given
     */
    @Singular
    List<List<Double>> vectors;

    /**
     * Emotive readings. A repeated name overwrites the earlier reading.
     */
    @Singular
    List<Emotive> emotives;

    public static Observation ofStrings(String... strings) {
        return Observation.builder()
                .strings(List.of(strings))
                .build();
    }
}
