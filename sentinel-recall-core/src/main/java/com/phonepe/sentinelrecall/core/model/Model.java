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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.sentinelrecall.core.events.Event;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A learned, content addressed sequence of events. The id and events never change once created, only the
 * {@link ModelStats} get replaced when the same sequence is learned again.
 */
@Value
public class Model {
    ModelId id;

    /**
     * Events of the model without emotives. Emotives live in {@link ModelStats}.
     */
    List<Event> events;

    @With
    ModelStats stats;

    @Builder
    @Jacksonized
    public Model(@NonNull ModelId id, List<Event> events, @NonNull ModelStats stats) {
        this.id = id;
        this.events = events == null ? List.of() : List.copyOf(events);
        this.stats = stats;
    }

    @JsonIgnore
    public long getFrequency() {
        return stats.getFrequency();
    }

    public int length() {
        return events.size();
    }
}
