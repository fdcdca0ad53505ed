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

package com.phonepe.sentinelrecall.core.prediction;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.model.ModelId;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One ranked model match, split into temporal segments relative to the current working memory
 */
@Value
@Builder
@Jacksonized
public class PredictionEntry {
    @JsonPropertyDescription("Id of the matched model")
    ModelId modelId;

    @JsonPropertyDescription("Share of working memory events matched by the model, in [0,1]")
    double similarity;

    @JsonPropertyDescription("Number of times the model has been learned")
    long frequency;

    @JsonPropertyDescription("Model events before the matched region")
    List<Event> past;

    @JsonPropertyDescription("Model events in the matched region")
    List<Event> present;

    @JsonPropertyDescription("Model events after the matched region")
    List<Event> future;

    @JsonPropertyDescription("Model events from the matched region onwards that working memory does not have at the aligned position")
    List<Event> missing;

    @JsonPropertyDescription("Working memory events not accounted for by the model")
    List<Event> extras;

    @JsonPropertyDescription("Number of aligned event pairs that matched")
    int matches;

    @JsonPropertyDescription("matches divided by model length")
    double evidence;

    @JsonPropertyDescription("matches divided by length of the present segment")
    double confidence;

    @JsonPropertyDescription("Signal to noise ratio of matches against extras, in [-1,1]")
    double snr;

    @JsonPropertyDescription("Number of matched blocks minus one")
    double fragmentation;

    @JsonPropertyDescription("Combined score: (evidence + confidence) * snr + 1 / (fragmentation + 1). "
            + "The last term is 0 when nothing matched. Informational only, ranking does not use it")
    double potential;

    @JsonPropertyDescription("Mean emotives recorded for the model")
    Map<String, Double> emotives;
}
