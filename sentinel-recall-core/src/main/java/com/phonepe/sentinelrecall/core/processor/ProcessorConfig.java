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

package com.phonepe.sentinelrecall.core.processor;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.google.common.base.Strings;
import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import com.phonepe.sentinelrecall.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.function.Function;

/**
 * Settings of one processor context
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class ProcessorConfig {
    public static final int DEFAULT_MAX_PREDICTIONS = 100;
    public static final double DEFAULT_RECALL_THRESHOLD = 0.1;

    @JsonPropertyDescription("Upper bound on the number of predictions returned. Must be positive")
    @Builder.Default
    int maxPredictions = DEFAULT_MAX_PREDICTIONS;

    @JsonPropertyDescription("Minimum similarity for a model to be predicted. Must be in [0,1]")
    @Builder.Default
    double recallThreshold = DEFAULT_RECALL_THRESHOLD;

    @JsonPropertyDescription("Learn automatically once working memory reaches this many events. 0 disables")
    @Builder.Default
    int maxPatternLength = 0;

    @JsonPropertyDescription("Working memory handling after an automatic learn")
    @Builder.Default
    StmMode stmMode = StmMode.CLEAR;

    @JsonPropertyDescription("Maximum events kept in working memory, oldest evicted first. 0 means unbounded. "
            + "Cannot be below a non zero maxPatternLength")
    @Builder.Default
    int workingMemoryCapacity = 0;

    @JsonPropertyDescription("Model store namespace. Defaults to the context id, contexts naming the same namespace share models")
    String namespace;

    public static ProcessorConfig defaults() {
        return ProcessorConfig.builder().build();
    }

    /**
     * Defaults overridden by RECALL_THRESHOLD, MAX_PREDICTIONS, MAX_PATTERN_LENGTH, STM_MODE and
     * WORKING_MEMORY_CAPACITY when set
     */
    public static ProcessorConfig fromEnv() {
        final var defaults = defaults();
        return ProcessorConfig.builder()
                .recallThreshold(env("RECALL_THRESHOLD", Double::parseDouble, defaults.getRecallThreshold()))
                .maxPredictions(env("MAX_PREDICTIONS", Integer::parseInt, defaults.getMaxPredictions()))
                .maxPatternLength(env("MAX_PATTERN_LENGTH", Integer::parseInt, defaults.getMaxPatternLength()))
                .stmMode(env("STM_MODE",
                             value -> StmMode.valueOf(value.trim().toUpperCase(Locale.ROOT)),
                             defaults.getStmMode()))
                .workingMemoryCapacity(env("WORKING_MEMORY_CAPACITY",
                                           Integer::parseInt,
                                           defaults.getWorkingMemoryCapacity()))
                .build()
                .validate();
    }

    /**
     * @return this config if valid
     * @throws SentinelRecallException with {@link ErrorType#INVALID_CONFIGURATION} otherwise
     */
    public ProcessorConfig validate() {
        if (maxPredictions <= 0) {
            throw invalid("maxPredictions must be positive, got " + maxPredictions);
        }
        if (Double.isNaN(recallThreshold) || recallThreshold < 0.0 || recallThreshold > 1.0) {
            throw invalid("recallThreshold must be in [0,1], got " + recallThreshold);
        }
        if (maxPatternLength < 0) {
            throw invalid("maxPatternLength cannot be negative, got " + maxPatternLength);
        }
        if (stmMode == null) {
            throw invalid("stmMode is required");
        }
        if (workingMemoryCapacity < 0) {
            throw invalid("workingMemoryCapacity cannot be negative, got " + workingMemoryCapacity);
        }
        if (workingMemoryCapacity > 0 && maxPatternLength > workingMemoryCapacity) {
            throw invalid("workingMemoryCapacity %d is below maxPatternLength %d, auto learn could never trigger"
                                  .formatted(workingMemoryCapacity, maxPatternLength));
        }
        return this;
    }

    public String effectiveNamespace(String contextId) {
        return Strings.isNullOrEmpty(namespace) ? contextId : namespace;
    }

    private static SentinelRecallException invalid(String reason) {
        return SentinelRecallException.error(ErrorType.INVALID_CONFIGURATION, reason);
    }

    private static <T> T env(String variable, Function<String, T> parser, T defaultValue) {
        final var raw = EnvLoader.readEnv(variable).orElse(null);
        if (Strings.isNullOrEmpty(raw)) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        }
        catch (IllegalArgumentException e) {
            throw SentinelRecallException.error(e, ErrorType.INVALID_CONFIGURATION,
                                                "cannot parse %s=%s".formatted(variable, raw));
        }
    }
}
