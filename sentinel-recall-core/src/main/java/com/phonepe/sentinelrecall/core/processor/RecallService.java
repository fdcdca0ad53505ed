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

import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.events.EventCanonicalizer;
import com.phonepe.sentinelrecall.core.events.Observation;
import com.phonepe.sentinelrecall.core.model.Model;
import com.phonepe.sentinelrecall.core.model.ModelId;
import com.phonepe.sentinelrecall.core.prediction.PredictionEntry;
import com.phonepe.sentinelrecall.core.prediction.Predictor;
import com.phonepe.sentinelrecall.core.recall.IndexedRecallEngine;
import com.phonepe.sentinelrecall.core.recall.RecallEngine;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Entry point used by the surrounding system (transport, CLI etc.). Every operation is scoped to a context id.
 * Failures are raised as {@link SentinelRecallException} and affect only the calling operation.
 */
@Slf4j
public class RecallService {
    @Getter
    private final ProcessorRegistry registry;
    private final RecallEngine recallEngine;
    private final EventCanonicalizer canonicalizer;
    private final Predictor predictor;

    @Builder
    public RecallService(ProcessorRegistry registry, RecallEngine recallEngine) {
        this.registry = Objects.requireNonNullElseGet(registry, () -> ProcessorRegistry.builder().build());
        this.recallEngine = Objects.requireNonNullElseGet(recallEngine, IndexedRecallEngine::new);
        this.canonicalizer = this.registry.getHasher().getCanonicalizer();
        this.predictor = new Predictor(this.recallEngine.matcher());
    }

    /**
     * Canonicalizes an observation and appends it to the working memory of the context. Observations without strings
     * and vectors are not appended.
     *
     * @throws SentinelRecallException with {@link ErrorType#INVALID_OBSERVATION} for malformed input
     */
    public ObservationResult observe(final String contextId, final Observation observation) {
        final var event = canonicalizer.canonicalize(observation);
        final var context = registry.context(contextId);
        if (event.isEmpty()) {
            log.debug("Context {}: skipping observation without strings or vectors", contextId);
            return new ObservationResult(event, false, null);
        }
        final var learned = context.append(event);
        log.debug("Context {}: observed {}", contextId, event.getStrings());
        return new ObservationResult(event, true, learned.orElse(null));
    }

    /**
     * @throws SentinelRecallException with {@link ErrorType#EMPTY_SEQUENCE} if working memory is empty
     */
    public ModelId learn(final String contextId) {
        final var modelId = registry.context(contextId).learn();
        log.debug("Context {}: learnt model {}", contextId, modelId);
        return modelId;
    }

    public List<Event> getWorkingMemory(final String contextId) {
        return registry.context(contextId).workingMemory();
    }

    public void clearWorkingMemory(final String contextId) {
        registry.context(contextId).clearWorkingMemory();
    }

    /**
     * Ranked predictions for the current working memory, at most {@link ProcessorConfig#getMaxPredictions()} long
     */
    public List<PredictionEntry> predict(final String contextId) {
        final var snapshot = registry.context(contextId).snapshot();
        final var query = snapshot.getWorkingMemory();
        final var config = snapshot.getConfig();
        final var predictions = recallEngine.recall(query,
                                                    snapshot.getModelStore(),
                                                    config.getRecallThreshold(),
                                                    config.getMaxPredictions())
                .stream()
                .map(match -> predictor.predict(match, query))
                .toList();
        log.debug("Context {}: {} predictions for {} events in working memory",
                  contextId, predictions.size(), query.size());
        return predictions;
    }

    /**
     * @throws SentinelRecallException with {@link ErrorType#INVALID_CONFIGURATION} for out of range values
     */
    public void configure(final String contextId, final ProcessorConfig config) {
        if (config == null) {
            throw SentinelRecallException.error(ErrorType.INVALID_CONFIGURATION, "config is required");
        }
        registry.configure(contextId, config);
    }

    /**
     * Changes only the prediction limits, all other settings of the context are kept
     */
    public void configure(final String contextId, final int maxPredictions, final double recallThreshold) {
        final var current = registry.context(contextId).config();
        configure(contextId, current.toBuilder()
                .maxPredictions(maxPredictions)
                .recallThreshold(recallThreshold)
                .build());
    }

    public ProcessorConfig getConfig(final String contextId) {
        return registry.context(contextId).config();
    }

    /**
     * @throws SentinelRecallException with {@link ErrorType#NOT_FOUND} if the namespace of the context has no such
     *                                 model
     */
    public Model getModel(final String contextId, final String modelId) {
        return registry.context(contextId)
                .modelStore()
                .get(ModelId.parse(modelId));
    }
}
