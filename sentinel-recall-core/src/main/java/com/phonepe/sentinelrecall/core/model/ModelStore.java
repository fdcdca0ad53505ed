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

import com.google.common.util.concurrent.Striped;
import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import com.phonepe.sentinelrecall.core.events.Event;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.stream.Stream;

/**
 * Content addressed store of learned models for one namespace.
 * <p>
 * Implementation:
 * - The id of a model is the hash of the canonical encoding of its event signatures
 * - Learning an existing sequence bumps its frequency and folds the emotives into the running means
 * - Updates to one model are serialized with a striped lock on the model id, different models proceed in parallel
 * - An inverted index from event signature to models is rebuilt from the repository on startup and kept current on
 *   every insert. Models never change content, so entries are never removed.
 */
@Slf4j
public class ModelStore {
    private static final int LOCK_STRIPES = 64;

    @Getter
    private final String namespace;
    private final ModelRepository repository;
    @Getter
    private final ModelHasher hasher;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);
    private final Map<String, Set<ModelId>> signatureIndex = new ConcurrentHashMap<>();

    public ModelStore(@NonNull String namespace, @NonNull ModelRepository repository, @NonNull ModelHasher hasher) {
        this.namespace = namespace;
        this.repository = repository;
        this.hasher = hasher;
        try (final var models = repository.iterate()) {
            models.forEach(this::index);
        }
        log.info("Model store for namespace {} ready with {} models", namespace, repository.count());
    }

    /**
     * Learns a sequence of events.
     *
     * @param sequence Events in observation order. Emotives feed the statistics, the rest defines the identity.
     * @return id of the new or existing model
     * @throws SentinelRecallException with {@link ErrorType#EMPTY_SEQUENCE} if the sequence has no events
     */
    public ModelId learn(final List<Event> sequence) {
        if (sequence == null || sequence.isEmpty()) {
            throw SentinelRecallException.error(ErrorType.EMPTY_SEQUENCE, namespace);
        }
        final var events = sequence.stream()
                .map(Event::withoutEmotives)
                .toList();
        final var id = hasher.modelId(events);
        final var lock = locks.get(id);
        lock.lock();
        try {
            final var now = LocalDateTime.now();
            final var existing = repository.get(id).orElse(null);
            if (existing != null) {
                final var updated = existing.withStats(existing.getStats().recordOccurrence(sequence, now));
                repository.put(updated);
                log.debug("Model {} seen again in namespace {}. Frequency: {}",
                          id, namespace, updated.getFrequency());
            }
            else {
                final var model = new Model(id, events, ModelStats.first(sequence, now));
                index(model);
                repository.put(model);
                log.debug("New model {} of length {} learnt in namespace {}", id, events.size(), namespace);
            }
        }
        finally {
            lock.unlock();
        }
        return id;
    }

    public Optional<Model> find(final ModelId id) {
        return repository.get(id);
    }

    /**
     * @throws SentinelRecallException with {@link ErrorType#NOT_FOUND} for unknown ids
     */
    public Model get(final ModelId id) {
        return find(id).orElseThrow(() -> SentinelRecallException.error(ErrorType.NOT_FOUND, id));
    }

    /**
     * Full scan over the stored models. Caller should close the stream if the backing repository needs it.
     */
    public Stream<Model> iterate() {
        return repository.iterate();
    }

    /**
     * Ids of all models that contain at least one event with one of the given signatures
     */
    public Set<ModelId> candidates(final Collection<String> signatures) {
        final var found = new HashSet<ModelId>();
        signatures.forEach(signature -> {
            final var ids = signatureIndex.get(signature);
            if (ids != null) {
                found.addAll(ids);
            }
        });
        return found;
    }

    public long size() {
        return repository.count();
    }

    private void index(final Model model) {
        model.getEvents()
                .stream()
                .map(hasher::signature)
                .distinct()
                .forEach(signature -> signatureIndex
                        .computeIfAbsent(signature, key -> ConcurrentHashMap.newKeySet())
                        .add(model.getId()));
    }
}
