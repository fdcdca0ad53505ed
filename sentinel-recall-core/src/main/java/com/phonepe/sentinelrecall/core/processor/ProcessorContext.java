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
import com.phonepe.sentinelrecall.core.memory.WorkingMemory;
import com.phonepe.sentinelrecall.core.model.ModelId;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One isolated processor: its own working memory and configuration plus a reference to a model store namespace.
 * <p>
 * All working memory access, learning and configuration changes happen under a single exclusive lock, so a learn never
 * sees a half applied append.
 */
@Slf4j
public class ProcessorContext {
    @Getter
    private final String contextId;
    private final ReentrantLock lock = new ReentrantLock();
    private final WorkingMemory workingMemory;
    private ProcessorConfig config;
    private ModelStore modelStore;

    public ProcessorContext(@NonNull String contextId, @NonNull ProcessorConfig config, @NonNull ModelStore modelStore) {
        this.contextId = contextId;
        this.config = config.validate();
        this.modelStore = modelStore;
        this.workingMemory = new WorkingMemory(config.getWorkingMemoryCapacity());
    }

    /**
     * Appends an event and learns automatically if the configured pattern length is reached. If that learn fails the
     * append is rolled back and the error is rethrown.
     *
     * @return id of the automatically learnt model, if any
     */
    public Optional<ModelId> append(@NonNull Event event) {
        return locked(() -> {
            final var maxPatternLength = config.getMaxPatternLength();
            final var learnDue = maxPatternLength > 0 && workingMemory.size() + 1 >= maxPatternLength;
            final var previous = learnDue ? workingMemory.snapshot() : List.<Event>of();
            workingMemory.append(event);
            if (!learnDue || workingMemory.size() < maxPatternLength) {
                return Optional.empty();
            }
            final ModelId modelId;
            try {
                modelId = modelStore.learn(workingMemory.snapshot());
            }
            catch (RuntimeException e) {
                workingMemory.reset(previous);
                throw e;
            }
            if (config.getStmMode() == StmMode.ROLLING && maxPatternLength > 1) {
                workingMemory.reset(workingMemory.tail(maxPatternLength - 1));
            }
            else {
                workingMemory.clear();
            }
            log.debug("Context {} auto learnt model {} in {} mode", contextId, modelId, config.getStmMode());
            return Optional.of(modelId);
        });
    }

    /**
     * Learns the current working memory as a model and clears it.
     *
     * @throws SentinelRecallException with {@link ErrorType#EMPTY_SEQUENCE} if working memory is empty. Working memory
     *                                 is left untouched on any failure.
     */
    public ModelId learn() {
        return locked(() -> {
            if (workingMemory.isEmpty()) {
                throw SentinelRecallException.error(ErrorType.EMPTY_SEQUENCE, contextId);
            }
            final var modelId = modelStore.learn(workingMemory.snapshot());
            workingMemory.clear();
            return modelId;
        });
    }

    public List<Event> workingMemory() {
        return locked(workingMemory::snapshot);
    }

    public void clearWorkingMemory() {
        locked(() -> {
            workingMemory.clear();
            return null;
        });
    }

    public ContextSnapshot snapshot() {
        return locked(() -> new ContextSnapshot(workingMemory.snapshot(), config, modelStore));
    }

    public ProcessorConfig config() {
        return locked(() -> config);
    }

    public ModelStore modelStore() {
        return locked(() -> modelStore);
    }

    /**
     * Swaps configuration and model store reference. Working memory is kept, trimmed to a lowered capacity.
     */
    void reconfigure(@NonNull ProcessorConfig newConfig, @NonNull ModelStore newStore) {
        newConfig.validate();
        locked(() -> {
            this.config = newConfig;
            this.modelStore = newStore;
            workingMemory.setCapacity(newConfig.getWorkingMemoryCapacity());
            return null;
        });
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }
}
