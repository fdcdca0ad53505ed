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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.sentinelrecall.core.model.ModelHasher;
import com.phonepe.sentinelrecall.core.model.ModelRepositoryFactory;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns all processor contexts and model store namespaces of a process. Contexts are created lazily with the default
 * configuration the first time their id is referenced and are never destroyed.
 */
@Slf4j
public class ProcessorRegistry {
    private final ModelRepositoryFactory repositoryFactory;
    @Getter
    private final ModelHasher hasher;
    @Getter
    private final ProcessorConfig defaultConfig;
    private final Map<String, ProcessorContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, ModelStore> stores = new ConcurrentHashMap<>();

    @Builder
    public ProcessorRegistry(ModelRepositoryFactory repositoryFactory,
                             ModelHasher hasher,
                             ProcessorConfig defaultConfig) {
        this.repositoryFactory = Objects.requireNonNullElseGet(repositoryFactory, ModelRepositoryFactory::inMemory);
        this.hasher = Objects.requireNonNullElseGet(hasher, ModelHasher::new);
        this.defaultConfig = Objects.requireNonNullElseGet(defaultConfig, ProcessorConfig::defaults).validate();
    }

    public ProcessorContext context(final String contextId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(contextId), "Context id is required");
        return contexts.computeIfAbsent(contextId, id -> {
            log.info("Creating processor context {}", id);
            return new ProcessorContext(id, defaultConfig, store(defaultConfig.effectiveNamespace(id)));
        });
    }

    public ProcessorContext configure(final String contextId, final ProcessorConfig config) {
        config.validate();
        final var context = context(contextId);
        context.reconfigure(config, store(config.effectiveNamespace(contextId)));
        log.debug("Context {} reconfigured: {}", contextId, config);
        return context;
    }

    public ModelStore store(final String namespace) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "Namespace is required");
        return stores.computeIfAbsent(namespace, ns -> {
            log.info("Opening model store namespace {}", ns);
            return new ModelStore(ns, repositoryFactory.create(ns), hasher);
        });
    }

    public Set<String> contextIds() {
        return Set.copyOf(contexts.keySet());
    }
}
