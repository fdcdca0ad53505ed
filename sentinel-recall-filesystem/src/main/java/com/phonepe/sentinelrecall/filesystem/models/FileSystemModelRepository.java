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

package com.phonepe.sentinelrecall.filesystem.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import com.phonepe.sentinelrecall.core.model.Model;
import com.phonepe.sentinelrecall.core.model.ModelId;
import com.phonepe.sentinelrecall.core.model.ModelRepository;
import com.phonepe.sentinelrecall.core.model.ModelRepositoryFactory;
import com.phonepe.sentinelrecall.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.StampedLock;
import java.util.stream.Stream;

/**
 * Disk based model repository.
 * Implementation:
 * - Every model is stored as {@code <hash>.json} in the provided directory
 * - All models are read in one shot at startup and served from an in memory map afterwards
 * - Writes replace the whole file atomically and are then committed to the map
 * - A stamped lock serializes writers. Readers only touch the concurrent map.
 */
@Slf4j
public class FileSystemModelRepository implements ModelRepository {
    private static final String MODEL_FILE_SUFFIX = ".json";

    private final Path modelRoot;
    private final ObjectMapper mapper;
    private final Map<ModelId, Model> cache = new ConcurrentHashMap<>();
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemModelRepository(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.modelRoot = FileUtils.ensurePath(baseDir, true);
        this.mapper = mapper;
        loadModels();
    }

    /**
     * Factory creating one sub directory per namespace below {@code baseDir}
     */
    public static ModelRepositoryFactory factory(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        final var root = FileUtils.ensurePath(baseDir, true);
        return namespace -> new FileSystemModelRepository(root.resolve(FileUtils.safeName(namespace)).toString(),
                                                          mapper);
    }

    @Override
    public Optional<Model> get(ModelId id) {
        return Optional.ofNullable(cache.get(id));
    }

    @Override
    public void put(Model model) {
        final var stamp = lock.writeLock();
        try {
            final var file = modelRoot.resolve(model.getId().getHash() + MODEL_FILE_SUFFIX);
            FileUtils.writeAtomically(file, mapper.writeValueAsBytes(model));
            cache.put(model.getId(), model);
        }
        catch (IOException e) {
            throw SentinelRecallException.error(e, ErrorType.STORAGE_FAILURE,
                                                "could not write model %s to %s".formatted(model.getId(), modelRoot));
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Stream<Model> iterate() {
        return List.copyOf(cache.values()).stream();
    }

    @Override
    public long count() {
        return cache.size();
    }

    private void loadModels() {
        try (final var paths = Files.list(modelRoot)) {
            paths.filter(path -> Files.isRegularFile(path)
                            && path.getFileName().toString().endsWith(MODEL_FILE_SUFFIX))
                    .forEach(this::loadModel);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to list models in " + modelRoot, e);
        }
        log.info("Loaded {} models from {}", cache.size(), modelRoot);
    }

    private void loadModel(Path path) {
        try {
            final var model = mapper.readValue(path.toFile(), Model.class);
            final var fileName = path.getFileName().toString();
            final var expectedHash = fileName.substring(0, fileName.length() - MODEL_FILE_SUFFIX.length());
            if (!expectedHash.equals(model.getId().getHash())) {
                log.warn("Ignoring {}: file name does not match model id {}", path, model.getId());
                return;
            }
            cache.put(model.getId(), model);
        }
        catch (Exception e) {
            log.error("Failed to load model from path: {}", path, e);
        }
    }
}
