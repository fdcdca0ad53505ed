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

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Key value storage for models, keyed by {@link ModelId}. Implementations only need to store and return what they are
 * given; hashing, locking and statistics are handled by {@link ModelStore}.
 */
public interface ModelRepository {
    Optional<Model> get(ModelId id);

    /**
     * Insert or overwrite the model with the same id
     */
    void put(Model model);

    /**
     * @return finite stream over all stored models. Every call starts a fresh iteration.
     */
    Stream<Model> iterate();

    long count();
}
