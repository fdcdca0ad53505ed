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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

public class InMemoryModelRepository implements ModelRepository {
    private final Map<ModelId, Model> models = new ConcurrentHashMap<>();

    @Override
    public Optional<Model> get(ModelId id) {
        return Optional.ofNullable(models.get(id));
    }

    @Override
    public void put(Model model) {
        models.put(model.getId(), model);
    }

    @Override
    public Stream<Model> iterate() {
        return models.values().stream();
    }

    @Override
    public long count() {
        return models.size();
    }
}
