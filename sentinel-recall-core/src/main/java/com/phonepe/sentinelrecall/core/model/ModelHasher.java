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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.events.EventCanonicalizer;
import lombok.Getter;

import java.util.List;

/**
 * Fixed width digests over canonical event encodings. Used for model identity and for the event signature index.
 */
public class ModelHasher {
    @Getter
    private final EventCanonicalizer canonicalizer;
    private final HashFunction hashFunction;

    public ModelHasher() {
        this(new EventCanonicalizer(), Hashing.sha256());
    }

    public ModelHasher(EventCanonicalizer canonicalizer, HashFunction hashFunction) {
        this.canonicalizer = canonicalizer;
        this.hashFunction = hashFunction;
    }

    public ModelId modelId(final List<Event> sequence) {
        return ModelId.parse(hashFunction.hashBytes(canonicalizer.encodeSequence(sequence)).toString());
    }

    /**
     * Digest of the signature of a single event, emotives excluded
     */
    public String signature(final Event event) {
        return hashFunction.hashBytes(canonicalizer.encode(event)).toString();
    }
}
