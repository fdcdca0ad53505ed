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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;
import com.phonepe.sentinelrecall.core.errors.ErrorType;
import com.phonepe.sentinelrecall.core.errors.SentinelRecallException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * Content hash identifying a model. Rendered as {@code PTRN|<hex>}; lookups accept the bare hex digest as well.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModelId implements Comparable<ModelId> {
    public static final String PREFIX = "PTRN|";

    String hash;

    @JsonCreator
    public static ModelId parse(String value) {
        if (Strings.isNullOrEmpty(value)) {
            throw SentinelRecallException.error(ErrorType.NOT_FOUND, value);
        }
        final var hash = value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
        if (hash.isEmpty()) {
            throw SentinelRecallException.error(ErrorType.NOT_FOUND, value);
        }
        return new ModelId(hash.toLowerCase(Locale.ROOT));
    }

    @JsonValue
    @Override
    public String toString() {
        return PREFIX + hash;
    }

    @Override
    public int compareTo(ModelId other) {
        return hash.compareTo(other.hash);
    }
}
