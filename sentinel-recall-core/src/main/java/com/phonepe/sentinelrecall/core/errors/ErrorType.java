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

package com.phonepe.sentinelrecall.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures raised by the recall core. Every failure is scoped to the operation and processor context that
 * triggered it.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    EMPTY_SEQUENCE("Cannot learn from an empty sequence. Context: %s", false),
    INVALID_CONFIGURATION("Invalid configuration: %s", false),
    NOT_FOUND("Model not found: %s", false),
    INVALID_OBSERVATION("Invalid observation: %s", false),
    STORAGE_FAILURE("Model storage failure: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}
