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

import lombok.Getter;

/**
 * Raised to the immediate caller for any failure in the recall core. The {@link ErrorType} lets the caller (usually a
 * transport layer) map the failure to its own response.
 */
@Getter
public class SentinelRecallException extends RuntimeException {
    private final ErrorType errorType;

    public SentinelRecallException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SentinelRecallException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static SentinelRecallException error(ErrorType errorType, Object... args) {
        return new SentinelRecallException(errorType, String.format(errorType.getMessage(), args));
    }

    public static SentinelRecallException error(Throwable cause, ErrorType errorType, Object... args) {
        return new SentinelRecallException(errorType, String.format(errorType.getMessage(), args), cause);
    }
}
