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

package com.phonepe.sentinelrecall.core.recall;

import com.phonepe.sentinelrecall.core.events.Event;

/**
 * Exact matching on canonical signatures. Two canonical events match iff their encodings are byte identical, which for
 * canonical events is the same as equal strings and equal vectors.
 */
public class SignatureEventMatcher implements EventMatcher {
    public static final SignatureEventMatcher INSTANCE = new SignatureEventMatcher();

    @Override
    public boolean matches(Event modelEvent, Event queryEvent) {
        return modelEvent.sameSignature(queryEvent);
    }
}
