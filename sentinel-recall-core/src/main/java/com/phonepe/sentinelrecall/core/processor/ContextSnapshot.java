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

import com.phonepe.sentinelrecall.core.events.Event;
import com.phonepe.sentinelrecall.core.model.ModelStore;
import lombok.Value;

import java.util.List;

/**
 * Consistent view of a context taken under its lock, used to run a prediction without holding the lock
 */
@Value
public class ContextSnapshot {
    List<Event> workingMemory;
    ProcessorConfig config;
    ModelStore modelStore;
}
