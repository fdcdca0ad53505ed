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

package com.phonepe.sentinelrecall.core.memory;

import com.google.common.base.Preconditions;
import com.phonepe.sentinelrecall.core.events.Event;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Ordered buffer of events observed since the last clear.
 * <p>
 * When a capacity is set the oldest events are evicted to make room. A capacity of 0 means unbounded.
 * Not thread safe, callers guard it with the lock of the owning processor context.
 */
public class WorkingMemory {
    private final Deque<Event> events = new ArrayDeque<>();
    private int capacity;

    public WorkingMemory() {
        this(0);
    }

    public WorkingMemory(int capacity) {
        Preconditions.checkArgument(capacity >= 0, "Capacity cannot be negative");
        this.capacity = capacity;
    }

    public void append(final Event event) {
        Preconditions.checkNotNull(event, "Event cannot be null");
        events.addLast(event);
        evict();
    }

    /**
     * @return immutable copy of the buffer in append order
     */
    public List<Event> snapshot() {
        return List.copyOf(events);
    }

    /**
     * Last {@code count} events, oldest first
     */
    public List<Event> tail(int count) {
        final var all = snapshot();
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    /**
     * Replaces the whole buffer. Capacity still applies.
     */
    public void reset(final List<Event> retained) {
        events.clear();
        events.addAll(retained);
        evict();
    }

    public void clear() {
        events.clear();
    }

    public void setCapacity(int capacity) {
        Preconditions.checkArgument(capacity >= 0, "Capacity cannot be negative");
        this.capacity = capacity;
        evict();
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    private void evict() {
        if (capacity <= 0) {
            return;
        }
        while (events.size() > capacity) {
            events.pollFirst();
        }
    }
}
