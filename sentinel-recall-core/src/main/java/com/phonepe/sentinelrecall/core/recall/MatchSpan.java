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

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Half open range {@code [start, end)} of model positions
 */
@Value
public class MatchSpan {
    int start;
    int end;

    public MatchSpan(int start, int end) {
        Preconditions.checkArgument(0 <= start && start <= end, "Invalid span [%s, %s)", start, end);
        this.start = start;
        this.end = end;
    }

    public static MatchSpan empty() {
        return new MatchSpan(0, 0);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}
