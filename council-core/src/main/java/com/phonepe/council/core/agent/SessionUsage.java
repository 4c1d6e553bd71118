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

package com.phonepe.council.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Token usage counters for a session, or the delta produced by one turn
 */
@Value
@Builder
@With
@Jacksonized
public class SessionUsage {
    public static final SessionUsage ZERO = new SessionUsage(0, 0, 0, 0);

    long inputTokens;
    long reasoningTokens;
    long outputTokens;
    long totalTokens;

    public SessionUsage add(final SessionUsage delta) {
        if (null == delta) {
            return this;
        }
        return new SessionUsage(inputTokens + delta.inputTokens,
                                reasoningTokens + delta.reasoningTokens,
                                outputTokens + delta.outputTokens,
                                totalTokens + delta.totalTokens);
    }

    @JsonIgnore
    public boolean hasNegativeCounter() {
        return inputTokens < 0 || reasoningTokens < 0 || outputTokens < 0 || totalTokens < 0;
    }
}
