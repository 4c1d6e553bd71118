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

package com.phonepe.council.core.model;

import com.phonepe.council.core.agent.SessionUsage;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Model usage for a run. Counters are thread safe.
 */
@NoArgsConstructor
@ToString
@EqualsAndHashCode
public class ModelUsageStats {

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    @ToString
    @EqualsAndHashCode
    public static class PromptTokenDetails {
        private final AtomicInteger cachedTokens = new AtomicInteger(0);

        public int getCachedTokens() {
            return cachedTokens.get();
        }

        public PromptTokenDetails incrementCachedTokens(int value) {
            cachedTokens.addAndGet(value);
            return this;
        }
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    @ToString
    @EqualsAndHashCode
    public static class ResponseTokenDetails {
        private final AtomicInteger reasoningTokens = new AtomicInteger(0);

        public int getReasoningTokens() {
            return reasoningTokens.get();
        }

        public ResponseTokenDetails incrementReasoningTokens(int value) {
            reasoningTokens.addAndGet(value);
            return this;
        }
    }

    private final AtomicInteger requestsForRun = new AtomicInteger(0);
    private final AtomicInteger toolCallsForRun = new AtomicInteger(0);
    private final AtomicInteger requestTokens = new AtomicInteger(0);
    private final AtomicInteger responseTokens = new AtomicInteger(0);
    private final AtomicInteger totalTokens = new AtomicInteger(0);
    @Getter
    private final PromptTokenDetails requestTokenDetails = new PromptTokenDetails();
    @Getter
    private final ResponseTokenDetails responseTokenDetails = new ResponseTokenDetails();

    public int getRequestTokens() {
        return requestTokens.get();
    }

    public int getRequestsForRun() {
        return requestsForRun.get();
    }

    public int getResponseTokens() {
        return responseTokens.get();
    }

    public int getToolCallsForRun() {
        return toolCallsForRun.get();
    }

    public int getTotalTokens() {
        return totalTokens.get();
    }

    public ModelUsageStats incrementRequestTokens(int value) {
        this.requestTokens.addAndGet(value);
        return this;
    }

    public ModelUsageStats incrementRequestsForRun() {
        return incrementRequestsForRun(1);
    }

    public ModelUsageStats incrementRequestsForRun(int value) {
        this.requestsForRun.addAndGet(value);
        return this;
    }

    public ModelUsageStats incrementResponseTokens(int value) {
        this.responseTokens.addAndGet(value);
        return this;
    }

    public ModelUsageStats incrementToolCallsForRun() {
        return incrementToolCallsForRun(1);
    }

    public ModelUsageStats incrementToolCallsForRun(int value) {
        this.toolCallsForRun.addAndGet(value);
        return this;
    }

    public ModelUsageStats incrementTotalTokens(int value) {
        this.totalTokens.addAndGet(value);
        return this;
    }

    public ModelUsageStats merge(final ModelUsageStats other) {
        if (null == other) {
            return this;
        }
        this.requestTokenDetails.incrementCachedTokens(other.getRequestTokenDetails().getCachedTokens());
        this.responseTokenDetails.incrementReasoningTokens(other.getResponseTokenDetails().getReasoningTokens());
        return this.incrementRequestsForRun(other.getRequestsForRun())
                .incrementToolCallsForRun(other.getToolCallsForRun())
                .incrementRequestTokens(other.getRequestTokens())
                .incrementResponseTokens(other.getResponseTokens())
                .incrementTotalTokens(other.getTotalTokens());
    }

    /**
     * Converts to session counters. Providers that do not report a total get input + output.
     */
    public SessionUsage toSessionUsage() {
        final long input = getRequestTokens();
        final long output = getResponseTokens();
        final long total = getTotalTokens() > 0 ? getTotalTokens() : input + output;
        return SessionUsage.builder()
                .inputTokens(input)
                .reasoningTokens(responseTokenDetails.getReasoningTokens())
                .outputTokens(output)
                .totalTokens(total)
                .build();
    }
}
