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

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ModelUsageStatsMergeTest {

    @Test
    void mergeWithNullDoesNotChangeState() {
        final var base = new ModelUsageStats()
                .incrementRequestsForRun(5)
                .incrementToolCallsForRun(2)
                .incrementRequestTokens(30)
                .incrementResponseTokens(40)
                .incrementTotalTokens(70);
        base.getResponseTokenDetails().incrementReasoningTokens(4);

        final var ret = base.merge(null);

        assertAll(
                () -> assertSame(base, ret),
                () -> assertEquals(5, base.getRequestsForRun()),
                () -> assertEquals(2, base.getToolCallsForRun()),
                () -> assertEquals(30, base.getRequestTokens()),
                () -> assertEquals(40, base.getResponseTokens()),
                () -> assertEquals(70, base.getTotalTokens()),
                () -> assertEquals(4, base.getResponseTokenDetails().getReasoningTokens()));
    }

    @Test
    void mergeAddsAllCounters() {
        final var base = new ModelUsageStats()
                .incrementRequestsForRun(1)
                .incrementRequestTokens(10)
                .incrementResponseTokens(20)
                .incrementTotalTokens(30);
        final var other = new ModelUsageStats()
                .incrementRequestsForRun(2)
                .incrementToolCallsForRun(3)
                .incrementRequestTokens(1)
                .incrementResponseTokens(2)
                .incrementTotalTokens(3);
        other.getRequestTokenDetails().incrementCachedTokens(6);
        other.getResponseTokenDetails().incrementReasoningTokens(8);

        base.merge(other);

        assertAll(
                () -> assertEquals(3, base.getRequestsForRun()),
                () -> assertEquals(3, base.getToolCallsForRun()),
                () -> assertEquals(11, base.getRequestTokens()),
                () -> assertEquals(22, base.getResponseTokens()),
                () -> assertEquals(33, base.getTotalTokens()),
                () -> assertEquals(6, base.getRequestTokenDetails().getCachedTokens()),
                () -> assertEquals(8, base.getResponseTokenDetails().getReasoningTokens()));
    }

    @Test
    void concurrentIncrementsAreNotLost() throws InterruptedException {
        final var stats = new ModelUsageStats();
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 1000; i++) {
                executor.submit(() -> stats.incrementRequestTokens(1).incrementTotalTokens(2));
            }
        }
        finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1000, stats.getRequestTokens());
        assertEquals(2000, stats.getTotalTokens());
    }

    @Test
    void toSessionUsageFallsBackToInputPlusOutput() {
        final var stats = new ModelUsageStats()
                .incrementRequestTokens(12)
                .incrementResponseTokens(5);
        stats.getResponseTokenDetails().incrementReasoningTokens(2);
        final var usage = stats.toSessionUsage();
        assertEquals(12, usage.getInputTokens());
        assertEquals(5, usage.getOutputTokens());
        assertEquals(2, usage.getReasoningTokens());
        assertEquals(17, usage.getTotalTokens());

        stats.incrementTotalTokens(20);
        assertEquals(20, stats.toSessionUsage().getTotalTokens());
    }
}
