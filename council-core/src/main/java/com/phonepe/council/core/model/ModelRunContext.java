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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.concurrent.ExecutorService;

/**
 * A context object passed to the model and to context aware tools at runtime.
 */
@Value
@Builder
public class ModelRunContext {
    /**
     * Agent the turn is being run for
     */
    @NonNull
    String agentId;

    /**
     * Session the turn belongs to
     */
    @NonNull
    String sessionId;

    /**
     * An id for this particular run. This is used to track the run in logs
     */
    @NonNull
    String runId;

    /**
     * Instructions (system prompt) for the model
     */
    String systemPrompt;

    ModelSettings modelSettings;

    /**
     * Executor on which the model loop runs
     */
    @NonNull
    ExecutorService executorService;

    /**
     * Usage stats for this run
     */
    @NonNull
    ModelUsageStats modelUsageStats;
}
