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
import lombok.Value;
import lombok.With;

import java.util.Objects;

/**
 * Settings to change behaviour for model
 */
@Value
@Builder
@With
public class ModelSettings {
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    /**
     * Maximum number of tokens to generate
     */
    Integer maxTokens;

    /**
     * Amount of randomness to inject in output. Varies from model to model. Lower generally means more predictable
     * output
     */
    Float temperature;

    /**
     * Nucleus sampling mass. Alter either this or temperature, not both.
     */
    Float topP;

    /**
     * Whether the model may request multiple tool calls in one response. Calls are still run one at a time.
     */
    Boolean parallelToolCalls;

    /**
     * Seed for random number generator. Can be used to make output more predictable.
     */
    Integer seed;

    Float presencePenalty;

    Float frequencyPenalty;

    /**
     * Maximum number of requests made to the model in one turn. A turn that has not produced a final text response
     * by then fails.
     */
    Integer maxIterations;

    public int effectiveMaxIterations() {
        final var configured = Objects.requireNonNullElse(maxIterations, DEFAULT_MAX_ITERATIONS);
        return configured > 0 ? configured : DEFAULT_MAX_ITERATIONS;
    }
}
