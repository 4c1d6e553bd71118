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

package com.phonepe.council.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Connection details for an OpenAI compatible endpoint
 */
@Value
@Builder
public class OpenAIProviderConfig {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(120);

    @NonNull
    String apiKey;

    /**
     * Base url. The client appends {@code /v1/chat/completions}. Null for OpenAI.
     */
    String baseUrl;

    /**
     * Extra headers sent with every request. OpenRouter uses {@code HTTP-Referer} and {@code X-Title} for
     * attribution.
     */
    @Builder.Default
    Map<String, String> headers = Map.of();

    @Builder.Default
    Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    /**
     * Maximum wait between two streamed chunks
     */
    @Builder.Default
    Duration readTimeout = DEFAULT_READ_TIMEOUT;
}
