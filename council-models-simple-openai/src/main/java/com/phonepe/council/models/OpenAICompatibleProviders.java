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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.openai.SimpleOpenAI;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.Map;
import java.util.Objects;

/**
 * Builds clients for OpenAI compatible endpoints (OpenAI, OpenRouter, vLLM and the like)
 */
@UtilityClass
@Slf4j
public class OpenAICompatibleProviders {

    public static SimpleOpenAI create(@NonNull OpenAIProviderConfig config, @NonNull ObjectMapper mapper) {
        final var extraHeaders = Map.copyOf(Objects.requireNonNullElseGet(config.getHeaders(),
                                                                          Map::<String, String>of));
        final var httpClient = new OkHttpClient.Builder()
                .connectTimeout(Objects.requireNonNullElse(config.getConnectTimeout(),
                                                           OpenAIProviderConfig.DEFAULT_CONNECT_TIMEOUT))
                .readTimeout(Objects.requireNonNullElse(config.getReadTimeout(),
                                                        OpenAIProviderConfig.DEFAULT_READ_TIMEOUT))
                .addInterceptor(chain -> {
                    final var request = chain.request().newBuilder();
                    extraHeaders.forEach(request::header);
                    return chain.proceed(request.build());
                })
                .build();
        final var builder = SimpleOpenAI.builder()
                .apiKey(config.getApiKey())
                .objectMapper(mapper)
                .clientAdapter(new OkHttpClientAdapter(httpClient));
        if (!Strings.isNullOrEmpty(config.getBaseUrl())) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.info("Created OpenAI compatible provider for {} with extra headers {}",
                 Objects.requireNonNullElse(config.getBaseUrl(), "default endpoint"),
                 extraHeaders.keySet());
        return builder.build();
    }
}
