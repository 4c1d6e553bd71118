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

import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Providers registered against model names, with an optional default for everything else.
 */
@NoArgsConstructor
public class DefaultChatCompletionServiceFactory implements ChatCompletionServiceFactory {
    private final AtomicReference<ChatCompletionServices> defaultProvider = new AtomicReference<>();
    private final Map<String, ChatCompletionServices> providers = new ConcurrentHashMap<>();

    public DefaultChatCompletionServiceFactory(@NonNull final ChatCompletionServices defaultProvider) {
        this.defaultProvider.set(defaultProvider);
    }

    /**
     * Provider registered for the model, or the default one
     *
     * @throws NullPointerException if nothing is registered for the model and there is no default
     */
    @Override
    public ChatCompletionServices get(String modelName) {
        return Objects.requireNonNull(providers.getOrDefault(modelName, defaultProvider.get()),
                                      "No ChatCompletionServices provider found for model name: " + modelName);
    }

    public DefaultChatCompletionServiceFactory registerDefaultProvider(
            @NonNull final ChatCompletionServices defaultProvider) {
        this.defaultProvider.set(defaultProvider);
        return this;
    }

    public DefaultChatCompletionServiceFactory registerProvider(
            @NonNull final String name,
            @NonNull final ChatCompletionServices provider) {
        this.providers.put(name, provider);
        return this;
    }
}
