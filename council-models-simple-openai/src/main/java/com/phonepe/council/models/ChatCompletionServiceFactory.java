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

/**
 * Returns the {@link ChatCompletionServices} to use for a model name. Lets one process talk to different providers
 * for different models, for example OpenAI for some and OpenRouter for others.
 */
@FunctionalInterface
public interface ChatCompletionServiceFactory {
    ChatCompletionServices get(final String modelName);
}
