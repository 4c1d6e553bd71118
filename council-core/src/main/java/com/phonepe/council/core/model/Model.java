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

import com.phonepe.council.core.agent.ToolRunner;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.tools.ExecutableTool;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Abstract representation for a LLM model.
 * <p>
 * Implementations drive the tool calling loop: they send the messages and tools to the model, run requested tools
 * through the provided {@link ToolRunner}, feed results back, and finish once the model produces a response without
 * tool calls or {@link ModelSettings#effectiveMaxIterations()} requests have been made.
 */
public interface Model {

    /**
     * Runs the loop, passing text to the stream handler as it is generated.
     *
     * @param context       Run context. Carries instructions, settings and the executor to run on
     * @param messages      Conversation so far, oldest first
     * @param tools         Tools available for this turn keyed by advertised id
     * @param toolRunner    Runner to execute tool calls with
     * @param streamHandler Receives text chunks as they arrive
     * @return Final output. Failures are reported in {@link ModelOutput#getError()} rather than by failing the future
     */
    CompletableFuture<ModelOutput> exchangeMessagesStreaming(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            Consumer<String> streamHandler);

    /**
     * Same as {@link #exchangeMessagesStreaming} but without streaming
     */
    default CompletableFuture<ModelOutput> exchangeMessages(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner) {
        return exchangeMessagesStreaming(context, messages, tools, toolRunner, chunk -> {});
    }
}
