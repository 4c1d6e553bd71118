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
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.tools.ExecutableTool;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A model that replays scripted steps. Each step is one model request: either a batch of tool calls or a final
 * text that is streamed word by word. Every request reports 10 input and 5 output tokens.
 */
public class ScriptedModel implements Model {
    public interface Step {
    }

    public record CallTools(List<ToolCall> calls) implements Step {
    }

    public record Reply(String text) implements Step {
    }

    public record Fail(ErrorType errorType, String detail) implements Step {
    }

    private final ConcurrentLinkedQueue<Step> steps;

    /**
     * Messages received for every call, in call order
     */
    @Getter
    private final List<List<AgentMessage>> receivedMessages = new CopyOnWriteArrayList<>();

    @Getter
    private final List<Set<String>> receivedToolIds = new CopyOnWriteArrayList<>();

    @Getter
    private final List<String> receivedSystemPrompts = new CopyOnWriteArrayList<>();

    public ScriptedModel(Step... steps) {
        this.steps = new ConcurrentLinkedQueue<>(List.of(steps));
    }

    public static Step toolCall(String id, String toolName, String arguments) {
        return new CallTools(List.of(new ToolCall(id, toolName, arguments)));
    }

    public static Step reply(String text) {
        return new Reply(text);
    }

    public static Step fail(ErrorType errorType, String detail) {
        return new Fail(errorType, detail);
    }

    @Override
    public CompletableFuture<ModelOutput> exchangeMessagesStreaming(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            Consumer<String> streamHandler) {
        receivedMessages.add(List.copyOf(messages));
        receivedToolIds.add(Set.copyOf(tools.keySet()));
        receivedSystemPrompts.add(context.getSystemPrompt());
        return CompletableFuture.supplyAsync(() -> run(context, messages, tools, toolRunner, streamHandler),
                                             context.getExecutorService());
    }

    private ModelOutput run(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            Consumer<String> streamHandler) {
        final var allMessages = new ArrayList<>(messages);
        final var newMessages = new ArrayList<AgentMessage>();
        final var usage = context.getModelUsageStats();
        final var maxIterations = null == context.getModelSettings()
                                  ? ModelSettings.DEFAULT_MAX_ITERATIONS
                                  : context.getModelSettings().effectiveMaxIterations();
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            final var step = steps.poll();
            if (null == step) {
                return ModelOutput.error(newMessages, allMessages, usage, CouncilError.error(ErrorType.NO_RESPONSE));
            }
            usage.incrementRequestsForRun().incrementRequestTokens(10).incrementResponseTokens(5);
            if (step instanceof Fail failure) {
                return ModelOutput.error(newMessages,
                                         allMessages,
                                         usage,
                                         CouncilError.error(failure.errorType(), failure.detail()));
            }
            if (step instanceof Reply reply) {
                for (final var word : reply.text().split("(?<= )")) {
                    streamHandler.accept(word);
                }
                final var text = new Text(reply.text());
                newMessages.add(text);
                allMessages.add(text);
                return ModelOutput.success(reply.text(), newMessages, allMessages, usage);
            }
            for (final var call : ((CallTools) step).calls()) {
                usage.incrementToolCallsForRun();
                newMessages.add(call);
                allMessages.add(call);
                final var response = toolRunner.runTool(tools, call);
                newMessages.add(response);
                allMessages.add(response);
            }
        }
        return ModelOutput.error(newMessages,
                                 allMessages,
                                 usage,
                                 CouncilError.error(ErrorType.MAX_ITERATIONS_EXCEEDED, maxIterations));
    }
}
