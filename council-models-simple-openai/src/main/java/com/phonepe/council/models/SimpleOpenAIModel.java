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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.council.core.agent.ToolRunner;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.*;
import com.phonepe.council.core.tools.ExecutableTool;
import com.phonepe.council.core.tools.ParameterMapper;
import com.phonepe.council.core.utils.AgentUtils;
import io.github.sashirestela.cleverclient.support.CleverClientException;
import io.github.sashirestela.openai.common.Usage;
import io.github.sashirestela.openai.common.function.FunctionCall;
import io.github.sashirestela.openai.common.tool.Tool;
import io.github.sashirestela.openai.common.tool.ToolChoiceOption;
import io.github.sashirestela.openai.common.tool.ToolType;
import io.github.sashirestela.openai.domain.chat.Chat;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ClassUtils;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static com.phonepe.council.core.utils.AgentUtils.safeGetInt;
import static com.phonepe.council.models.utils.OpenAIMessageUtils.convertIndividualMessageToOpenAIFormat;
import static com.phonepe.council.models.utils.OpenAIMessageUtils.convertToOpenAIMessages;

/**
 * Model implementation based on the SimpleOpenAI client. Works with any OpenAI compatible chat completions endpoint.
 * <p>
 * Please check <a href="https://github.com/sashirestela/simple-openai">Simple OpenAI Repo</a>
 * for details of client usage
 */
@Slf4j
@Getter
public class SimpleOpenAIModel<M extends ChatCompletionServices> implements Model {

    @UtilityClass
    private static final class FinishReasons {
        public static final String STOP = "stop";
        public static final String FUNCTION_CALL = "function_call";
        public static final String TOOL_CALLS = "tool_calls";
        public static final String LENGTH = "length";
        public static final String CONTENT_FILTER = "content_filter";
    }

    /**
     * Everything received for one streamed response
     */
    private static final class StreamedResponse {
        private final StringBuilder content = new StringBuilder();
        private final Map<Integer, io.github.sashirestela.openai.common.tool.ToolCall> toolCallData = new HashMap<>();
        private String finishReason;
        private String refusal;

        List<io.github.sashirestela.openai.common.tool.ToolCall> toolCalls() {
            return toolCallData.values()
                    .stream()
                    .sorted(Comparator.comparing(io.github.sashirestela.openai.common.tool.ToolCall::getIndex))
                    .toList();
        }
    }

    private final String modelName;
    private final ChatCompletionServiceFactory openAIProviderFactory;
    private final ObjectMapper mapper;
    private final ParameterMapper parameterMapper;

    public SimpleOpenAIModel(String modelName, M openAIProvider, ObjectMapper mapper) {
        this(modelName, new DefaultChatCompletionServiceFactory(openAIProvider), mapper);
    }

    public SimpleOpenAIModel(
            final String modelName,
            @NonNull final ChatCompletionServiceFactory openAIProviderFactory,
            @NonNull final ObjectMapper mapper) {
        this.modelName = modelName;
        this.openAIProviderFactory = openAIProviderFactory;
        this.mapper = mapper;
        this.parameterMapper = new ParameterMapper(mapper);
    }

    @Override
    public CompletableFuture<ModelOutput> exchangeMessagesStreaming(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            Consumer<String> streamHandler) {
        final var availableTools = Map.copyOf(Objects.requireNonNullElseGet(tools, Map::<String, ExecutableTool>of));
        return CompletableFuture.supplyAsync(
                () -> runLoop(context, messages, availableTools, toolRunner, streamHandler),
                context.getExecutorService());
    }

    private ModelOutput runLoop(
            ModelRunContext context,
            List<AgentMessage> messages,
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            Consumer<String> streamHandler) {
        final var modelSettings = context.getModelSettings();
        final var maxIterations = null == modelSettings
                                  ? ModelSettings.DEFAULT_MAX_ITERATIONS
                                  : modelSettings.effectiveMaxIterations();
        //Augmented with tool calls and reused across all iterations
        final var openAiMessages = new ArrayList<>(convertToOpenAIMessages(context.getSystemPrompt(), messages));
        final var allMessages = new ArrayList<>(messages);
        final var newMessages = new ArrayList<AgentMessage>();
        final var stats = context.getModelUsageStats();

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            final var stopwatch = Stopwatch.createStarted();
            final var request = toChatRequest(openAiMessages, modelSettings, tools);
            stats.incrementRequestsForRun();
            logModelRequest(request);
            final StreamedResponse response;
            try {
                response = readStream(openAIProviderFactory.get(modelName)
                                              .chatCompletions()
                                              .createStream(request)
                                              .join(),
                                      stats,
                                      streamHandler);
            }
            catch (Exception e) {
                return errorToModelOutput(e, newMessages, allMessages, stats);
            }
            log.debug("Model {} responded in {} ms with finish reason {}",
                      modelName, stopwatch.elapsed(TimeUnit.MILLISECONDS), response.finishReason);
            final var finishReason = Strings.isNullOrEmpty(response.finishReason)
                                     ? inferFinishReason(response)
                                     : response.finishReason;
            if (null == finishReason) {
                return ModelOutput.error(newMessages, allMessages, stats, CouncilError.error(ErrorType.NO_RESPONSE));
            }
            switch (finishReason) {
                case FinishReasons.STOP -> {
                    if (!Strings.isNullOrEmpty(response.refusal)) {
                        return ModelOutput.error(newMessages,
                                                 allMessages,
                                                 stats,
                                                 CouncilError.error(ErrorType.REFUSED, response.refusal));
                    }
                    //Some providers finish with stop even when they ask for tools
                    if (response.toolCallData.isEmpty()) {
                        return processOutput(response.content.toString(), newMessages, allMessages, stats);
                    }
                    handleToolCalls(tools, toolRunner, response, openAiMessages, allMessages, newMessages, stats);
                }
                case FinishReasons.FUNCTION_CALL, FinishReasons.TOOL_CALLS -> {
                    if (response.toolCallData.isEmpty()) {
                        return ModelOutput.error(newMessages,
                                                 allMessages,
                                                 stats,
                                                 CouncilError.error(ErrorType.NO_RESPONSE));
                    }
                    handleToolCalls(tools, toolRunner, response, openAiMessages, allMessages, newMessages, stats);
                }
                case FinishReasons.LENGTH -> {
                    return ModelOutput.error(newMessages,
                                             allMessages,
                                             stats,
                                             CouncilError.error(ErrorType.LENGTH_EXCEEDED));
                }
                case FinishReasons.CONTENT_FILTER -> {
                    return ModelOutput.error(newMessages,
                                             allMessages,
                                             stats,
                                             CouncilError.error(ErrorType.FILTERED));
                }
                default -> {
                    return ModelOutput.error(newMessages,
                                             allMessages,
                                             stats,
                                             CouncilError.error(ErrorType.UNKNOWN_FINISH_REASON, finishReason));
                }
            }
        }
        log.warn("Model {} did not finish within {} iterations", modelName, maxIterations);
        return ModelOutput.error(newMessages,
                                 allMessages,
                                 stats,
                                 CouncilError.error(ErrorType.MAX_ITERATIONS_EXCEEDED, maxIterations));
    }

    /**
     * Consumes the whole stream. Usage arrives in the last chunk, so the stream must not be cut short even after the
     * finish reason has been received.
     */
    private StreamedResponse readStream(
            Stream<Chat> chunks,
            ModelUsageStats stats,
            Consumer<String> streamHandler) {
        final var response = new StreamedResponse();
        chunks.forEach(chunk -> {
            logModelResponse(chunk);
            mergeUsage(stats, chunk.getUsage());
            final var choice = extractResponse(chunk);
            if (null == choice) {
                return;
            }
            final var message = choice.getMessage();
            if (null != message) {
                if (!Strings.isNullOrEmpty(message.getContent())) {
                    response.content.append(message.getContent());
                    streamHandler.accept(message.getContent());
                }
                if (!Strings.isNullOrEmpty(message.getRefusal())) {
                    response.refusal = Strings.nullToEmpty(response.refusal) + message.getRefusal();
                }
                // Tool calls arrive as fragments keyed by index, pieces of name and arguments need to be joined
                Objects.requireNonNullElseGet(message.getToolCalls(),
                                              List::<io.github.sashirestela.openai.common.tool.ToolCall>of)
                        .forEach(call -> response.toolCallData.compute(
                                Objects.requireNonNullElse(call.getIndex(), 0),
                                (idx, existing) -> mergeToolCallFragment(existing, call)));
            }
            if (!Strings.isNullOrEmpty(choice.getFinishReason())) {
                response.finishReason = choice.getFinishReason();
            }
        });
        return response;
    }

    /**
     * Some OpenAI compatible servers close the stream without sending a finish reason
     */
    private static String inferFinishReason(StreamedResponse response) {
        if (!response.toolCallData.isEmpty()) {
            return FinishReasons.TOOL_CALLS;
        }
        if (!response.content.isEmpty()) {
            return FinishReasons.STOP;
        }
        return null;
    }

    private ModelOutput processOutput(
            String content,
            List<AgentMessage> newMessages,
            List<AgentMessage> allMessages,
            ModelUsageStats stats) {
        if (Strings.isNullOrEmpty(content)) {
            return ModelOutput.error(newMessages, allMessages, stats, CouncilError.error(ErrorType.NO_RESPONSE));
        }
        final var text = new Text(content);
        allMessages.add(text);
        newMessages.add(text);
        return ModelOutput.success(content, newMessages, allMessages, stats);
    }

    /**
     * Runs the requested tools one at a time in the order the model listed them. Text sent along with the tool calls
     * is kept as a message of its own.
     */
    @SuppressWarnings("java:S107")
    private void handleToolCalls(
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            StreamedResponse response,
            List<ChatMessage> openAiMessages,
            List<AgentMessage> allMessages,
            List<AgentMessage> newMessages,
            ModelUsageStats stats) {
        if (!response.content.isEmpty()) {
            final var text = new Text(response.content.toString());
            openAiMessages.add(convertIndividualMessageToOpenAIFormat(text));
            allMessages.add(text);
            newMessages.add(text);
        }
        for (final var call : response.toolCalls()) {
            final var function = Objects.requireNonNullElseGet(call.getFunction(), FunctionCall::new);
            final var toolCallMessage = new ToolCall(
                    Strings.isNullOrEmpty(call.getId()) ? "call_" + AgentUtils.newRunId() : call.getId(),
                    Strings.nullToEmpty(function.getName()),
                    Strings.isNullOrEmpty(function.getArguments()) ? "{}" : function.getArguments());
            final var toolCallResponse = callTool(tools, toolRunner, toolCallMessage);
            if (toolCallResponse.isSuccess()) {
                log.debug("Tool call {} Successful. Name: {} Arguments: {} Response: {}",
                          toolCallMessage.getToolCallId(),
                          toolCallMessage.getToolName(),
                          toolCallMessage.getArguments(),
                          toolCallResponse.getResponse());
            }
            else {
                log.error("Tool call {} Failed. Name: {} Arguments: {} Error: {} -> {}",
                          toolCallMessage.getToolCallId(),
                          toolCallMessage.getToolName(),
                          toolCallMessage.getArguments(),
                          toolCallResponse.getErrorType(),
                          toolCallResponse.getResponse());
            }
            openAiMessages.add(convertIndividualMessageToOpenAIFormat(toolCallMessage));
            openAiMessages.add(convertIndividualMessageToOpenAIFormat(toolCallResponse));
            allMessages.add(toolCallMessage);
            newMessages.add(toolCallMessage);
            allMessages.add(toolCallResponse);
            newMessages.add(toolCallResponse);
            stats.incrementToolCallsForRun();
        }
    }

    private static ToolCallResponse callTool(
            Map<String, ExecutableTool> tools,
            ToolRunner toolRunner,
            ToolCall toolCallMessage) {
        return null != toolRunner
               ? toolRunner.runTool(tools, toolCallMessage)
               : new ToolCallResponse(toolCallMessage.getToolCallId(),
                                      toolCallMessage.getToolName(),
                                      ErrorType.TOOL_CALL_PERMANENT_FAILURE,
                                      "Tool runner not provided for tool call %s[%s]"
                                              .formatted(toolCallMessage.getToolCallId(),
                                                         toolCallMessage.getToolName()),
                                      LocalDateTime.now());
    }

    private static ModelOutput errorToModelOutput(
            final Throwable error,
            final List<AgentMessage> newMessages,
            final List<AgentMessage> allMessages,
            final ModelUsageStats stats) {
        final var rootCause = AgentUtils.rootCause(error);
        log.error("Error calling model: %s -> %s".formatted(
                          rootCause.getClass().getSimpleName(), rootCause.getMessage()),
                  error);
        // OkHttp raises a variety of IOExceptions for network issues
        if (ClassUtils.isAssignable(rootCause.getClass(), IOException.class)) {
            return errorOutput(newMessages, allMessages, stats, ErrorType.MODEL_CALL_COMMUNICATION_ERROR,
                               rootCause.getMessage());
        }
        final var clientException = findClientException(error);
        if (null != clientException) {
            return clientException.responseInfo()
                    .map(responseInfo -> {
                        final var message = Objects.requireNonNullElse(responseInfo.getData(),
                                                                       clientException.getMessage());
                        return responseInfo.getStatusCode() == 429
                               ? errorOutput(newMessages, allMessages, stats,
                                             ErrorType.MODEL_CALL_RATE_LIMIT_EXCEEDED, message)
                               : errorOutput(newMessages, allMessages, stats,
                                             ErrorType.MODEL_CALL_HTTP_FAILURE,
                                             "Received HTTP error: [%d] %s".formatted(responseInfo.getStatusCode(),
                                                                                      message));
                    })
                    .orElseGet(() -> errorOutput(newMessages, allMessages, stats,
                                                 ErrorType.GENERIC_MODEL_CALL_FAILURE,
                                                 clientException.getMessage()));
        }
        return errorOutput(newMessages, allMessages, stats, ErrorType.GENERIC_MODEL_CALL_FAILURE,
                           rootCause.getMessage());
    }

    private static CleverClientException findClientException(Throwable error) {
        var current = error;
        while (null != current) {
            if (current instanceof CleverClientException clientException) {
                return clientException;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ModelOutput errorOutput(
            final List<AgentMessage> newMessages,
            final List<AgentMessage> allMessages,
            final ModelUsageStats stats,
            final ErrorType errorType,
            final String message) {
        return ModelOutput.error(newMessages, allMessages, stats, CouncilError.error(errorType, message));
    }

    private static Chat.Choice extractResponse(Chat completionResponse) {
        return Objects.requireNonNullElseGet(completionResponse.getChoices(), List::<Chat.Choice>of)
                .stream()
                .findFirst()
                .orElse(null);
    }

    private static io.github.sashirestela.openai.common.tool.ToolCall mergeToolCallFragment(
            io.github.sashirestela.openai.common.tool.ToolCall existing,
            io.github.sashirestela.openai.common.tool.ToolCall call) {
        if (null == existing) {
            final var function = Objects.requireNonNullElseGet(call.getFunction(), FunctionCall::new);
            return new io.github.sashirestela.openai.common.tool.ToolCall(
                    Objects.requireNonNullElse(call.getIndex(), 0),
                    call.getId(),
                    Objects.requireNonNullElse(call.getType(), ToolType.FUNCTION),
                    new FunctionCall(function.getName(), function.getArguments()));
        }
        final var id = !Strings.isNullOrEmpty(call.getId())
                       ? call.getId()
                       : existing.getId();
        final var function = existing.getFunction();
        if (null != call.getFunction()) {
            final var name = call.getFunction().getName();
            if (!Strings.isNullOrEmpty(name)) {
                function.setName(Strings.nullToEmpty(function.getName()) + name);
            }
            final var arguments = call.getFunction().getArguments();
            if (!Strings.isNullOrEmpty(arguments)) {
                function.setArguments(Strings.nullToEmpty(function.getArguments()) + arguments);
            }
        }
        return new io.github.sashirestela.openai.common.tool.ToolCall(
                existing.getIndex(),
                id,
                existing.getType(),
                function);
    }

    public static void mergeUsage(ModelUsageStats stats, Usage usage) {
        if (null != usage) {
            stats.incrementRequestTokens(safeGetInt(usage::getPromptTokens))
                    .incrementResponseTokens(safeGetInt(usage::getCompletionTokens))
                    .incrementTotalTokens(safeGetInt(usage::getTotalTokens));
            final var promptTokensDetails = usage.getPromptTokensDetails();
            if (promptTokensDetails != null) {
                stats.getRequestTokenDetails()
                        .incrementCachedTokens(safeGetInt(promptTokensDetails::getCachedTokens));
            }
            final var completionTokensDetails = usage.getCompletionTokensDetails();
            if (completionTokensDetails != null) {
                stats.getResponseTokenDetails()
                        .incrementReasoningTokens(safeGetInt(completionTokensDetails::getReasoningTokens));
            }
        }
    }

    private ChatRequest toChatRequest(
            final List<ChatMessage> openAiMessages,
            final ModelSettings modelSettings,
            final Map<String, ExecutableTool> tools) {
        final var builder = ChatRequest.builder()
                .messages(openAiMessages)
                .model(modelName)
                .n(1);
        applyModelSettings(modelSettings, builder, tools);
        if (!tools.isEmpty()) {
            builder.tools(tools.values()
                                  .stream()
                                  .sorted(Comparator.comparing(tool -> tool.getToolDefinition().getId()))
                                  .map(tool -> {
                                      final var toolDefinition = tool.getToolDefinition();
                                      return new Tool(
                                              ToolType.FUNCTION,
                                              new Tool.ToolFunctionDef(toolDefinition.getId(),
                                                                       toolDefinition.getDescription(),
                                                                       tool.accept(parameterMapper),
                                                                       toolDefinition.isStrictSchema()));
                                  })
                                  .toList());
            // Some models do not like tool_choice being sent without tools
            builder.toolChoice(ToolChoiceOption.AUTO);
        }
        return builder.build();
    }

    private static void applyModelSettings(
            ModelSettings modelSettings,
            ChatRequest.ChatRequestBuilder builder,
            Map<String, ExecutableTool> tools) {
        if (null == modelSettings) {
            log.debug("No model settings provided");
            return;
        }
        if (modelSettings.getMaxTokens() != null) {
            builder.maxCompletionTokens(modelSettings.getMaxTokens());
        }
        if (modelSettings.getTemperature() != null) {
            builder.temperature(Double.valueOf(modelSettings.getTemperature()));
        }
        if (modelSettings.getTopP() != null) {
            builder.topP(Double.valueOf(modelSettings.getTopP()));
        }
        if (!tools.isEmpty() && modelSettings.getParallelToolCalls() != null) {
            builder.parallelToolCalls(modelSettings.getParallelToolCalls());
        }
        if (modelSettings.getSeed() != null) {
            builder.seed(modelSettings.getSeed());
        }
        if (modelSettings.getFrequencyPenalty() != null) {
            builder.frequencyPenalty(Double.valueOf(modelSettings.getFrequencyPenalty()));
        }
        if (modelSettings.getPresencePenalty() != null) {
            builder.presencePenalty(Double.valueOf(modelSettings.getPresencePenalty()));
        }
    }

    private void logModelRequest(Object node) {
        logDataDebug("Request to model: {}", node);
    }

    private void logModelResponse(Object node) {
        if (log.isTraceEnabled()) {
            try {
                log.trace("Response chunk from model: {}", mapper.writeValueAsString(node));
            }
            catch (JsonProcessingException e) {
                log.trace("Could not serialize response chunk: {}", e.getMessage());
            }
        }
    }

    private void logDataDebug(String fmtStr, Object node) {
        if (log.isDebugEnabled()) {
            try {
                log.debug(fmtStr, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node));
            }
            catch (JsonProcessingException e) {
                log.debug("Could not serialize model payload: {}", e.getMessage());
            }
        }
    }
}
