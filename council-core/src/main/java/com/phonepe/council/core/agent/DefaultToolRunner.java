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

package com.phonepe.council.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.primitives.Primitives;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.tools.*;
import com.phonepe.council.core.utils.AgentUtils;
import com.phonepe.council.core.utils.ToolUtils;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs local and remote tools for one turn. Tools run on the calling thread, one at a time. Failures are never
 * thrown, they are converted into a {@link ToolCallResponse} carrying the failure type so that the model can react.
 */
@Value
@Slf4j
public class DefaultToolRunner implements ToolRunner {
    @NonNull
    ModelRunContext context;
    @NonNull
    ObjectMapper mapper;
    @NonNull
    ToolRunApprovalSeeker toolRunApprovalSeeker;

    @Override
    public ToolCallResponse runTool(Map<String, ExecutableTool> tools, ToolCall toolCall) {
        if (!toolRunApprovalSeeker.seekApproval(context, toolCall)) {
            log.info("Tool call {} for tool {} was not approved", toolCall.getToolCallId(), toolCall.getToolName());
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.TOOL_CALL_APPROVAL_DENIED,
                                        "Tool call was not approved by the user",
                                        LocalDateTime.now());
        }
        final var stopwatch = Stopwatch.createStarted();
        final var response = runTool(tools.get(toolCall.getToolName()), toolCall);
        log.debug("Tool call {} [{}] completed in {} ms with status {}",
                  toolCall.getToolCallId(),
                  toolCall.getToolName(),
                  stopwatch.elapsed(TimeUnit.MILLISECONDS),
                  response.getErrorType());
        return response;
    }

    private ToolCallResponse runTool(ExecutableTool tool, ToolCall toolCall) {
        if (null == tool) {
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.TOOL_CALL_PERMANENT_FAILURE,
                                        "Tool call %s failed. Invalid tool: %s"
                                                .formatted(toolCall.getToolCallId(), toolCall.getToolName()),
                                        LocalDateTime.now());
        }
        return tool.accept(new ExecutableToolVisitor<>() {
            @Override
            public ToolCallResponse visit(ExternalTool externalTool) {
                return runExternalTool(externalTool, toolCall);
            }

            @Override
            public ToolCallResponse visit(InternalTool internalTool) {
                return runInternalTool(internalTool, toolCall);
            }
        });
    }

    @SuppressWarnings("java:S3011")
    private ToolCallResponse runInternalTool(InternalTool internalTool, ToolCall toolCall) {
        try {
            final var args = new ArrayList<>();
            if (internalTool.getToolDefinition().isContextAware()) {
                args.add(context);
            }
            args.addAll(ToolUtils.convertToRealParams(internalTool.getMethodInfo(),
                                                      toolCall.getArguments(),
                                                      mapper));
            final var callable = internalTool.getMethodInfo().callable();
            callable.setAccessible(true);
            log.debug("Calling internal tool: {} [{}] Arguments: {}",
                      toolCall.getToolCallId(), toolCall.getToolName(), toolCall.getArguments());
            final var resultObject = callable.invoke(internalTool.getInstance(), args.toArray());
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.SUCCESS,
                                        toStringContent(internalTool, resultObject),
                                        LocalDateTime.now());
        }
        catch (InvocationTargetException e) {
            log.error("Local error making tool call " + toolCall.getToolCallId(), e);
            final var rootCause = AgentUtils.rootCause(e);
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.TOOL_CALL_PERMANENT_FAILURE,
                                        "Tool call local failure: %s".formatted(rootCause.getMessage()),
                                        LocalDateTime.now());
        }
        catch (Exception e) {
            return processUnhandledException(toolCall, e);
        }
    }

    private ToolCallResponse runExternalTool(ExternalTool externalTool, ToolCall toolCall) {
        try {
            log.debug("Calling external tool: {} [{}] Arguments: {}",
                      toolCall.getToolCallId(), toolCall.getToolName(), toolCall.getArguments());
            final var response = externalTool.getCallable()
                    .apply(context, toolCall.getToolName(), toolCall.getArguments());
            log.debug("Tool response: {}", response);
            final var error = Objects.requireNonNullElse(response.error(), ErrorType.SUCCESS);
            if (!error.equals(ErrorType.SUCCESS)) {
                printToolCallError(toolCall, response.response());
                return new ToolCallResponse(
                        toolCall.getToolCallId(),
                        toolCall.getToolName(),
                        error,
                        "Tool call failed. External tool error: %s".formatted(Objects.toString(response.response())),
                        LocalDateTime.now());
            }
            return successResponse(response, toolCall);
        }
        catch (Exception e) {
            return processUnhandledException(toolCall, e);
        }
    }

    /**
     * Returns a temporary failure for unhandled exceptions so the model can decide to call the tool again.
     */
    private static ToolCallResponse processUnhandledException(ToolCall toolCall, Exception e) {
        final var errorMessage = AgentUtils.rootCause(e).getMessage();
        printToolCallError(toolCall, errorMessage);
        if (log.isDebugEnabled()) {
            log.error("Error stacktrace for %s".formatted(toolCall.getToolCallId()), e);
        }
        return new ToolCallResponse(toolCall.getToolCallId(),
                                    toolCall.getToolName(),
                                    ErrorType.TOOL_CALL_TEMPORARY_FAILURE,
                                    "Error running tool: %s".formatted(errorMessage),
                                    LocalDateTime.now());
    }

    private static void printToolCallError(ToolCall toolCall, Object error) {
        log.error("Error calling tool {} -> {}: {}",
                  toolCall.getToolCallId(), toolCall.getToolName(), error);
    }

    private ToolCallResponse successResponse(ExternalTool.ExternalToolResponse response, ToolCall toolCall) {
        final var payload = response.response();
        try {
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.SUCCESS,
                                        payload instanceof String text ? text : mapper.writeValueAsString(payload),
                                        LocalDateTime.now());
        }
        catch (JsonProcessingException e) {
            return new ToolCallResponse(toolCall.getToolCallId(),
                                        toolCall.getToolName(),
                                        ErrorType.SERIALIZATION_ERROR,
                                        "Error serializing external tool response: %s"
                                                .formatted(Objects.toString(payload)),
                                        LocalDateTime.now());
        }
    }

    /**
     * Convert tool response to string to send to LLM. For void return type a fixed success string is sent to LLM.
     */
    @SneakyThrows
    private String toStringContent(InternalTool tool, Object result) {
        final var returnType = tool.getMethodInfo().returnType();
        if (returnType.equals(Void.TYPE)) {
            return "success";
        }
        if (returnType.isAssignableFrom(String.class) || Primitives.isWrapperType(Primitives.wrap(returnType))) {
            return Objects.toString(result);
        }
        return mapper.writeValueAsString(result);
    }
}
