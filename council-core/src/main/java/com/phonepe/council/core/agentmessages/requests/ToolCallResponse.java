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

package com.phonepe.council.core.agentmessages.requests;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.AgentMessageVisitor;
import com.phonepe.council.core.agentmessages.MessageRole;
import com.phonepe.council.core.errors.ErrorType;
import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Response for a tool run. A denied approval is recorded with {@link ErrorType#TOOL_CALL_APPROVAL_DENIED}.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCallResponse extends AgentMessage {

    /**
     * Tool call ID as received from the LLM
     */
    String toolCallId;

    /**
     * Name of the tool that was called
     */
    String toolName;

    /**
     * Outcome of the run
     */
    ErrorType errorType;

    /**
     * Serialized response that was sent to model
     */
    String response;

    LocalDateTime sentAt;

    @Builder
    @Jacksonized
    public ToolCallResponse(
            @NonNull String toolCallId,
            @NonNull String toolName,
            ErrorType errorType,
            @NonNull String response,
            LocalDateTime sentAt) {
        super(AgentMessageType.TOOL_CALL_RESPONSE_MESSAGE);
        this.toolCallId = toolCallId;
        this.toolName = toolName;
        this.errorType = Objects.requireNonNullElse(errorType, ErrorType.SUCCESS);
        this.response = response;
        this.sentAt = Objects.requireNonNullElseGet(sentAt, LocalDateTime::now);
    }

    @Override
    public MessageRole role() {
        return MessageRole.TOOL;
    }

    @Override
    public <T> T accept(AgentMessageVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return errorType == ErrorType.SUCCESS;
    }
}
