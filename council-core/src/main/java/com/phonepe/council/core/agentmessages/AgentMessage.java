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

package com.phonepe.council.core.agentmessages;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single entry in a session transcript. Messages are exchanged between the user, the model and tools and are
 * stored in the order they were produced.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "messageType")
@JsonSubTypes(
        {
                //User/tools -> LLM
                @JsonSubTypes.Type(name = "USER_PROMPT_REQUEST_MESSAGE", value = UserPrompt.class),
                @JsonSubTypes.Type(name = "TOOL_CALL_RESPONSE_MESSAGE", value = ToolCallResponse.class),

                //LLM -> Agent
                @JsonSubTypes.Type(name = "TEXT_RESPONSE_MESSAGE", value = Text.class),
                @JsonSubTypes.Type(name = "TOOL_CALL_REQUEST_MESSAGE", value = ToolCall.class),
        }
)
public abstract class AgentMessage {
    private final AgentMessageType messageType;

    public abstract MessageRole role();

    public abstract <T> T accept(AgentMessageVisitor<T> visitor);
}
