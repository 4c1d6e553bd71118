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

package com.phonepe.council.models.utils;

import com.google.common.base.Strings;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageVisitor;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import io.github.sashirestela.openai.common.function.FunctionCall;
import io.github.sashirestela.openai.common.tool.ToolType;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@UtilityClass
public class OpenAIMessageUtils {
    /**
     * Converts a transcript to OpenAI messages. The system prompt, when present, goes first.
     *
     * @param systemPrompt  Instructions for the model. Skipped when blank.
     * @param agentMessages Transcript, oldest first
     * @return List of OpenAI messages
     */
    public static List<ChatMessage> convertToOpenAIMessages(String systemPrompt, List<AgentMessage> agentMessages) {
        final var converted = new ArrayList<ChatMessage>();
        if (!Strings.isNullOrEmpty(systemPrompt) && !systemPrompt.isBlank()) {
            converted.add(ChatMessage.SystemMessage.of(systemPrompt));
        }
        Objects.requireNonNullElseGet(agentMessages, List::<AgentMessage>of)
                .stream()
                .map(OpenAIMessageUtils::convertIndividualMessageToOpenAIFormat)
                .forEach(converted::add);
        return converted;
    }

    public static ChatMessage convertIndividualMessageToOpenAIFormat(AgentMessage agentMessage) {
        return agentMessage.accept(new AgentMessageVisitor<>() {
            @Override
            public ChatMessage visit(UserPrompt userPrompt) {
                return ChatMessage.UserMessage.of(userPrompt.getContent());
            }

            @Override
            public ChatMessage visit(ToolCallResponse toolCallResponse) {
                return ChatMessage.ToolMessage.of(toolCallResponse.getResponse(), toolCallResponse.getToolCallId());
            }

            @Override
            public ChatMessage visit(Text text) {
                return ChatMessage.AssistantMessage.of(text.getContent());
            }

            @Override
            public ChatMessage visit(ToolCall toolCall) {
                final var arguments = Strings.isNullOrEmpty(toolCall.getArguments()) ? "{}" : toolCall.getArguments();
                return ChatMessage.AssistantMessage.of(List.of(new io.github.sashirestela.openai.common.tool.ToolCall(
                        0,
                        toolCall.getToolCallId(),
                        ToolType.FUNCTION,
                        new FunctionCall(toolCall.getToolName(), arguments))));
            }
        });
    }
}
