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

import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.ErrorType;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIMessageUtilsTest {

    @Test
    void testConversion() {
        final var converted = OpenAIMessageUtils.convertToOpenAIMessages(
                "Be helpful",
                List.of(new UserPrompt("Weather in Pune?"),
                        new ToolCall("call_1", "weather_get_weather", ""),
                        new ToolCallResponse("call_1", "weather_get_weather", ErrorType.SUCCESS, "Sunny",
                                             LocalDateTime.now()),
                        new Text("It is sunny")));
        assertEquals(5, converted.size());
        assertEquals("Be helpful", ((ChatMessage.SystemMessage) converted.get(0)).getContent());
        assertEquals("Weather in Pune?", ((ChatMessage.UserMessage) converted.get(1)).getContent());

        final var toolCall = ((ChatMessage.AssistantMessage) converted.get(2)).getToolCalls().get(0);
        assertEquals("call_1", toolCall.getId());
        assertEquals("weather_get_weather", toolCall.getFunction().getName());
        assertEquals("{}", toolCall.getFunction().getArguments());

        final var toolMessage = (ChatMessage.ToolMessage) converted.get(3);
        assertEquals("call_1", toolMessage.getToolCallId());
        assertEquals("Sunny", toolMessage.getContent());
        assertEquals("It is sunny", ((ChatMessage.AssistantMessage) converted.get(4)).getContent());
    }

    @Test
    void testBlankSystemPromptIsSkipped() {
        final var converted = OpenAIMessageUtils.convertToOpenAIMessages("  ", List.of(new UserPrompt("Hi")));
        assertEquals(1, converted.size());
        assertInstanceOf(ChatMessage.UserMessage.class, converted.get(0));
    }
}
