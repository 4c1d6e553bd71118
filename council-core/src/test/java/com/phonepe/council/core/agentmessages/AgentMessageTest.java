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

import com.fasterxml.jackson.core.type.TypeReference;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentMessageTest {

    @Test
    @SneakyThrows
    void testTranscriptKeepsTypesAndOrder() {
        final var mapper = JsonUtils.createMapper();
        final List<AgentMessage> transcript = List.of(
                new UserPrompt("What is the weather in Pune?"),
                new ToolCall("call_1", "weather_get_forecast", "{\"city\":\"Pune\"}"),
                new ToolCallResponse("call_1", "weather_get_forecast", null, "Sunny", null),
                new Text("It is sunny in Pune"));

        final var json = mapper.writeValueAsString(transcript);
        final var read = mapper.readValue(json, new TypeReference<List<AgentMessage>>() {});

        assertEquals(transcript, read);
        assertEquals(List.of(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL, MessageRole.ASSISTANT),
                     read.stream().map(AgentMessage::role).toList());
        final var toolResponse = (ToolCallResponse) read.get(2);
        assertEquals(ErrorType.SUCCESS, toolResponse.getErrorType());
        assertTrue(toolResponse.isSuccess());
    }
}
