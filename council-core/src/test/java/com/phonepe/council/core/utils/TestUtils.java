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

package com.phonepe.council.core.utils;

import com.github.tomakehurst.wiremock.http.Fault;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.model.ModelUsageStats;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;
import java.util.stream.IntStream;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Helpers shared by tests across modules
 */
@UtilityClass
public class TestUtils {
    public static final String COMPLETIONS_URL = "/chat/completions?api-version=2024-10-21";

    /**
     * Sets up a scenario that replays {@code /wiremock/<prefix>.<n>.txt} as server sent event streams, one file per
     * request
     */
    public static void setupStreamingMocks(int numStates, String prefix, Class<?> clazz) {
        IntStream.rangeClosed(1, numStates)
                .forEach(i -> stubFor(post(COMPLETIONS_URL)
                                              .inScenario("model-test")
                                              .whenScenarioStateIs(i == 1 ? STARTED : Objects.toString(i))
                                              .willReturn(okForContentType("text/event-stream",
                                                                           readStubFile(i, prefix, clazz)))
                                              .willSetStateTo(Objects.toString(i + 1))));
    }

    public static void setupMocksWithFault(Fault fault) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(aResponse()
                                            .withFault(fault)));
    }

    public static void setupMocksWithStatus(int status, String body) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(aResponse()
                                            .withStatus(status)
                                            .withHeader("Content-Type", "application/json")
                                            .withBody(body)));
    }

    @SneakyThrows
    public static String readStubFile(int i, String prefix, Class<?> clazz) {
        return Files.readString(Path.of(Objects.requireNonNull(clazz.getResource(
                "/wiremock/%s.%d.txt".formatted(prefix, i))).toURI()));
    }

    public static ModelRunContext runContext(String agentId, String systemPrompt, ExecutorService executorService) {
        return ModelRunContext.builder()
                .agentId(agentId)
                .sessionId("default")
                .runId(AgentUtils.newRunId())
                .systemPrompt(systemPrompt)
                .executorService(executorService)
                .modelUsageStats(new ModelUsageStats())
                .build();
    }

    public static void assertNoFailedToolCalls(List<AgentMessage> messages) {
        final var failedCall = messages.stream()
                .filter(agentMessage -> agentMessage.getMessageType()
                        .equals(AgentMessageType.TOOL_CALL_RESPONSE_MESSAGE))
                .map(ToolCallResponse.class::cast)
                .filter(Predicate.not(ToolCallResponse::isSuccess))
                .toList();
        assertTrue(failedCall.isEmpty(),
                   "Expected no failed tool calls, but found: " + failedCall.stream()
                           .map(ToolCallResponse::getToolName)
                           .toList());
    }
}
