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

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.council.core.agent.DefaultToolRunner;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.agentmessages.responses.ToolCall;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.ModelOutput;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.model.ModelSettings;
import com.phonepe.council.core.model.ModelUsageStats;
import com.phonepe.council.core.tools.Tool;
import com.phonepe.council.core.tools.ToolBox;
import com.phonepe.council.core.tools.ToolRunApprovalSeeker;
import com.phonepe.council.core.utils.JsonUtils;
import com.phonepe.council.core.utils.TestUtils;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.openai.SimpleOpenAIAzure;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the tool calling loop of {@link SimpleOpenAIModel} against recorded event streams
 */
@WireMockTest
class SimpleOpenAIModelTest {
    private static final String SYSTEM_PROMPT = "You are a weather assistant";

    public static class WeatherToolBox implements ToolBox {
        @Override
        public String name() {
            return "weather";
        }

        @Tool("Get current weather for a city")
        public String getWeather(@JsonPropertyDescription("City name") String city) {
            return "Sunny in " + city;
        }
    }

    private final ObjectMapper mapper = JsonUtils.createMapper();
    private ExecutorService executorService;

    @BeforeEach
    void setup() {
        executorService = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testToolCallThenReply(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupStreamingMocks(2, "weather", getClass());
        final var chunks = Collections.synchronizedList(new ArrayList<String>());
        final var context = TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService);

        final var output = run(wiremock, new OkHttpClient(), context, chunks::add);

        assertTrue(output.isSuccess(), () -> output.getError().getMessage());
        assertEquals("It is sunny in Pune.", output.getData());
        assertEquals(output.getData(), String.join("", chunks));
        assertEquals(List.of(AgentMessageType.TOOL_CALL_REQUEST_MESSAGE,
                             AgentMessageType.TOOL_CALL_RESPONSE_MESSAGE,
                             AgentMessageType.TEXT_RESPONSE_MESSAGE),
                     output.getNewMessages().stream().map(AgentMessage::getMessageType).toList());
        TestUtils.assertNoFailedToolCalls(output.getNewMessages());

        final var call = (ToolCall) output.getNewMessages().get(0);
        assertEquals("call_1", call.getToolCallId());
        assertEquals("weather_get_weather", call.getToolName());
        assertEquals("{\"city\":\"Pune\"}", call.getArguments());
        final var callResponse = (ToolCallResponse) output.getNewMessages().get(1);
        assertEquals("call_1", callResponse.getToolCallId());
        assertEquals("Sunny in Pune", callResponse.getResponse());

        assertEquals(4, output.getAllMessages().size());
        assertInstanceOf(UserPrompt.class, output.getAllMessages().get(0));

        final var usage = context.getModelUsageStats();
        assertEquals(2, usage.getRequestsForRun());
        assertEquals(1, usage.getToolCallsForRun());
        assertEquals(130, usage.getRequestTokens());
        assertEquals(18, usage.getResponseTokens());
        assertEquals(148, usage.getTotalTokens());
        assertEquals(3, usage.getResponseTokenDetails().getReasoningTokens());

        verify(2, postRequestedFor(urlEqualTo(TestUtils.COMPLETIONS_URL)));
        verify(postRequestedFor(urlEqualTo(TestUtils.COMPLETIONS_URL))
                       .withRequestBody(containing(SYSTEM_PROMPT))
                       .withRequestBody(containing("weather_get_weather")));
        verify(postRequestedFor(urlEqualTo(TestUtils.COMPLETIONS_URL))
                       .withRequestBody(containing("call_1"))
                       .withRequestBody(containing("Sunny in Pune")));
    }

    @Test
    void testLengthExceeded(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupStreamingMocks(1, "length", getClass());
        final var output = run(wiremock,
                               new OkHttpClient(),
                               TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService),
                               chunk -> {});
        assertFalse(output.isSuccess());
        assertEquals(ErrorType.LENGTH_EXCEEDED, output.getError().getErrorType());
        assertTrue(output.getNewMessages().isEmpty());
    }

    @Test
    void testMaxIterations(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupStreamingMocks(2, "loop", getClass());
        final var context = ModelRunContext.builder()
                .agentId("weather-agent")
                .sessionId("default")
                .runId("loop-run")
                .systemPrompt(SYSTEM_PROMPT)
                .modelSettings(ModelSettings.builder().maxIterations(2).build())
                .executorService(executorService)
                .modelUsageStats(new ModelUsageStats())
                .build();
        final var output = run(wiremock, new OkHttpClient(), context, chunk -> {});

        assertFalse(output.isSuccess());
        assertEquals(ErrorType.MAX_ITERATIONS_EXCEEDED, output.getError().getErrorType());
        //Interim text is kept along with both rounds of tool calls
        assertEquals(6, output.getNewMessages().size());
        assertEquals("Checking. ", ((Text) output.getNewMessages().get(0)).getContent());
        assertEquals("call_b", ((ToolCall) output.getNewMessages().get(4)).getToolCallId());
        assertEquals(2, context.getModelUsageStats().getToolCallsForRun());
        verify(2, postRequestedFor(urlEqualTo(TestUtils.COMPLETIONS_URL)));
    }

    @Test
    void testTimeout(final WireMockRuntimeInfo wiremock) {
        stubFor(post(TestUtils.COMPLETIONS_URL)
                        .willReturn(aResponse()
                                            .withStatus(200)
                                            .withFixedDelay(1000)));
        final var httpClient = new OkHttpClient.Builder()
                .readTimeout(Duration.ofMillis(100))
                .build();
        final var output = run(wiremock,
                               httpClient,
                               TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService),
                               chunk -> {});
        assertSame(ErrorType.MODEL_CALL_COMMUNICATION_ERROR, output.getError().getErrorType());
    }

    @Test
    void testConnectionReset(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupMocksWithFault(Fault.CONNECTION_RESET_BY_PEER);
        final var output = run(wiremock,
                               new OkHttpClient(),
                               TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService),
                               chunk -> {});
        assertSame(ErrorType.MODEL_CALL_COMMUNICATION_ERROR, output.getError().getErrorType());
    }

    @Test
    void testRateLimited(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupMocksWithStatus(429, "{\"error\": {\"message\": \"Slow down\"}}");
        final var output = run(wiremock,
                               new OkHttpClient(),
                               TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService),
                               chunk -> {});
        assertSame(ErrorType.MODEL_CALL_RATE_LIMIT_EXCEEDED, output.getError().getErrorType());
    }

    @Test
    void testServerError(final WireMockRuntimeInfo wiremock) {
        TestUtils.setupMocksWithStatus(500, "{\"error\": {\"message\": \"Boom\"}}");
        final var output = run(wiremock,
                               new OkHttpClient(),
                               TestUtils.runContext("weather-agent", SYSTEM_PROMPT, executorService),
                               chunk -> {});
        assertSame(ErrorType.MODEL_CALL_HTTP_FAILURE, output.getError().getErrorType());
        assertTrue(output.getError().getMessage().contains("[500]"));
    }

    private ModelOutput run(
            WireMockRuntimeInfo wiremock,
            OkHttpClient httpClient,
            ModelRunContext context,
            Consumer<String> streamHandler) {
        final var model = new SimpleOpenAIModel<>(
                "gpt-4o",
                SimpleOpenAIAzure.builder()
                        .baseUrl(wiremock.getHttpBaseUrl())
                        .apiKey("BLAH")
                        .apiVersion("2024-10-21")
                        .objectMapper(mapper)
                        .clientAdapter(new OkHttpClientAdapter(httpClient))
                        .build(),
                mapper);
        final var tools = new WeatherToolBox().tools();
        return model.exchangeMessagesStreaming(
                        context,
                        List.of(new UserPrompt("How is the weather in Pune?")),
                        tools,
                        new DefaultToolRunner(context, mapper, ToolRunApprovalSeeker.approveAll()),
                        streamHandler)
                .join();
    }
}
