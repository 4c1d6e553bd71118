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

package com.phonepe.council.agents;

import com.phonepe.council.agentmemory.AgentMemory;
import com.phonepe.council.agentmemory.InMemoryMemoryIndex;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.agent.SessionUsage;
import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.requests.ToolCallResponse;
import com.phonepe.council.core.agentmessages.requests.UserPrompt;
import com.phonepe.council.core.agentmessages.responses.Text;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorCategory;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.Model;
import com.phonepe.council.core.model.ModelSettings;
import com.phonepe.council.core.model.ScriptedModel;
import com.phonepe.council.core.tools.RemoteToolConnection;
import com.phonepe.council.core.tools.RemoteToolConnector;
import com.phonepe.council.core.utils.JsonUtils;
import com.phonepe.council.core.utils.TestUtils;
import com.phonepe.council.session.AgentStore;
import com.phonepe.council.session.BootstrapPromptLoader;
import com.phonepe.council.session.InMemoryDataStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversationDriverTest {
    private static final String BOOTSTRAP = "You are a member of the council.";

    @TempDir
    Path baseDir;

    private AgentStore store;
    private ExecutorService executorService;
    private RemoteToolConnector connector;

    @BeforeEach
    void setup() throws Exception {
        Files.writeString(baseDir.resolve("bootstrap.md"), BOOTSTRAP);
        store = AgentStore.builder()
                .dataStore(new InMemoryDataStore())
                .mapper(JsonUtils.createMapper())
                .bootstrapPromptLoader(new BootstrapPromptLoader(baseDir))
                .build();
        store.createAgent("scout", "Scout");
        executorService = Executors.newCachedThreadPool();
        connector = mock(RemoteToolConnector.class);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testTurnWithLocalTool() {
        final var model = new ScriptedModel(
                ScriptedModel.toolCall("c1", "agent_update_system_prompt", "{\"systemPrompt\": \"Be terse\"}"),
                ScriptedModel.reply("Done, I will be terse."));
        final var chunks = Collections.synchronizedList(new ArrayList<String>());
        final var output = driver(model, false)
                .converse(request("scout", null, "  Please be terse  "), chunks::add)
                .join();

        assertEquals("scout", output.getAgentId());
        assertEquals("default", output.getSessionId());
        assertEquals("Done, I will be terse.", output.getData());
        assertEquals(output.getData(), String.join("", chunks));
        assertTrue(output.isStreamDelivered());
        assertEquals("Be terse", store.getSystemPrompt("scout"));

        //Model saw the persisted prompt and the instructions as they were at the start of the turn
        final var seen = model.getReceivedMessages().get(0);
        assertEquals(1, seen.size());
        assertEquals("Please be terse", ((UserPrompt) seen.get(0)).getContent());
        assertEquals(BOOTSTRAP, model.getReceivedSystemPrompts().get(0));
        assertTrue(model.getReceivedToolIds().get(0).contains("memory_append"));

        final var transcript = store.getMessages("scout", "default");
        assertEquals(List.of(AgentMessageType.USER_PROMPT_REQUEST_MESSAGE,
                             AgentMessageType.TOOL_CALL_REQUEST_MESSAGE,
                             AgentMessageType.TOOL_CALL_RESPONSE_MESSAGE,
                             AgentMessageType.TEXT_RESPONSE_MESSAGE),
                     transcript.stream().map(AgentMessage::getMessageType).toList());
        TestUtils.assertNoFailedToolCalls(transcript);
        assertEquals(3, output.getNewMessages().size());

        //Scripted model reports 10 input and 5 output tokens per request
        final var expected = usage(20, 10, 30);
        assertEquals(expected, output.getUsage());
        assertEquals(expected, output.getSessionUsage());
        assertEquals(expected, store.getUsage("scout", "default"));
    }

    @Test
    void testUsageAccumulatesAcrossTurns() {
        final var driver = driver(new ScriptedModel(ScriptedModel.reply("one"), ScriptedModel.reply("two")), false);
        driver.converse(request("scout", "s1", "first")).join();
        final var second = driver.converse(request("scout", "s1", "second")).join();
        assertEquals(usage(20, 10, 30), second.getSessionUsage());
        assertEquals(4, store.getMessages("scout", "s1").size());
        assertEquals(SessionUsage.ZERO, store.getUsage("scout", "default"));
    }

    @Test
    void testValidation() {
        final var model = new ScriptedModel(ScriptedModel.reply("never"));
        final var driver = driver(model, false);
        assertFailure(ErrorType.INVALID_INPUT, () -> driver.converse(request(" ", null, "hi")).join());
        assertFailure(ErrorType.INVALID_INPUT, () -> driver.converse(request("scout", null, "  ")).join());
        assertFailure(ErrorType.NOT_FOUND, () -> driver.converse(request("ghost", null, "hi")).join());
        assertTrue(store.getMessages("scout", "default").isEmpty());
        assertFalse(store.agentExists("ghost"));
        assertTrue(model.getReceivedMessages().isEmpty());
    }

    @Test
    void testModelFailureKeepsOnlyUserMessage() {
        final var model = new ScriptedModel(
                ScriptedModel.toolCall("c1", "agent_list_agents", "{}"),
                ScriptedModel.fail(ErrorType.MODEL_CALL_HTTP_FAILURE, "Received HTTP error: [502] Bad gateway"));
        final var error = assertFailure(ErrorType.MODEL_CALL_HTTP_FAILURE,
                                        () -> driver(model, false).converse(request("scout", null, "hi")).join());
        assertEquals(ErrorCategory.UPSTREAM, error.getCategory());
        final var transcript = store.getMessages("scout", "default");
        assertEquals(1, transcript.size());
        assertInstanceOf(UserPrompt.class, transcript.get(0));
        assertEquals(SessionUsage.ZERO, store.getUsage("scout", "default"));
    }

    @Test
    void testMaxIterations() {
        final var model = new ScriptedModel(
                ScriptedModel.toolCall("c1", "agent_list_agents", "{}"),
                ScriptedModel.toolCall("c2", "agent_list_agents", "{}"),
                ScriptedModel.reply("too late"));
        final var driver = ConversationDriver.builder()
                .agentStore(store)
                .toolRegistry(registry())
                .model(model)
                .mapper(JsonUtils.createMapper())
                .modelSettings(ModelSettings.builder().maxIterations(2).build())
                .executorService(executorService)
                .build();
        assertFailure(ErrorType.MAX_ITERATIONS_EXCEEDED,
                      () -> driver.converse(request("scout", null, "loop")).join());
        assertEquals(1, store.getMessages("scout", "default").size());
    }

    @Test
    void testBrokenStreamStillPersists() {
        final var model = new ScriptedModel(ScriptedModel.reply("Saved even if nobody listens"));
        final var received = new ArrayList<String>();
        final var output = driver(model, false)
                .converse(request("scout", null, "hello"), chunk -> {
                    received.add(chunk);
                    throw new IllegalStateException("Client went away");
                })
                .join();
        assertFalse(output.isStreamDelivered());
        assertEquals(1, received.size());
        assertEquals("Saved even if nobody listens", output.getData());
        assertEquals(2, store.getMessages("scout", "default").size());
    }

    @Test
    void testRemoteToolsAreUsedAndClosed() {
        store.addServer("scout", RemoteToolServerConfig.builder()
                .id("search1")
                .name("Search")
                .url("http://localhost:8931/mcp")
                .build());
        final var connection = mock(RemoteToolConnection.class);
        when(connection.serverId()).thenReturn("search1");
        when(connection.tools()).thenReturn(Map.of("lookup", ToolRegistryTest.tool("lookup")));
        when(connector.connect(any())).thenReturn(connection);

        final var model = new ScriptedModel(ScriptedModel.toolCall("c1", "search1__lookup", "{\"q\":\"weather\"}"),
                                            ScriptedModel.reply("Found it"));
        final var output = driver(model, false).converse(request("scout", null, "search")).join();

        assertEquals("Found it", output.getData());
        assertTrue(model.getReceivedToolIds().get(0).contains("search1__lookup"));
        final var toolResponse = (ToolCallResponse) output.getNewMessages().get(1);
        assertTrue(toolResponse.isSuccess());
        assertEquals("lookup handled {\"q\":\"weather\"}", toolResponse.getResponse());
        verify(connection).close();
    }

    @Test
    void testDiscoveryFailureSkipsModel() {
        store.addServer("scout", RemoteToolServerConfig.builder()
                .id("down")
                .name("Down")
                .url("http://localhost:1/mcp")
                .build());
        when(connector.connect(any()))
                .thenThrow(CouncilException.of(ErrorType.TOOL_DISCOVERY_FAILURE, "down", "Connection refused"));
        final var model = new ScriptedModel(ScriptedModel.reply("unused"));
        final var error = assertFailure(ErrorType.TOOL_DISCOVERY_FAILURE,
                                        () -> driver(model, false).converse(request("scout", null, "hi")).join());
        assertEquals(ErrorCategory.UPSTREAM, error.getCategory());
        assertTrue(model.getReceivedMessages().isEmpty());
        assertEquals(1, store.getMessages("scout", "default").size());
    }

    @Test
    void testModelThrowingOnStartClosesTools() {
        store.addServer("scout", RemoteToolServerConfig.builder()
                .id("search1")
                .name("Search")
                .url("http://localhost:8931/mcp")
                .build());
        final var connection = mock(RemoteToolConnection.class);
        when(connection.serverId()).thenReturn("search1");
        when(connection.tools()).thenReturn(Map.of("lookup", ToolRegistryTest.tool("lookup")));
        when(connector.connect(any())).thenReturn(connection);
        final Model model = (context, messages, tools, toolRunner, streamHandler) -> {
            throw new IllegalStateException("model rejected request");
        };

        final var error = assertFailure(ErrorType.GENERIC_MODEL_CALL_FAILURE,
                                        () -> driver(model, false).converse(request("scout", null, "hi")).join());
        assertEquals(ErrorCategory.UPSTREAM, error.getCategory());
        assertTrue(error.getMessage().contains("model rejected request"));
        verify(connection).close();
        assertEquals(1, store.getMessages("scout", "default").size());
        assertEquals(SessionUsage.ZERO, store.getUsage("scout", "default"));
    }

    @Test
    void testSerializedTurnsDoNotInterleave() {
        final var driver = driver(new ScriptedModel(ScriptedModel.reply("first answer"),
                                                    ScriptedModel.reply("second answer")),
                                  true);
        final var first = driver.converse(request("scout", "s1", "first question"));
        final var second = driver.converse(request("scout", "s1", "second question"));
        second.join();
        first.join();
        final var contents = store.getMessages("scout", "s1")
                .stream()
                .map(message -> message instanceof UserPrompt prompt
                                ? prompt.getContent()
                                : ((Text) message).getContent())
                .toList();
        assertEquals(List.of("first question", "first answer", "second question", "second answer"), contents);
    }

    private ConversationDriver driver(Model model, boolean serialize) {
        return ConversationDriver.builder()
                .agentStore(store)
                .toolRegistry(registry())
                .model(model)
                .mapper(JsonUtils.createMapper())
                .executorService(executorService)
                .serializeSessionTurns(serialize)
                .build();
    }

    private ToolRegistry registry() {
        return new ToolRegistry(store,
                                connector,
                                new AgentMemory(new InMemoryMemoryIndex()),
                                executorService,
                                Duration.ofSeconds(5));
    }

    private static SessionUsage usage(long input, long output, long total) {
        return SessionUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(total)
                .build();
    }

    private static TurnRequest request(String agentId, String sessionId, String content) {
        return TurnRequest.builder()
                .agentId(agentId)
                .sessionId(sessionId)
                .content(content)
                .build();
    }

    private static CouncilException assertFailure(ErrorType errorType, Runnable call) {
        final var error = assertThrows(CompletionException.class, call::run);
        final var cause = assertInstanceOf(CouncilException.class, error.getCause());
        assertEquals(errorType, cause.getErrorType());
        return cause;
    }
}
