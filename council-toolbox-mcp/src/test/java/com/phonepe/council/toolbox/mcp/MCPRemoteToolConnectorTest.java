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

package com.phonepe.council.toolbox.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorCategory;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.utils.JsonUtils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests {@link MCPRemoteToolConnector} and {@link MCPToolConnection} against a mocked client
 */
class MCPRemoteToolConnectorTest {
    private static final ObjectMapper MAPPER = JsonUtils.createMapper();

    private static final RemoteToolServerConfig CONFIG = RemoteToolServerConfig.builder()
            .id("weather")
            .name("Weather")
            .url("http://localhost:3001/mcp")
            .build();

    @SneakyThrows
    private static McpSchema.ListToolsResult toolsPage(String json) {
        return MAPPER.readValue(json, McpSchema.ListToolsResult.class);
    }

    @SneakyThrows
    private static McpSchema.CallToolResult callResult(String json) {
        return MAPPER.readValue(json, McpSchema.CallToolResult.class);
    }

    @Test
    void testConnectReadsAllPages() {
        final var client = mock(McpSyncClient.class);
        when(client.listTools(isNull())).thenReturn(toolsPage("""
                {"tools":[{"name":"get-forecast","description":"Forecast for a city",
                           "inputSchema":{"type":"object","properties":{"city":{"type":"string"}}}}],
                 "nextCursor":"page2"}
                """));
        when(client.listTools("page2")).thenReturn(toolsPage("""
                {"tools":[{"name":"alerts","inputSchema":{"type":"object"}}]}
                """));
        final var connector = new MCPRemoteToolConnector(MAPPER, config -> client);
        try (final var connection = connector.connect(CONFIG)) {
            assertEquals("weather", connection.serverId());
            assertEquals(List.of("get-forecast", "alerts"), List.copyOf(connection.tools().keySet()));
            final var forecast = connection.tools().get("get-forecast");
            assertEquals("Forecast for a city", forecast.getToolDefinition().getDescription());
            assertFalse(forecast.getToolDefinition().isStrictSchema());
            assertEquals("string", forecast.getParameterSchema().at("/properties/city/type").asText());
            assertEquals("alerts", connection.tools().get("alerts").getToolDefinition().getDescription());
        }
        verify(client).initialize();
        verify(client).close();
    }

    @Test
    void testCallToolMapsResults() {
        final var client = mock(McpSyncClient.class);
        when(client.listTools(isNull())).thenReturn(toolsPage("""
                {"tools":[{"name":"echo","inputSchema":{"type":"object"}}]}
                """));
        when(client.callTool(any()))
                .thenReturn(callResult("""
                        {"content":[{"type":"text","text":"Echo: hi"},{"type":"text","text":"done"}],"isError":false}
                        """))
                .thenReturn(callResult("""
                        {"content":[{"type":"text","text":"bad city"}],"isError":true}
                        """))
                .thenThrow(new IllegalStateException("connection reset"));
        final var connector = new MCPRemoteToolConnector(MAPPER, config -> client);
        try (final var connection = connector.connect(CONFIG)) {
            final var echo = connection.tools().get("echo").withId("weather__echo");
            final var success = echo.getCallable().apply(null, "weather__echo", "{\"message\":\"hi\"}");
            assertEquals(ErrorType.SUCCESS, success.error());
            assertEquals("Echo: hi\ndone", success.response());

            final var toolError = echo.getCallable().apply(null, "weather__echo", "{}");
            assertEquals(ErrorType.TOOL_CALL_TEMPORARY_FAILURE, toolError.error());
            assertEquals("bad city", toolError.response());

            final var failure = echo.getCallable().apply(null, "weather__echo", "");
            assertEquals(ErrorType.TOOL_CALL_TEMPORARY_FAILURE, failure.error());
            assertTrue(failure.response().toString().contains("connection reset"));
        }
        verify(client, times(3)).callTool(argThat(request -> request.name().equals("echo")));
    }

    @Test
    void testInitializeFailureClosesClient() {
        final var client = mock(McpSyncClient.class);
        when(client.initialize()).thenThrow(new RuntimeException("Connection refused"));
        final var connector = new MCPRemoteToolConnector(MAPPER, config -> client);
        final var error = assertThrows(CouncilException.class, () -> connector.connect(CONFIG));
        assertEquals(ErrorType.TOOL_DISCOVERY_FAILURE, error.getErrorType());
        assertEquals(ErrorCategory.UPSTREAM, error.getCategory());
        assertTrue(error.getMessage().contains("weather"));
        assertTrue(error.getMessage().contains("Connection refused"));
        verify(client).close();
        verify(client, never()).listTools(any());
    }

    @Test
    void testRepeatedCursorStopsPaging() {
        final var client = mock(McpSyncClient.class);
        when(client.listTools(isNull())).thenReturn(toolsPage("""
                {"tools":[{"name":"a","inputSchema":{"type":"object"}}],"nextCursor":"again"}
                """));
        when(client.listTools("again")).thenReturn(toolsPage("""
                {"tools":[{"name":"b","inputSchema":{"type":"object"}}],"nextCursor":"again"}
                """));
        final var connector = new MCPRemoteToolConnector(MAPPER, config -> client);
        try (final var connection = connector.connect(CONFIG)) {
            assertEquals(List.of("a", "b"), List.copyOf(connection.tools().keySet()));
        }
        verify(client, times(1)).listTools("again");
    }
}
