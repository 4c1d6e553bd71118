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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.tools.ExternalTool;
import com.phonepe.council.core.tools.RemoteToolConnection;
import com.phonepe.council.core.tools.ToolDefinition;
import com.phonepe.council.core.utils.AgentUtils;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * An initialized MCP client along with the tools it advertised when the connection was opened
 */
@Slf4j
public class MCPToolConnection implements RemoteToolConnection {
    private final String serverId;
    private final McpSyncClient client;
    private final ObjectMapper mapper;
    private final Map<String, ExternalTool> tools;

    public MCPToolConnection(
            String serverId,
            McpSyncClient client,
            List<McpSchema.Tool> advertisedTools,
            ObjectMapper mapper) {
        this.serverId = serverId;
        this.client = client;
        this.mapper = mapper;
        final var converted = new LinkedHashMap<String, ExternalTool>();
        advertisedTools.forEach(tool -> converted.putIfAbsent(tool.name(), toExternalTool(tool)));
        this.tools = Collections.unmodifiableMap(converted);
    }

    @Override
    public String serverId() {
        return serverId;
    }

    @Override
    public Map<String, ExternalTool> tools() {
        return tools;
    }

    @Override
    public void close() {
        log.debug("Closing MCP connection to server {}", serverId);
        client.close();
    }

    private ExternalTool toExternalTool(McpSchema.Tool tool) {
        final var toolName = tool.name();
        return new ExternalTool(
                ToolDefinition.builder()
                        .id(toolName)
                        .name(toolName)
                        .description(Objects.requireNonNullElse(tool.description(), toolName))
                        .contextAware(false)
                        // Many MCP servers do not list every property as required, which strict mode demands
                        .strictSchema(false)
                        .build(),
                mapper.valueToTree(tool.inputSchema()),
                (context, advertisedId, args) -> callTool(context, toolName, args));
    }

    private ExternalTool.ExternalToolResponse callTool(ModelRunContext context, String toolName, String args) {
        log.debug("Calling MCP tool {} on server {} for run {} with args: {}",
                  toolName, serverId, null != context ? context.getRunId() : null, args);
        try {
            final var result = client.callTool(
                    new McpSchema.CallToolRequest(toolName, AgentUtils.isBlank(args) ? "{}" : args));
            final var text = toText(result.content());
            if (Boolean.TRUE.equals(result.isError())) {
                log.warn("MCP tool {} on server {} returned an error: {}", toolName, serverId, text);
                return new ExternalTool.ExternalToolResponse(text, ErrorType.TOOL_CALL_TEMPORARY_FAILURE);
            }
            return new ExternalTool.ExternalToolResponse(text, ErrorType.SUCCESS);
        }
        catch (Exception e) {
            final var message = AgentUtils.rootCause(e).getMessage();
            log.error("Error calling MCP tool {} on server {}: {}", toolName, serverId, message);
            return new ExternalTool.ExternalToolResponse("Error processing request: " + message,
                                                         ErrorType.TOOL_CALL_TEMPORARY_FAILURE);
        }
    }

    private String toText(List<McpSchema.Content> content) throws JsonProcessingException {
        if (null == content || content.isEmpty()) {
            return "";
        }
        final var parts = new ArrayList<String>();
        for (final var item : content) {
            if (item instanceof McpSchema.TextContent textContent) {
                parts.add(textContent.text());
            }
            else {
                parts.add(mapper.writeValueAsString(item));
            }
        }
        return String.join("\n", parts);
    }
}
