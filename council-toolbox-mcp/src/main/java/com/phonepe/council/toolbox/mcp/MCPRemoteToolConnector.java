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
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.tools.RemoteToolConnection;
import com.phonepe.council.core.tools.RemoteToolConnector;
import com.phonepe.council.core.utils.AgentUtils;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Connects to MCP servers over streamable HTTP or SSE. Every connection is a fresh client that is initialized and
 * whose full tool catalogue is read before it is handed out.
 */
@Slf4j
public class MCPRemoteToolConnector implements RemoteToolConnector {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final int MAX_TOOL_PAGES = 50;

    private final ObjectMapper mapper;
    private final MCPClientFactory clientFactory;

    public MCPRemoteToolConnector(@NonNull ObjectMapper mapper) {
        this(mapper, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    public MCPRemoteToolConnector(
            @NonNull ObjectMapper mapper,
            @NonNull Duration connectTimeout,
            @NonNull Duration requestTimeout) {
        this(mapper, config -> McpClient.sync(MCPTransports.transport(config, mapper, connectTimeout))
                .requestTimeout(requestTimeout)
                .initializationTimeout(requestTimeout)
                .build());
    }

    public MCPRemoteToolConnector(@NonNull ObjectMapper mapper, @NonNull MCPClientFactory clientFactory) {
        this.mapper = mapper;
        this.clientFactory = clientFactory;
    }

    @Override
    public RemoteToolConnection connect(RemoteToolServerConfig config) {
        log.debug("Connecting to MCP server {} at {} over {}", config.getId(), config.getUrl(), config.getTransport());
        McpSyncClient client = null;
        try {
            client = clientFactory.create(config);
            client.initialize();
            final var tools = listTools(client);
            log.info("Loaded {} tools from MCP server {}", tools.size(), config.getId());
            return new MCPToolConnection(config.getId(), client, tools, mapper);
        }
        catch (CouncilException e) {
            closeAfterFailure(config, client);
            throw e;
        }
        catch (Exception e) {
            closeAfterFailure(config, client);
            final var message = AgentUtils.rootCause(e).getMessage();
            log.error("Could not connect to MCP server {}: {}", config.getId(), message);
            throw new CouncilException(CouncilError.error(ErrorType.TOOL_DISCOVERY_FAILURE, config.getId(), message),
                                       e);
        }
    }

    private static List<McpSchema.Tool> listTools(McpSyncClient client) {
        final var tools = new ArrayList<McpSchema.Tool>();
        final var seenCursors = new HashSet<String>();
        String cursor = null;
        for (int page = 0; page < MAX_TOOL_PAGES; page++) {
            final var result = client.listTools(cursor);
            if (null != result.tools()) {
                tools.addAll(result.tools());
            }
            cursor = result.nextCursor();
            if (AgentUtils.isBlank(cursor) || !seenCursors.add(cursor)) {
                break;
            }
        }
        return tools;
    }

    private static void closeAfterFailure(RemoteToolServerConfig config, McpSyncClient client) {
        if (null == client) {
            return;
        }
        try {
            client.close();
        }
        catch (Exception e) {
            log.warn("Error closing MCP client for server {}: {}", config.getId(), AgentUtils.rootCause(e).getMessage());
        }
    }
}
