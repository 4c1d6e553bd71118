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
import com.phonepe.council.agents.tools.AgentToolBox;
import com.phonepe.council.agents.tools.MemoryToolBox;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.tools.ExecutableTool;
import com.phonepe.council.core.tools.RemoteToolConnection;
import com.phonepe.council.core.tools.RemoteToolConnector;
import com.phonepe.council.core.utils.AgentUtils;
import com.phonepe.council.session.AgentStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the tool set for a turn. Local tools are always present. Every enabled remote server of the agent is
 * connected to concurrently and its tools are registered under {@code <server scope>__<tool name>}.
 * If any server cannot be reached the whole assembly fails and nothing stays open.
 */
@Slf4j
public class ToolRegistry {
    public static final String SCOPE_SEPARATOR = "__";
    public static final Duration DEFAULT_DISCOVERY_TIMEOUT = Duration.ofSeconds(15);

    private final AgentStore agentStore;
    private final RemoteToolConnector remoteToolConnector;
    private final AgentMemory agentMemory;
    private final ExecutorService executorService;
    private final Duration discoveryTimeout;

    public ToolRegistry(
            @NonNull AgentStore agentStore,
            @NonNull RemoteToolConnector remoteToolConnector,
            AgentMemory agentMemory,
            @NonNull ExecutorService executorService,
            Duration discoveryTimeout) {
        this.agentStore = agentStore;
        this.remoteToolConnector = remoteToolConnector;
        this.agentMemory = agentMemory;
        this.executorService = executorService;
        this.discoveryTimeout = null == discoveryTimeout || discoveryTimeout.isNegative() || discoveryTimeout.isZero()
                                ? DEFAULT_DISCOVERY_TIMEOUT
                                : discoveryTimeout;
    }

    /**
     * Scope prefix for tools of a server. Distinct ids always give distinct scopes.
     */
    public static String scope(String serverId) {
        return AgentUtils.uniqueSanitizedName(serverId);
    }

    public static String scopedToolName(String serverId, String toolName) {
        return scope(serverId) + SCOPE_SEPARATOR + AgentUtils.sanitizeName(toolName);
    }

    /**
     * Local tools that do not need any connection
     */
    public Map<String, ExecutableTool> localTools() {
        final var tools = new HashMap<>(new AgentToolBox(agentStore).tools());
        if (null != agentMemory) {
            tools.putAll(new MemoryToolBox(agentMemory).tools());
        }
        return tools;
    }

    /**
     * Assembles the tools for one turn of the agent. The caller must close the returned object.
     *
     * @param agentId Agent the turn is for
     * @return Tools and the connections backing them
     * @throws CouncilException with {@link ErrorType#TOOL_DISCOVERY_FAILURE} if any enabled server fails
     */
    public TurnTools assemble(String agentId) {
        final var tools = new LinkedHashMap<>(localTools());
        final var servers = agentStore.listServers(agentId)
                .stream()
                .filter(RemoteToolServerConfig::isEnabled)
                .toList();
        if (servers.isEmpty()) {
            return new TurnTools(tools, List.of(), executorService);
        }
        final var connections = connectAll(servers);
        for (final var connection : connections) {
            for (final var entry : connection.tools().entrySet()) {
                final var scopedName = scopedToolName(connection.serverId(), entry.getKey());
                if (null != tools.putIfAbsent(scopedName, entry.getValue().withId(scopedName))) {
                    log.error("Tool {} of server {} maps to already registered name {}",
                              entry.getKey(), connection.serverId(), scopedName);
                    new TurnTools(Map.of(), connections, executorService).close();
                    throw new CouncilException(CouncilError.error(
                            ErrorType.TOOL_DISCOVERY_FAILURE,
                            connection.serverId(),
                            "Tool %s clashes with already registered tool %s".formatted(entry.getKey(),
                                                                                        scopedName)));
                }
            }
        }
        log.info("Assembled {} tools for agent {} from {} remote servers",
                 tools.size(), agentId, connections.size());
        return new TurnTools(tools, connections, executorService);
    }

    private List<RemoteToolConnection> connectAll(List<RemoteToolServerConfig> servers) {
        final var attempts = new ArrayList<Future<RemoteToolConnection>>(servers.size());
        servers.forEach(server -> attempts.add(executorService.submit(() -> remoteToolConnector.connect(server))));
        final var deadline = System.nanoTime() + discoveryTimeout.toNanos();
        final var opened = new ArrayList<RemoteToolConnection>(servers.size());
        for (int i = 0; i < servers.size(); i++) {
            final var server = servers.get(i);
            try {
                opened.add(attempts.get(i).get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            }
            catch (TimeoutException e) {
                throw abort(server, "Timed out after %d ms".formatted(discoveryTimeout.toMillis()),
                            e, attempts.subList(i, attempts.size()), opened);
            }
            catch (ExecutionException e) {
                throw abort(server, AgentUtils.rootCause(e).getMessage(), e,
                            attempts.subList(i + 1, attempts.size()), opened);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw abort(server, "Interrupted", e, attempts.subList(i, attempts.size()), opened);
            }
        }
        return opened;
    }

    /**
     * Cancels pending attempts and closes every connection that got opened, including ones that completed just
     * before cancellation.
     */
    private CouncilException abort(
            RemoteToolServerConfig server,
            String reason,
            Exception cause,
            List<Future<RemoteToolConnection>> pending,
            List<RemoteToolConnection> opened) {
        log.error("Tool discovery failed for server {} ({}): {}", server.getId(), server.getUrl(), reason);
        final var toClose = new ArrayList<>(opened);
        pending.forEach(attempt -> {
            if (!attempt.cancel(true)) {
                completedConnection(attempt, toClose);
            }
        });
        new TurnTools(Map.of(), toClose, executorService).close();
        if (cause.getCause() instanceof CouncilException councilException
                && councilException.getErrorType() == ErrorType.TOOL_DISCOVERY_FAILURE) {
            return councilException;
        }
        return new CouncilException(CouncilError.error(ErrorType.TOOL_DISCOVERY_FAILURE, server.getId(), reason),
                                    cause);
    }

    private static void completedConnection(
            Future<RemoteToolConnection> attempt,
            List<RemoteToolConnection> toClose) {
        try {
            final var connection = attempt.get();
            if (null != connection) {
                toClose.add(connection);
            }
        }
        catch (ExecutionException e) {
            log.debug("Discovery attempt had already failed: {}", AgentUtils.rootCause(e).getMessage());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while collecting discovery attempt for cleanup");
        }
    }
}
