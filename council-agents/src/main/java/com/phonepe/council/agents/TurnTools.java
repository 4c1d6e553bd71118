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

import com.phonepe.council.core.tools.ExecutableTool;
import com.phonepe.council.core.tools.RemoteToolConnection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The tools available to the model for one turn along with the remote connections backing them
 */
@Slf4j
public class TurnTools implements AutoCloseable {
    @Getter
    private final Map<String, ExecutableTool> tools;
    @Getter
    private final List<RemoteToolConnection> connections;
    private final ExecutorService executorService;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TurnTools(
            Map<String, ExecutableTool> tools,
            List<RemoteToolConnection> connections,
            ExecutorService executorService) {
        this.tools = Collections.unmodifiableMap(tools);
        this.connections = List.copyOf(connections);
        this.executorService = executorService;
    }

    /**
     * Closes all connections in parallel and waits for them. Failures are logged and do not stop other closes.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final var failures = Collections.synchronizedList(new ArrayList<String>());
        CompletableFuture.allOf(
                        connections.stream()
                                .map(connection -> CompletableFuture
                                        .runAsync(connection::close, executorService)
                                        .exceptionally(error -> {
                                            failures.add(connection.serverId());
                                            log.warn("Error closing connection to tool server {}: {}",
                                                     connection.serverId(), error.getMessage());
                                            return null;
                                        }))
                                .toArray(CompletableFuture[]::new))
                .join();
        if (!failures.isEmpty()) {
            log.warn("Could not cleanly close connections to {} of {} tool servers: {}",
                     failures.size(), connections.size(), failures);
        }
    }
}
