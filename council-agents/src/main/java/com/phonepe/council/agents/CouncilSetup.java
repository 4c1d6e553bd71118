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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.council.agentmemory.MemoryIndex;
import com.phonepe.council.core.model.Model;
import com.phonepe.council.core.model.ModelSettings;
import com.phonepe.council.core.tools.RemoteToolConnector;
import com.phonepe.council.core.tools.ToolRunApprovalSeeker;
import com.phonepe.council.core.utils.JsonUtils;
import com.phonepe.council.session.DataStore;
import com.phonepe.council.session.InMemoryDataStore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Everything needed to run a council. Only the model and the remote tool connector are mandatory.
 */
@Value
@Builder
public class CouncilSetup {
    /**
     * Mapper used for stored messages and tool arguments. Defaults to {@link JsonUtils#createMapper()}.
     */
    ObjectMapper mapper;

    Model model;

    /**
     * Settings passed to the model on every turn. Carries the iteration cap for the tool loop.
     */
    ModelSettings modelSettings;

    /**
     * Storage for agents, sessions and transcripts. Defaults to an in-memory store.
     */
    DataStore dataStore;

    /**
     * Key namespace within the data store
     */
    String namespace;

    /**
     * Directory searched for the bootstrap prompt. Defaults to the working directory.
     */
    Path bootstrapDir;

    /**
     * Memory backend. Memory tools are not offered when absent.
     */
    MemoryIndex memoryIndex;

    RemoteToolConnector remoteToolConnector;

    /**
     * Upper bound for connecting to all remote tool servers of a turn
     */
    Duration discoveryTimeout;

    ToolRunApprovalSeeker toolRunApprovalSeeker;

    /**
     * Run turns on the same session one after another
     */
    boolean serializeSessionTurns;

    /**
     * Runs turns and model calls. Defaults to a cached thread pool.
     */
    ExecutorService executorService;

    Clock clock;

    @SuppressWarnings("java:S107")
    public CouncilSetup(
            ObjectMapper mapper,
            Model model,
            ModelSettings modelSettings,
            DataStore dataStore,
            String namespace,
            Path bootstrapDir,
            MemoryIndex memoryIndex,
            RemoteToolConnector remoteToolConnector,
            Duration discoveryTimeout,
            ToolRunApprovalSeeker toolRunApprovalSeeker,
            boolean serializeSessionTurns,
            ExecutorService executorService,
            Clock clock) {
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.model = model;
        this.modelSettings = modelSettings;
        this.dataStore = Objects.requireNonNullElseGet(dataStore, InMemoryDataStore::new);
        this.namespace = namespace;
        this.bootstrapDir = Objects.requireNonNullElseGet(bootstrapDir, () -> Path.of("."));
        this.memoryIndex = memoryIndex;
        this.remoteToolConnector = remoteToolConnector;
        this.discoveryTimeout = discoveryTimeout;
        this.toolRunApprovalSeeker = Objects.requireNonNullElseGet(toolRunApprovalSeeker,
                                                                   ToolRunApprovalSeeker::approveAll);
        this.serializeSessionTurns = serializeSessionTurns;
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }
}
