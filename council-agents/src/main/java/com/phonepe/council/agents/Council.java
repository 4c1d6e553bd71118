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

import com.google.common.base.Preconditions;
import com.phonepe.council.agentmemory.AgentMemory;
import com.phonepe.council.session.AgentStore;
import com.phonepe.council.session.BootstrapPromptLoader;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Process level state of the council. Owns the store, the memory, the tool registry and the conversation driver,
 * all built once from a {@link CouncilSetup} and shared by every turn.
 */
@Slf4j
@Getter
public class Council {
    private final CouncilSetup setup;
    private final AgentStore agentStore;
    private final AgentMemory agentMemory;
    private final ToolRegistry toolRegistry;
    private final ConversationDriver conversationDriver;

    public Council(@NonNull CouncilSetup setup) {
        Preconditions.checkArgument(null != setup.getModel(), "A model is required");
        Preconditions.checkArgument(null != setup.getRemoteToolConnector(), "A remote tool connector is required");
        this.setup = setup;
        this.agentStore = AgentStore.builder()
                .dataStore(setup.getDataStore())
                .mapper(setup.getMapper())
                .bootstrapPromptLoader(new BootstrapPromptLoader(setup.getBootstrapDir()))
                .namespace(setup.getNamespace())
                .clock(setup.getClock())
                .build();
        this.agentMemory = null == setup.getMemoryIndex()
                           ? null
                           : new AgentMemory(setup.getMemoryIndex(), setup.getClock());
        this.toolRegistry = new ToolRegistry(agentStore,
                                             setup.getRemoteToolConnector(),
                                             agentMemory,
                                             setup.getExecutorService(),
                                             setup.getDiscoveryTimeout());
        this.conversationDriver = ConversationDriver.builder()
                .agentStore(agentStore)
                .toolRegistry(toolRegistry)
                .model(setup.getModel())
                .mapper(setup.getMapper())
                .modelSettings(setup.getModelSettings())
                .toolRunApprovalSeeker(setup.getToolRunApprovalSeeker())
                .executorService(setup.getExecutorService())
                .serializeSessionTurns(setup.isSerializeSessionTurns())
                .build();
        log.info("Council initialized. Memory enabled: {} Serialized session turns: {}",
                 null != agentMemory, setup.isSerializeSessionTurns());
    }

    public CompletableFuture<TurnOutput> converse(TurnRequest request) {
        return conversationDriver.converse(request);
    }

    public CompletableFuture<TurnOutput> converse(TurnRequest request, Consumer<String> streamHandler) {
        return conversationDriver.converse(request, streamHandler);
    }
}
