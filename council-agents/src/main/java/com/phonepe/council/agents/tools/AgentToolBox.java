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

package com.phonepe.council.agents.tools;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.phonepe.council.core.agent.Session;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.tools.Tool;
import com.phonepe.council.core.tools.ToolBox;
import com.phonepe.council.session.AgentStore;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Tools that let an agent look at the council and rewrite its own instructions
 */
@Slf4j
public class AgentToolBox implements ToolBox {
    public static final String NAME = "agent";

    @Value
    public static class AgentSummary {
        String id;
        String name;
    }

    @Value
    public static class SessionSummary {
        String id;
        Instant lastMessageAt;
        long totalTokens;
    }

    @Value
    public static class PromptUpdateResult {
        boolean ok;
        String message;
    }

    private final AgentStore agentStore;

    public AgentToolBox(@NonNull AgentStore agentStore) {
        this.agentStore = agentStore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Tool("Get the list of all agents with id and name.")
    public List<AgentSummary> listAgents() {
        return agentStore.listAgents()
                .stream()
                .map(agent -> new AgentSummary(agent.getId(), agent.getName()))
                .toList();
    }

    @Tool("Get the conversation sessions of this agent along with the time of the last message in each.")
    public List<SessionSummary> listSessions(ModelRunContext context) {
        return agentStore.listSessions(context.getAgentId())
                .stream()
                .map(AgentToolBox::toSummary)
                .toList();
    }

    @Tool("Update this agent's system prompt. Use when asked to change behavior, tone, or operating rules.")
    public PromptUpdateResult updateSystemPrompt(
            ModelRunContext context,
            @JsonPropertyDescription("The new complete system prompt for this agent.") String systemPrompt) {
        agentStore.updateSystemPrompt(context.getAgentId(), systemPrompt);
        log.info("Agent {} updated its system prompt during run {}", context.getAgentId(), context.getRunId());
        return new PromptUpdateResult(true, "System prompt updated successfully.");
    }

    private static SessionSummary toSummary(Session session) {
        return new SessionSummary(session.getId(),
                                  session.getLastMessageAt(),
                                  null == session.getUsage() ? 0 : session.getUsage().getTotalTokens());
    }
}
