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
import com.phonepe.council.agentmemory.AgentMemory;
import com.phonepe.council.agentmemory.MemoryAppendResult;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.tools.Tool;
import com.phonepe.council.core.tools.ToolBox;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Long term memory for an agent. Notes are grouped by day.
 */
public class MemoryToolBox implements ToolBox {
    public static final String NAME = "memory";

    @Value
    public static class MemoryHit {
        String day;
        String text;
        double score;
    }

    private final AgentMemory agentMemory;

    public MemoryToolBox(@NonNull AgentMemory agentMemory) {
        this.agentMemory = agentMemory;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Tool("Save a note to long term memory. Use for facts, preferences and decisions worth remembering later.")
    public MemoryAppendResult append(
            ModelRunContext context,
            @JsonPropertyDescription("The note to remember") String text) {
        return agentMemory.append(context.getAgentId(), text);
    }

    @Tool("Search long term memory. Returns the most relevant days of notes.")
    public List<MemoryHit> search(
            ModelRunContext context,
            @JsonPropertyDescription("What to look for") String query) {
        return agentMemory.search(context.getAgentId(), query)
                .stream()
                .map(result -> new MemoryHit(result.getId(), result.getDocument().getText(), result.getScore()))
                .toList();
    }
}
