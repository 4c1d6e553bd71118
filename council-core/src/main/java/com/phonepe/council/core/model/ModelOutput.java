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

package com.phonepe.council.core.model;

import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.errors.CouncilError;
import lombok.Value;

import java.util.List;

/**
 * Final response of the model for a turn
 */
@Value
public class ModelOutput {
    /**
     * Final text produced by the model. Null on error.
     */
    String data;

    /**
     * Messages produced during the turn (tool calls, tool results and the final text) in generation order
     */
    List<AgentMessage> newMessages;

    /**
     * Input messages followed by the new messages
     */
    List<AgentMessage> allMessages;

    ModelUsageStats usage;

    CouncilError error;

    public static ModelOutput success(
            String data,
            List<AgentMessage> newMessages,
            List<AgentMessage> allMessages,
            ModelUsageStats usage) {
        return new ModelOutput(data, List.copyOf(newMessages), List.copyOf(allMessages), usage, CouncilError.success());
    }

    public static ModelOutput error(
            List<AgentMessage> newMessages,
            List<AgentMessage> allMessages,
            ModelUsageStats usage,
            CouncilError error) {
        return new ModelOutput(null, List.copyOf(newMessages), List.copyOf(allMessages), usage, error);
    }

    public boolean isSuccess() {
        return error == null || error.isSuccess();
    }
}
