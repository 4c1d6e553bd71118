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

import com.phonepe.council.core.agent.SessionUsage;
import com.phonepe.council.core.agentmessages.AgentMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a successful turn
 */
@Value
@Builder
public class TurnOutput {
    String agentId;
    String sessionId;
    /**
     * Final assistant text
     */
    String data;
    /**
     * Messages generated in this turn in the order they were persisted. Does not include the user prompt.
     */
    List<AgentMessage> newMessages;
    /**
     * Tokens used by this turn
     */
    SessionUsage usage;
    /**
     * Session totals after this turn was accounted for
     */
    SessionUsage sessionUsage;
    /**
     * False if the stream handler failed at some point and stopped receiving chunks
     */
    boolean streamDelivered;
}
