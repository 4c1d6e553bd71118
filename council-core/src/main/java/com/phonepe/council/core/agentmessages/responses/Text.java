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

package com.phonepe.council.core.agentmessages.responses;

import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.AgentMessageVisitor;
import com.phonepe.council.core.agentmessages.MessageRole;
import lombok.*;
import lombok.extern.jackson.Jacksonized;

/**
 * Text response from LLM
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Text extends AgentMessage {
    String content;

    @Builder
    @Jacksonized
    public Text(@NonNull String content) {
        super(AgentMessageType.TEXT_RESPONSE_MESSAGE);
        this.content = content;
    }

    @Override
    public MessageRole role() {
        return MessageRole.ASSISTANT;
    }

    @Override
    public <T> T accept(AgentMessageVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
