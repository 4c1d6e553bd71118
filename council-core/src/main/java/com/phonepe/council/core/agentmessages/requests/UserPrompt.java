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

package com.phonepe.council.core.agentmessages.requests;

import com.phonepe.council.core.agentmessages.AgentMessage;
import com.phonepe.council.core.agentmessages.AgentMessageType;
import com.phonepe.council.core.agentmessages.AgentMessageVisitor;
import com.phonepe.council.core.agentmessages.MessageRole;
import lombok.*;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Message typed in by the user
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class UserPrompt extends AgentMessage {
    String content;
    LocalDateTime sentAt;

    @Builder
    @Jacksonized
    public UserPrompt(@NonNull String content, LocalDateTime sentAt) {
        super(AgentMessageType.USER_PROMPT_REQUEST_MESSAGE);
        this.content = content;
        this.sentAt = Objects.requireNonNullElseGet(sentAt, LocalDateTime::now);
    }

    public UserPrompt(@NonNull String content) {
        this(content, null);
    }

    @Override
    public MessageRole role() {
        return MessageRole.USER;
    }

    @Override
    public <T> T accept(AgentMessageVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
