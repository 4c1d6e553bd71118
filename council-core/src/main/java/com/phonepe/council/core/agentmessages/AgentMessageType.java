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

package com.phonepe.council.core.agentmessages;

/**
 * Different message types stored in a session transcript
 */
public enum AgentMessageType {
    //Sent by the user
    USER_PROMPT_REQUEST_MESSAGE,
    //Result of running a tool, sent back to the model
    TOOL_CALL_RESPONSE_MESSAGE,

    //Received from the model
    TEXT_RESPONSE_MESSAGE,
    TOOL_CALL_REQUEST_MESSAGE,
}
