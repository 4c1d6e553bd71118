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

package com.phonepe.council.session;

import lombok.Value;

/**
 * Builds keys for agents and sessions under a namespace
 */
@Value
public class StoreKeys {
    public static final String DEFAULT_NAMESPACE = "council:v1";

    String namespace;

    public String agents() {
        return namespace + ":agents";
    }

    public String agent(String agentId) {
        return namespace + ":agent:" + agentId;
    }

    public String sessions(String agentId) {
        return agent(agentId) + ":sessions";
    }

    public String session(String agentId, String sessionId) {
        return agent(agentId) + ":session:" + sessionId;
    }

    public String messages(String agentId, String sessionId) {
        return session(agentId, sessionId) + ":messages";
    }
}
