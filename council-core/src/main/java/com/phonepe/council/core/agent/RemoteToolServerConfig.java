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

package com.phonepe.council.core.agent;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;

/**
 * Connection details for a remote tool server configured on an agent
 */
@Value
@With
public class RemoteToolServerConfig {
    /**
     * Unique within an agent
     */
    String id;

    String name;

    TransportType transport;

    String url;

    /**
     * Sent on every request to the server. Typically used for auth.
     */
    Map<String, String> headers;

    boolean enabled;

    @Builder
    @Jacksonized
    public RemoteToolServerConfig(
            String id,
            String name,
            TransportType transport,
            String url,
            Map<String, String> headers,
            Boolean enabled) {
        this.id = id;
        this.name = name;
        this.transport = Objects.requireNonNullElse(transport, TransportType.HTTP);
        this.url = url;
        this.headers = Objects.requireNonNullElseGet(headers, Map::of);
        this.enabled = Objects.requireNonNullElse(enabled, true);
    }
}
