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

package com.phonepe.council.core.tools;

import java.util.Map;

/**
 * An open connection to a remote tool server. Valid for the duration of one turn.
 */
public interface RemoteToolConnection extends AutoCloseable {
    /**
     * Identifier of the server this connection was opened to
     */
    String serverId();

    /**
     * Tool catalogue currently advertised by the server, keyed by the tool's own name
     */
    Map<String, ExternalTool> tools();

    /**
     * Releases the connection. Implementations must not throw checked exceptions.
     */
    @Override
    void close();
}
