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

import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorCategory;
import com.phonepe.council.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransportTypeTest {

    @Test
    void testFromValue() {
        assertEquals(TransportType.HTTP, TransportType.fromValue(null));
        assertEquals(TransportType.HTTP, TransportType.fromValue("  "));
        assertEquals(TransportType.HTTP, TransportType.fromValue("Streamable-HTTP"));
        assertEquals(TransportType.SSE, TransportType.fromValue(" sse "));
        final var error = assertThrows(CouncilException.class, () -> TransportType.fromValue("websocket"));
        assertEquals(ErrorCategory.INVALID_INPUT, error.getCategory());
    }

    @Test
    @SneakyThrows
    void testServerConfigDefaults() {
        final var mapper = JsonUtils.createMapper();
        final var config = mapper.readValue("{\"id\":\"s1\",\"name\":\"Search\",\"url\":\"http://localhost:8080/mcp\"}",
                                            RemoteToolServerConfig.class);
        assertEquals(TransportType.HTTP, config.getTransport());
        assertTrue(config.isEnabled());
        assertTrue(config.getHeaders().isEmpty());

        final var serialized = mapper.writeValueAsString(config.withTransport(TransportType.SSE));
        assertTrue(serialized.contains("\"transport\":\"sse\""));
    }
}
