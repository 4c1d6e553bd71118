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

package com.phonepe.council.toolbox.mcp;

import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.agent.TransportType;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorCategory;
import com.phonepe.council.core.utils.JsonUtils;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MCPTransportsTest {

    @Test
    void testSplitUsesTransportDefaults() {
        assertEquals(new MCPTransports.Endpoint("http://localhost:3001", "/mcp"),
                     MCPTransports.split("http://localhost:3001", TransportType.HTTP));
        assertEquals(new MCPTransports.Endpoint("http://localhost:3001", "/sse"),
                     MCPTransports.split("http://localhost:3001/", TransportType.SSE));
    }

    @Test
    void testSplitKeepsPathAndQuery() {
        assertEquals(new MCPTransports.Endpoint("https://tools.example.com:8443", "/v1/mcp?tenant=a%20b"),
                     MCPTransports.split(" https://tools.example.com:8443/v1/mcp?tenant=a%20b ", TransportType.HTTP));
    }

    @Test
    void testSplitRejectsRelativeUrls() {
        final var error = assertThrows(CouncilException.class,
                                       () -> MCPTransports.split("localhost/mcp", TransportType.HTTP));
        assertEquals(ErrorCategory.INVALID_INPUT, error.getCategory());
        assertThrows(CouncilException.class, () -> MCPTransports.split("http://bad host", TransportType.HTTP));
    }

    @Test
    void testTransportMatchesType() {
        final var mapper = JsonUtils.createMapper();
        final var config = RemoteToolServerConfig.builder()
                .id("weather")
                .name("Weather")
                .url("http://localhost:9999/mcp")
                .headers(Map.of("Authorization", "Bearer abc"))
                .build();
        assertInstanceOf(HttpClientStreamableHttpTransport.class,
                         MCPTransports.transport(config, mapper, Duration.ofSeconds(1)));
        assertInstanceOf(HttpClientSseClientTransport.class,
                         MCPTransports.transport(config.withTransport(TransportType.SSE),
                                                 mapper,
                                                 Duration.ofSeconds(1)));
    }
}
