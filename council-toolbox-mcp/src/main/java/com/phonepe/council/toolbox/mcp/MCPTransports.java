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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.agent.TransportType;
import com.phonepe.council.core.errors.CouncilException;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import lombok.Value;
import lombok.experimental.UtilityClass;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Builds MCP client transports from stored server configuration
 */
@UtilityClass
public class MCPTransports {
    public static final String DEFAULT_HTTP_ENDPOINT = "/mcp";
    public static final String DEFAULT_SSE_ENDPOINT = "/sse";

    /**
     * A server url split into the base uri and the endpoint path the transports expect
     */
    @Value
    public static class Endpoint {
        String baseUri;
        String path;
    }

    public static McpClientTransport transport(
            RemoteToolServerConfig config,
            ObjectMapper mapper,
            Duration connectTimeout) {
        final var transportType = config.getTransport();
        final var endpoint = split(config.getUrl(), transportType);
        final var headers = config.getHeaders();
        return switch (transportType) {
            case HTTP -> HttpClientStreamableHttpTransport.builder(endpoint.getBaseUri())
                    .endpoint(endpoint.getPath())
                    .objectMapper(mapper)
                    .customizeClient(builder -> builder.connectTimeout(connectTimeout))
                    .customizeRequest(builder -> addHeaders(builder, headers))
                    .build();
            case SSE -> HttpClientSseClientTransport.builder(endpoint.getBaseUri())
                    .sseEndpoint(endpoint.getPath())
                    .objectMapper(mapper)
                    .customizeClient(builder -> builder.connectTimeout(connectTimeout))
                    .customizeRequest(builder -> addHeaders(builder, headers))
                    .build();
        };
    }

    /**
     * Splits the url into scheme and authority and the rest. A url without a path uses the default endpoint of the
     * transport.
     */
    public static Endpoint split(String url, TransportType transportType) {
        final URI uri;
        try {
            uri = URI.create(url.trim());
        }
        catch (IllegalArgumentException e) {
            throw CouncilException.invalidInput("Invalid server url: " + url);
        }
        if (Strings.isNullOrEmpty(uri.getScheme()) || Strings.isNullOrEmpty(uri.getRawAuthority())) {
            throw CouncilException.invalidInput("Invalid server url: " + url);
        }
        final var baseUri = uri.getScheme() + "://" + uri.getRawAuthority();
        var path = Strings.nullToEmpty(uri.getRawPath());
        if (path.isEmpty() || path.equals("/")) {
            path = transportType == TransportType.SSE ? DEFAULT_SSE_ENDPOINT : DEFAULT_HTTP_ENDPOINT;
        }
        if (!Strings.isNullOrEmpty(uri.getRawQuery())) {
            path = path + "?" + uri.getRawQuery();
        }
        return new Endpoint(baseUri, path);
    }

    private static void addHeaders(HttpRequest.Builder builder, Map<String, String> headers) {
        headers.forEach(builder::header);
    }
}
