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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.council.core.agent.RemoteToolServerConfig;
import com.phonepe.council.core.agent.TransportType;
import com.phonepe.council.core.errors.CouncilException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Validation, normalization and lenient parsing of remote tool server configurations
 */
@Slf4j
@UtilityClass
public class RemoteToolServerConfigs {
    public static final Comparator<RemoteToolServerConfig> BY_NAME
            = Comparator.comparing(RemoteToolServerConfig::getName)
            .thenComparing(RemoteToolServerConfig::getId);

    /**
     * Trims id, name and url, drops blank header keys and null header values.
     *
     * @throws CouncilException with INVALID_INPUT if id, name or url is blank
     */
    public static RemoteToolServerConfig normalize(final RemoteToolServerConfig config) {
        if (null == config) {
            throw CouncilException.invalidInput("Server configuration is required");
        }
        return RemoteToolServerConfig.builder()
                .id(required(config.getId(), "Server id is required"))
                .name(required(config.getName(), "Server name is required"))
                .transport(config.getTransport())
                .url(required(config.getUrl(), "Server url is required"))
                .headers(normalizeHeaders(config.getHeaders()))
                .enabled(config.isEnabled())
                .build();
    }

    /**
     * Reads the stored server list. Accepts a JSON array, a JSON string holding an array, or an object whose values are
     * all objects. Entries that are not valid are skipped.
     */
    public static List<RemoteToolServerConfig> parseStored(final ObjectMapper mapper, final String raw) {
        if (Strings.isNullOrEmpty(raw) || raw.isBlank()) {
            return new ArrayList<>();
        }
        final JsonNode node;
        try {
            node = mapper.readTree(raw);
        }
        catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable server list: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
        final var entries = storedEntries(mapper, node);
        final var servers = new ArrayList<RemoteToolServerConfig>();
        for (final var entry : entries) {
            try {
                servers.add(fromNode(entry));
            }
            catch (CouncilException e) {
                log.warn("Skipping malformed server entry {}: {}", entry, e.getMessage());
            }
        }
        return servers;
    }

    public static String serialize(final ObjectMapper mapper, final List<RemoteToolServerConfig> servers) {
        try {
            return mapper.writeValueAsString(servers);
        }
        catch (JsonProcessingException e) {
            throw CouncilException.invalidInput("Could not serialize server list: " + e.getOriginalMessage());
        }
    }

    private static List<JsonNode> storedEntries(final ObjectMapper mapper, final JsonNode node) {
        if (node.isArray()) {
            final var entries = new ArrayList<JsonNode>();
            node.elements().forEachRemaining(entries::add);
            return entries;
        }
        if (node.isTextual()) {
            try {
                return storedEntries(mapper, mapper.readTree(node.asText()));
            }
            catch (JsonProcessingException e) {
                log.warn("Ignoring unparseable nested server list: {}", e.getOriginalMessage());
                return List.of();
            }
        }
        if (node.isObject()) {
            final var entries = new ArrayList<JsonNode>();
            node.elements().forEachRemaining(entries::add);
            if (entries.stream().allMatch(JsonNode::isObject)) {
                return entries;
            }
        }
        log.warn("Ignoring server list of unexpected shape: {}", node.getNodeType());
        return List.of();
    }

    private static RemoteToolServerConfig fromNode(final JsonNode node) {
        if (!node.isObject()) {
            throw CouncilException.invalidInput("Server entry must be an object");
        }
        final var headers = new LinkedHashMap<String, String>();
        final var headersNode = node.get("headers");
        if (null != headersNode && headersNode.isObject()) {
            headersNode.fields().forEachRemaining(field -> {
                if (field.getValue().isTextual()) {
                    headers.put(field.getKey(), field.getValue().asText());
                }
            });
        }
        final var enabledNode = node.get("enabled");
        return normalize(RemoteToolServerConfig.builder()
                                 .id(text(node, "id"))
                                 .name(text(node, "name"))
                                 .transport(TransportType.fromValue(text(node, "transport")))
                                 .url(text(node, "url"))
                                 .headers(headers)
                                 .enabled(null != enabledNode && enabledNode.isBoolean() ? enabledNode.asBoolean() : null)
                                 .build());
    }

    private static String text(final JsonNode node, final String field) {
        final var value = node.get(field);
        return null != value && value.isTextual() ? value.asText() : null;
    }

    private static String required(final String value, final String message) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw CouncilException.invalidInput(message);
        }
        return value.trim();
    }

    private static Map<String, String> normalizeHeaders(final Map<String, String> headers) {
        final var normalized = new LinkedHashMap<String, String>();
        if (null == headers) {
            return normalized;
        }
        headers.forEach((key, value) -> {
            if (null != key && !key.isBlank() && null != value) {
                normalized.put(key.trim(), value);
            }
        });
        return normalized;
    }
}
