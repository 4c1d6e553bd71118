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

package com.phonepe.council.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.council.agentmemory.InMemoryMemoryIndex;
import com.phonepe.council.agentmemory.MemoryIndex;
import com.phonepe.council.core.model.ModelSettings;
import com.phonepe.council.core.utils.AgentUtils;
import com.phonepe.council.core.utils.EnvLoader;
import com.phonepe.council.filesystem.FileSystemDataStore;
import com.phonepe.council.models.OpenAICompatibleProviders;
import com.phonepe.council.models.OpenAIProviderConfig;
import com.phonepe.council.models.SimpleOpenAIModel;
import com.phonepe.council.session.DataStore;
import com.phonepe.council.session.InMemoryDataStore;
import com.phonepe.council.storage.ESClient;
import com.phonepe.council.storage.memory.ESMemoryIndex;
import com.phonepe.council.toolbox.mcp.MCPRemoteToolConnector;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.function.Function;

/**
 * Process configuration read from the environment or a {@code .env} file
 */
@Value
@Builder
@Slf4j
public class CouncilConfiguration {
    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api";
    public static final String DEFAULT_SITE_URL = "http://localhost:3000";
    public static final String DEFAULT_APP_NAME = "Council";

    String modelApiKey;
    String modelName;
    String modelBaseUrl;
    String siteUrl;
    String appName;
    String namespace;
    /**
     * Directory for the file based store. Data is kept in memory when absent.
     */
    String dataDir;
    String bootstrapDir;
    Integer maxIterations;
    Duration discoveryTimeout;
    /**
     * Elasticsearch endpoint for memory. An in-memory index is used when absent.
     */
    String memoryEsUrl;
    String memoryEsApiKey;
    String memoryEsIndexPrefix;

    public static CouncilConfiguration fromEnv() {
        return fromSource(name -> EnvLoader.readEnv(name).orElse(null));
    }

    static CouncilConfiguration fromSource(Function<String, String> source) {
        return CouncilConfiguration.builder()
                .modelApiKey(source.apply("COUNCIL_MODEL_API_KEY"))
                .modelName(source.apply("COUNCIL_MODEL_NAME"))
                .modelBaseUrl(valueOr(source, "COUNCIL_MODEL_BASE_URL", DEFAULT_BASE_URL))
                .siteUrl(valueOr(source, "COUNCIL_MODEL_SITE_URL", DEFAULT_SITE_URL))
                .appName(valueOr(source, "COUNCIL_MODEL_APP_NAME", DEFAULT_APP_NAME))
                .namespace(source.apply("COUNCIL_NAMESPACE"))
                .dataDir(source.apply("COUNCIL_DATA_DIR"))
                .bootstrapDir(source.apply("COUNCIL_BOOTSTRAP_DIR"))
                .maxIterations(parseInt(source, "COUNCIL_MAX_ITERATIONS"))
                .discoveryTimeout(parseMillis(source, "COUNCIL_DISCOVERY_TIMEOUT_MS"))
                .memoryEsUrl(source.apply("COUNCIL_MEMORY_ES_URL"))
                .memoryEsApiKey(source.apply("COUNCIL_MEMORY_ES_API_KEY"))
                .memoryEsIndexPrefix(source.apply("COUNCIL_MEMORY_ES_INDEX_PREFIX"))
                .build();
    }

    /**
     * Builds a setup with the file or in-memory store, the OpenAI compatible model, MCP for remote tools and the
     * configured memory backend. The Elasticsearch client, when used, lives as long as the process.
     *
     * @throws IllegalStateException if the model api key or model name is missing
     */
    public CouncilSetup toSetup(@NonNull ObjectMapper mapper) {
        if (AgentUtils.isBlank(modelApiKey)) {
            throw new IllegalStateException("Missing COUNCIL_MODEL_API_KEY");
        }
        if (AgentUtils.isBlank(modelName)) {
            throw new IllegalStateException("Missing COUNCIL_MODEL_NAME");
        }
        final var headers = new LinkedHashMap<String, String>();
        headers.put("HTTP-Referer", siteUrl);
        headers.put("X-Title", appName);
        final var provider = OpenAICompatibleProviders.create(OpenAIProviderConfig.builder()
                                                                      .apiKey(modelApiKey)
                                                                      .baseUrl(modelBaseUrl)
                                                                      .headers(headers)
                                                                      .build(),
                                                              mapper);
        return CouncilSetup.builder()
                .mapper(mapper)
                .model(new SimpleOpenAIModel<>(modelName, provider, mapper))
                .modelSettings(ModelSettings.builder()
                                       .maxIterations(maxIterations)
                                       .build())
                .dataStore(dataStore(mapper))
                .namespace(namespace)
                .bootstrapDir(Strings.isNullOrEmpty(bootstrapDir) ? null : Path.of(bootstrapDir))
                .memoryIndex(memoryIndex())
                .remoteToolConnector(new MCPRemoteToolConnector(mapper))
                .discoveryTimeout(discoveryTimeout)
                .build();
    }

    private DataStore dataStore(ObjectMapper mapper) {
        if (AgentUtils.isBlank(dataDir)) {
            log.warn("COUNCIL_DATA_DIR is not set. Agents and sessions will be kept in memory only.");
            return new InMemoryDataStore();
        }
        log.info("Storing council data under {}", dataDir);
        return new FileSystemDataStore(dataDir, mapper);
    }

    private MemoryIndex memoryIndex() {
        if (AgentUtils.isBlank(memoryEsUrl)) {
            return new InMemoryMemoryIndex();
        }
        log.info("Using elasticsearch at {} for agent memory", memoryEsUrl);
        return new ESMemoryIndex(ESClient.builder()
                                         .serverUrl(memoryEsUrl)
                                         .apiKey(memoryEsApiKey)
                                         .build(),
                                 memoryEsIndexPrefix);
    }

    private static String valueOr(Function<String, String> source, String name, String defaultValue) {
        final var value = source.apply(name);
        return AgentUtils.isBlank(value) ? defaultValue : value.trim();
    }

    private static Integer parseInt(Function<String, String> source, String name) {
        final var value = source.apply(name);
        if (AgentUtils.isBlank(value)) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer value for %s: %s".formatted(name, value), e);
        }
    }

    private static Duration parseMillis(Function<String, String> source, String name) {
        final var millis = parseInt(source, name);
        return null == millis ? null : Duration.ofMillis(millis);
    }
}
