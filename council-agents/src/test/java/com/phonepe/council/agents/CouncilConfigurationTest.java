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

import com.phonepe.council.agentmemory.InMemoryMemoryIndex;
import com.phonepe.council.core.utils.JsonUtils;
import com.phonepe.council.filesystem.FileSystemDataStore;
import com.phonepe.council.models.SimpleOpenAIModel;
import com.phonepe.council.session.InMemoryDataStore;
import com.phonepe.council.toolbox.mcp.MCPRemoteToolConnector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CouncilConfigurationTest {

    @Test
    void testDefaults() {
        final var config = CouncilConfiguration.fromSource(Map.of("COUNCIL_MODEL_API_KEY", "key",
                                                                  "COUNCIL_MODEL_NAME", "openai/gpt-4o")::get);
        assertEquals(CouncilConfiguration.DEFAULT_BASE_URL, config.getModelBaseUrl());
        assertEquals(CouncilConfiguration.DEFAULT_SITE_URL, config.getSiteUrl());
        assertEquals(CouncilConfiguration.DEFAULT_APP_NAME, config.getAppName());
        assertNull(config.getMaxIterations());
        assertNull(config.getDiscoveryTimeout());

        final var setup = config.toSetup(JsonUtils.createMapper());
        assertInstanceOf(SimpleOpenAIModel.class, setup.getModel());
        assertInstanceOf(InMemoryDataStore.class, setup.getDataStore());
        assertInstanceOf(InMemoryMemoryIndex.class, setup.getMemoryIndex());
        assertInstanceOf(MCPRemoteToolConnector.class, setup.getRemoteToolConnector());
        assertEquals(10, setup.getModelSettings().effectiveMaxIterations());
        setup.getExecutorService().shutdownNow();
    }

    @Test
    void testExplicitValues(@TempDir Path dataDir) {
        final var config = CouncilConfiguration.fromSource(Map.of(
                "COUNCIL_MODEL_API_KEY", "key",
                "COUNCIL_MODEL_NAME", "openai/gpt-4o",
                "COUNCIL_DATA_DIR", dataDir.toString(),
                "COUNCIL_MAX_ITERATIONS", " 4 ",
                "COUNCIL_DISCOVERY_TIMEOUT_MS", "2500",
                "COUNCIL_NAMESPACE", "test:v1")::get);
        assertEquals(4, config.getMaxIterations());
        assertEquals(Duration.ofMillis(2500), config.getDiscoveryTimeout());

        final var setup = config.toSetup(JsonUtils.createMapper());
        assertInstanceOf(FileSystemDataStore.class, setup.getDataStore());
        assertEquals("test:v1", setup.getNamespace());
        assertEquals(4, setup.getModelSettings().effectiveMaxIterations());
        assertEquals(Duration.ofMillis(2500), setup.getDiscoveryTimeout());
        setup.getExecutorService().shutdownNow();
    }

    @Test
    void testMissingModelSettings() {
        final var mapper = JsonUtils.createMapper();
        final var noKey = CouncilConfiguration.fromSource(Map.of("COUNCIL_MODEL_NAME", "m")::get);
        assertThrows(IllegalStateException.class, () -> noKey.toSetup(mapper));
        final var noModel = CouncilConfiguration.fromSource(Map.of("COUNCIL_MODEL_API_KEY", "k")::get);
        assertThrows(IllegalStateException.class, () -> noModel.toSetup(mapper));
    }

    @Test
    void testInvalidNumber() {
        assertThrows(IllegalStateException.class,
                     () -> CouncilConfiguration.fromSource(Map.of("COUNCIL_MAX_ITERATIONS", "many")::get));
    }
}
