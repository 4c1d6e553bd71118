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

import com.google.common.base.Strings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the default system prompt given to new agents. The first non-blank candidate file under the base directory
 * wins, then the {@code /bootstrap.md} classpath resource. The prompt is read once and cached.
 */
@Slf4j
public class BootstrapPromptLoader {
    public static final List<String> DEFAULT_CANDIDATES
            = List.of("bootstrap.md", "BOOTSTRAP.md", "lib/bootstrap.md", "lib/BOOTSTRAP.md");
    public static final String CLASSPATH_RESOURCE = "/bootstrap.md";

    private final Path baseDir;
    private final List<String> candidates;
    private final String classpathResource;
    private final AtomicReference<String> cached = new AtomicReference<>();

    public BootstrapPromptLoader(Path baseDir) {
        this(baseDir, DEFAULT_CANDIDATES, CLASSPATH_RESOURCE);
    }

    public BootstrapPromptLoader(Path baseDir, List<String> candidates, String classpathResource) {
        this.baseDir = baseDir;
        this.candidates = List.copyOf(candidates);
        this.classpathResource = classpathResource;
    }

    /**
     * Always returns the same prompt once loaded
     *
     * @throws IllegalStateException if no candidate has any content
     */
    public String load() {
        final var existing = cached.get();
        if (null != existing) {
            return existing;
        }
        final var prompt = fromFiles()
                .or(this::fromClasspath)
                .orElseThrow(() -> new IllegalStateException(
                        "Missing bootstrap prompt. Checked %s under %s and classpath resource %s"
                                .formatted(candidates, baseDir, classpathResource)));
        cached.compareAndSet(null, prompt);
        return cached.get();
    }

    private Optional<String> fromFiles() {
        if (null == baseDir) {
            return Optional.empty();
        }
        for (final var candidate : candidates) {
            final var path = baseDir.resolve(candidate);
            if (!Files.isRegularFile(path)) {
                continue;
            }
            try {
                final var content = Files.readString(path).trim();
                if (!content.isEmpty()) {
                    log.info("Loaded bootstrap prompt from {}", path);
                    return Optional.of(content);
                }
            }
            catch (IOException e) {
                log.warn("Could not read bootstrap prompt candidate {}: {}", path, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<String> fromClasspath() {
        if (Strings.isNullOrEmpty(classpathResource)) {
            return Optional.empty();
        }
        try (InputStream in = BootstrapPromptLoader.class.getResourceAsStream(classpathResource)) {
            if (null == in) {
                return Optional.empty();
            }
            final var content = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (content.isEmpty()) {
                return Optional.empty();
            }
            log.info("Loaded bootstrap prompt from classpath resource {}", classpathResource);
            return Optional.of(content);
        }
        catch (IOException e) {
            log.warn("Could not read bootstrap prompt resource {}: {}", classpathResource, e.getMessage());
            return Optional.empty();
        }
    }
}
