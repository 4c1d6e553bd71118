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

package com.phonepe.council.agentmemory;

import com.google.common.base.Strings;
import com.phonepe.council.core.errors.CouncilException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Long term memory of agents. Notes are grouped into one document per agent per UTC day.
 */
@Slf4j
public class AgentMemory {
    public static final int SEARCH_LIMIT = 3;
    public static final int PAGE_SIZE = 100;
    public static final int MAX_PAGES = 20;

    private final MemoryIndex index;
    private final Clock clock;

    public AgentMemory(MemoryIndex index) {
        this(index, Clock.systemUTC());
    }

    public AgentMemory(MemoryIndex index, Clock clock) {
        this.index = Objects.requireNonNull(index);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Adds a note to today's document, creating it if needed
     */
    public MemoryAppendResult append(String agentId, String text) {
        final var content = requireText(text, "Memory content is required");
        final var now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        final var day = LocalDate.ofInstant(now, ZoneOffset.UTC).toString();
        final var existing = index.fetch(agentId, List.of(day)).stream().findFirst();
        final var previousText = existing.map(MemoryDocument::getText).map(String::trim).orElse("");
        final var line = "[%s] %s".formatted(now, content);
        final var entries = existing.map(MemoryDocument::getEntries).orElse(0) + 1;
        final var document = MemoryDocument.builder()
                .id(day)
                .agentId(agentId)
                .text(previousText.isEmpty() ? line : previousText + "\n" + line)
                .entries(entries)
                .createdAt(existing.map(MemoryDocument::getCreatedAt).orElse(now))
                .updatedAt(now)
                .build();
        index.upsert(agentId, document);
        log.debug("Agent {} recorded memory entry {} for {}", agentId, entries, day);
        return new MemoryAppendResult(agentId, day, entries);
    }

    public List<MemorySearchResult> search(String agentId, String query) {
        final var trimmed = requireText(query, "Memory search query is required");
        return index.search(agentId, trimmed, SEARCH_LIMIT);
    }

    /**
     * All documents of the agent, latest day first. Reads at most {@link #MAX_PAGES} pages.
     */
    public List<MemoryDocument> listAll(String agentId) {
        final var documents = new ArrayList<MemoryDocument>();
        final var seenCursors = new HashSet<String>();
        String cursor = "";
        for (int i = 0; i < MAX_PAGES; i++) {
            if (!seenCursors.add(cursor)) {
                log.warn("Memory index returned a repeated cursor {} for agent {}", cursor, agentId);
                break;
            }
            final var page = index.range(agentId, cursor, PAGE_SIZE);
            documents.addAll(page.getDocuments());
            if (Strings.isNullOrEmpty(page.getNextCursor())) {
                break;
            }
            cursor = page.getNextCursor();
        }
        documents.sort(Comparator.comparing(MemoryDocument::getId).reversed());
        return documents;
    }

    public void reset(String agentId) {
        index.reset(agentId);
        log.info("Memory reset for agent {}", agentId);
    }

    private static String requireText(String value, String message) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw CouncilException.invalidInput(message);
        }
        return value.trim();
    }
}
