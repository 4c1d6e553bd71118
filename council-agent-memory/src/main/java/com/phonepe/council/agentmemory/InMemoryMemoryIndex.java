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

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * A {@link MemoryIndex} on heap. Documents are scored by the fraction of distinct query terms they contain. Cursors
 * are the id of the last document on the previous page.
 */
public class InMemoryMemoryIndex implements MemoryIndex {
    private static final Splitter TERM_SPLITTER = Splitter.onPattern("[^\\p{L}\\p{N}]+").omitEmptyStrings();

    private final Map<String, ConcurrentSkipListMap<String, MemoryDocument>> documents = new ConcurrentHashMap<>();

    @Override
    public void upsert(String agentId, MemoryDocument document) {
        documents.computeIfAbsent(agentId, id -> new ConcurrentSkipListMap<>()).put(document.getId(), document);
    }

    @Override
    public List<MemoryDocument> fetch(String agentId, Collection<String> ids) {
        final var agentDocuments = documents.getOrDefault(agentId, new ConcurrentSkipListMap<>());
        return ids.stream()
                .map(agentDocuments::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public List<MemorySearchResult> search(String agentId, String query, int limit) {
        Preconditions.checkArgument(limit > 0, "Result limit must be positive, got %s", limit);
        final var queryTerms = terms(query);
        if (queryTerms.isEmpty()) {
            return List.of();
        }
        return documents.getOrDefault(agentId, new ConcurrentSkipListMap<>())
                .values()
                .stream()
                .map(document -> {
                    final var documentTerms = terms(document.getText());
                    final var matched = queryTerms.stream().filter(documentTerms::contains).count();
                    return new MemorySearchResult(document.getId(),
                                                  (double) matched / queryTerms.size(),
                                                  document);
                })
                .filter(result -> result.getScore() > 0)
                .sorted(Comparator.comparingDouble(MemorySearchResult::getScore).reversed()
                                .thenComparing(MemorySearchResult::getId, Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }

    @Override
    public MemoryPage range(String agentId, String cursor, int limit) {
        Preconditions.checkArgument(limit > 0, "Page size must be positive, got %s", limit);
        final var agentDocuments = documents.getOrDefault(agentId, new ConcurrentSkipListMap<>());
        final var remaining = Strings.isNullOrEmpty(cursor)
                              ? agentDocuments
                              : agentDocuments.tailMap(cursor, false);
        final var page = remaining.values().stream().limit(limit).toList();
        final var hasMore = remaining.size() > page.size();
        return new MemoryPage(page, hasMore ? page.get(page.size() - 1).getId() : null);
    }

    @Override
    public void reset(String agentId) {
        documents.remove(agentId);
    }

    private static Set<String> terms(String text) {
        final var terms = new HashSet<String>();
        TERM_SPLITTER.split(Strings.nullToEmpty(text).toLowerCase(Locale.ROOT)).forEach(terms::add);
        return terms;
    }
}
