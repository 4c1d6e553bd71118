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

package com.phonepe.council.storage.memory;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.google.common.base.Strings;
import com.phonepe.council.agentmemory.MemoryDocument;
import com.phonepe.council.agentmemory.MemoryIndex;
import com.phonepe.council.agentmemory.MemoryPage;
import com.phonepe.council.agentmemory.MemorySearchResult;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.storage.ESClient;
import com.phonepe.council.storage.IndexSettings;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * A {@link MemoryIndex} backed by elasticsearch. All agents share one index, documents are filtered by agent id.
 * Search is a full text match on the notes.
 */
@Slf4j
public class ESMemoryIndex implements MemoryIndex {
    private static final String MEMORIES_INDEX = "agent-memories";

    @FunctionalInterface
    private interface ESCall<T> {
        T call() throws IOException;
    }

    private final ESClient client;
    private final String indexPrefix;

    public ESMemoryIndex(@NonNull ESClient client, String indexPrefix) {
        this(client, indexPrefix, IndexSettings.DEFAULT);
    }

    public ESMemoryIndex(@NonNull ESClient client, String indexPrefix, IndexSettings indexSettings) {
        this.client = client;
        this.indexPrefix = indexPrefix;
        ensureIndex(Objects.requireNonNullElse(indexSettings, IndexSettings.DEFAULT));
    }

    @Override
    public void upsert(String agentId, MemoryDocument document) {
        final var stored = toStored(agentId, document);
        final var indexName = indexName();
        final var result = execute("upsert", () -> client.getElasticsearchClient()
                .update(u -> u.index(indexName)
                                .id(stored.getId())
                                .doc(stored)
                                .docAsUpsert(true)
                                .refresh(Refresh.True),
                        ESMemoryDocument.class)
                .result());
        log.debug("Result of indexing memory {} for agent {}: {}", document.getId(), agentId, result);
    }

    @Override
    public List<MemoryDocument> fetch(String agentId, Collection<String> ids) {
        final var indexName = indexName();
        final var documents = new ArrayList<MemoryDocument>();
        for (final var day : ids) {
            final var doc = execute("fetch", () -> client.getElasticsearchClient()
                    .get(g -> g.index(indexName).id(documentId(agentId, day)), ESMemoryDocument.class));
            if (doc.found() && doc.source() != null) {
                documents.add(toWire(doc.source()));
            }
        }
        return documents;
    }

    @Override
    public List<MemorySearchResult> search(String agentId, String query, int limit) {
        final var indexName = indexName();
        final var response = execute("search", () -> client.getElasticsearchClient()
                .search(s -> s.index(indexName)
                                .size(limit)
                                .query(q -> q.bool(b -> b
                                        .filter(f -> f.term(t -> t.field(ESMemoryDocument.Fields.agentId)
                                                .value(agentId)))
                                        .must(m -> m.match(mt -> mt.field(ESMemoryDocument.Fields.text)
                                                .query(query))))),
                        ESMemoryDocument.class));
        return response.hits()
                .hits()
                .stream()
                .filter(hit -> null != hit.source())
                .map(hit -> new MemorySearchResult(hit.source().getDay(),
                                                   Objects.requireNonNullElse(hit.score(), 0.0),
                                                   toWire(hit.source())))
                .toList();
    }

    @Override
    public MemoryPage range(String agentId, String cursor, int limit) {
        final var indexName = indexName();
        final var response = execute("range", () -> client.getElasticsearchClient()
                .search(s -> {
                            s.index(indexName)
                                    .size(limit)
                                    .query(q -> q.term(t -> t.field(ESMemoryDocument.Fields.agentId).value(agentId)))
                                    .sort(so -> so.field(f -> f.field(ESMemoryDocument.Fields.day)
                                            .order(SortOrder.Asc)));
                            if (!Strings.isNullOrEmpty(cursor)) {
                                s.searchAfter(List.of(FieldValue.of(cursor)));
                            }
                            return s;
                        },
                        ESMemoryDocument.class));
        final var documents = response.hits()
                .hits()
                .stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .map(this::toWire)
                .toList();
        final var nextCursor = documents.size() < limit || documents.isEmpty()
                               ? null
                               : documents.get(documents.size() - 1).getId();
        return new MemoryPage(documents, nextCursor);
    }

    @Override
    public void reset(String agentId) {
        final var indexName = indexName();
        final var deleted = execute("reset", () -> client.getElasticsearchClient()
                .deleteByQuery(d -> d.index(indexName)
                        .query(q -> q.term(t -> t.field(ESMemoryDocument.Fields.agentId).value(agentId)))
                        .refresh(true))
                .deleted());
        log.info("Deleted {} memory documents for agent {}", deleted, agentId);
    }

    private void ensureIndex(IndexSettings indexSettings) {
        final var elasticsearchClient = client.getElasticsearchClient();
        final var indexName = indexName();
        if (Boolean.TRUE.equals(execute("index check",
                                        () -> elasticsearchClient.indices().exists(ex -> ex.index(indexName))
                                                .value()))) {
            log.info("Index {} already exists", indexName);
            return;
        }
        log.info("Creating index {}", indexName);
        final var creationStatus = execute("index creation", () -> elasticsearchClient.indices()
                .create(ex -> ex.index(indexName)
                        .mappings(mapping -> mapping
                                .properties(ESMemoryDocument.Fields.id, p -> p.keyword(t -> t))
                                .properties(ESMemoryDocument.Fields.agentId, p -> p.keyword(t -> t))
                                .properties(ESMemoryDocument.Fields.day, p -> p.keyword(t -> t))
                                .properties(ESMemoryDocument.Fields.text, p -> p.text(t -> t))
                                .properties(ESMemoryDocument.Fields.entries, p -> p.integer(t -> t))
                                .properties(ESMemoryDocument.Fields.createdAt, p -> p.date(t -> t))
                                .properties(ESMemoryDocument.Fields.updatedAt, p -> p.date(t -> t)))
                        .settings(s -> s.numberOfShards(Integer.toString(indexSettings.getShards()))
                                .numberOfReplicas(Integer.toString(indexSettings.getReplicas()))))
                .acknowledged());
        log.info("Index creation status for index {}: {}", indexName, creationStatus);
    }

    private <T> T execute(String operation, ESCall<T> call) {
        try {
            return call.call();
        }
        catch (IOException | ElasticsearchException e) {
            log.error("Elasticsearch {} on index {} failed: {}", operation, indexName(), e.getMessage());
            throw new CouncilException(CouncilError.error(ErrorType.STORAGE_FAILURE, e), e);
        }
    }

    private MemoryDocument toWire(ESMemoryDocument document) {
        return MemoryDocument.builder()
                .id(document.getDay())
                .agentId(document.getAgentId())
                .text(document.getText())
                .entries(document.getEntries())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    private ESMemoryDocument toStored(String agentId, MemoryDocument document) {
        return ESMemoryDocument.builder()
                .id(documentId(agentId, document.getId()))
                .agentId(agentId)
                .day(document.getId())
                .text(document.getText())
                .entries(document.getEntries())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }

    private static String documentId(String agentId, String day) {
        return UUID.nameUUIDFromBytes("%s-%s".formatted(agentId, day).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String indexName() {
        return Strings.isNullOrEmpty(indexPrefix) ? MEMORIES_INDEX : "%s.%s".formatted(indexPrefix, MEMORIES_INDEX);
    }
}
