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

import java.util.Collection;
import java.util.List;

/**
 * Searchable storage for memory documents. Documents of different agents are never visible to each other.
 */
public interface MemoryIndex {
    /**
     * Creates or replaces the document with the same id for the agent
     */
    void upsert(String agentId, MemoryDocument document);

    /**
     * Documents with the given ids. Missing ids are skipped.
     */
    List<MemoryDocument> fetch(String agentId, Collection<String> ids);

    /**
     * Relevance ranked documents for the query, best first
     */
    List<MemorySearchResult> search(String agentId, String query, int limit);

    /**
     * Pages through all documents of the agent
     *
     * @param cursor Null or empty for the first page, otherwise {@link MemoryPage#getNextCursor()} of the previous page
     */
    MemoryPage range(String agentId, String cursor, int limit);

    /**
     * Deletes all documents of the agent
     */
    void reset(String agentId);
}
