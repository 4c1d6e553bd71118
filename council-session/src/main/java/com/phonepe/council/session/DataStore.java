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

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Key value storage used to persist agents and sessions. Values are sets, hashes or lists of strings. Implementations
 * must make every single operation atomic for its key. Failures are reported as
 * {@link com.phonepe.council.core.errors.CouncilException} with
 * {@link com.phonepe.council.core.errors.ErrorType#STORAGE_FAILURE}.
 */
public interface DataStore {
    /**
     * True if any value is stored against the key
     */
    boolean exists(String key);

    void addToSet(String key, String member);

    /**
     * Members of a set. Empty if the key is missing.
     */
    Set<String> setMembers(String key);

    /**
     * All fields of a hash. Empty if the key is missing.
     */
    Map<String, String> getFields(String key);

    /**
     * Sets the given fields of a hash, leaving others untouched
     */
    void setFields(String key, Map<String, String> fields);

    /**
     * Adds the deltas to the given fields of a hash in one step. Missing or non-numeric fields count as zero.
     *
     * @return New values of the incremented fields
     */
    Map<String, Long> incrementFields(String key, Map<String, Long> deltas);

    /**
     * Appends values to the end of a list in the given order
     */
    void append(String key, List<String> values);

    /**
     * Full contents of a list, oldest first. Empty if the key is missing.
     */
    List<String> readList(String key);

    void delete(String key);
}
