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

import com.google.common.primitives.Longs;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link DataStore} that keeps everything on heap. Contents are lost on restart.
 */
@Slf4j
public class InMemoryDataStore implements DataStore {
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final Map<String, List<String>> lists = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String key) {
        return sets.containsKey(key) || hashes.containsKey(key) || lists.containsKey(key);
    }

    @Override
    public void addToSet(String key, String member) {
        sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(member);
    }

    @Override
    public Set<String> setMembers(String key) {
        final var members = sets.get(key);
        return null == members ? Set.of() : Set.copyOf(members);
    }

    @Override
    public Map<String, String> getFields(String key) {
        final var fields = hashes.get(key);
        if (null == fields) {
            return Map.of();
        }
        synchronized (fields) {
            return Map.copyOf(fields);
        }
    }

    @Override
    public void setFields(String key, Map<String, String> fields) {
        hashes.compute(key, (k, existing) -> {
            final var updated = null == existing ? new HashMap<String, String>() : existing;
            synchronized (updated) {
                updated.putAll(fields);
            }
            return updated;
        });
    }

    @Override
    public Map<String, Long> incrementFields(String key, Map<String, Long> deltas) {
        final var result = new HashMap<String, Long>();
        hashes.compute(key, (k, existing) -> {
            final var updated = null == existing ? new HashMap<String, String>() : existing;
            synchronized (updated) {
                deltas.forEach((field, delta) -> {
                    final var current = Objects.requireNonNullElse(
                            Longs.tryParse(Objects.requireNonNullElse(updated.get(field), "0")), 0L);
                    final var next = current + delta;
                    updated.put(field, Long.toString(next));
                    result.put(field, next);
                });
            }
            return updated;
        });
        return result;
    }

    @Override
    public void append(String key, List<String> values) {
        lists.compute(key, (k, existing) -> {
            final var updated = null == existing ? new ArrayList<String>() : existing;
            synchronized (updated) {
                updated.addAll(values);
            }
            return updated;
        });
    }

    @Override
    public List<String> readList(String key) {
        final var values = lists.get(key);
        if (null == values) {
            return List.of();
        }
        synchronized (values) {
            return List.copyOf(values);
        }
    }

    @Override
    public void delete(String key) {
        log.debug("Deleting key {}", key);
        sets.remove(key);
        hashes.remove(key);
        lists.remove(key);
    }
}
