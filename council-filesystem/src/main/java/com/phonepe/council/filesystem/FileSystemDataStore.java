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

package com.phonepe.council.filesystem;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Longs;
import com.google.common.util.concurrent.Striped;
import com.phonepe.council.core.errors.CouncilError;
import com.phonepe.council.core.errors.CouncilException;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.filesystem.utils.FileUtils;
import com.phonepe.council.session.DataStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Lock;

/**
 * A {@link DataStore} that keeps one file per key under a data directory. Sets and hashes are stored as JSON documents
 * and replaced atomically on write. Lists are stored as one JSON string per line and appended to.
 * <p>
 * Per key atomicity holds within one process only. Do not point two processes to the same directory.
 */
@Slf4j
public class FileSystemDataStore implements DataStore {
    private static final int MAX_ENCODED_KEY_LENGTH = 200;
    private static final TypeReference<TreeSet<String>> SET_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, String>> HASH_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path setsDir;
    private final Path hashesDir;
    private final Path listsDir;
    private final Striped<Lock> locks = Striped.lock(128);

    public FileSystemDataStore(String dataDir, ObjectMapper mapper) {
        final var root = FileUtils.ensurePath(dataDir, true);
        this.mapper = mapper;
        this.setsDir = FileUtils.ensurePath(root.resolve("sets").toString(), true);
        this.hashesDir = FileUtils.ensurePath(root.resolve("hashes").toString(), true);
        this.listsDir = FileUtils.ensurePath(root.resolve("lists").toString(), true);
        log.info("File system data store initialized at {}", root);
    }

    @Override
    public boolean exists(String key) {
        final var name = fileName(key);
        return Files.exists(setsDir.resolve(name))
                || Files.exists(hashesDir.resolve(name))
                || Files.exists(listsDir.resolve(name));
    }

    @Override
    public void addToSet(String key, String member) {
        locked(key, () -> {
            final var path = setsDir.resolve(fileName(key));
            final var members = readSet(path);
            if (members.add(member)) {
                FileUtils.replace(path, mapper.writeValueAsBytes(members));
            }
            return null;
        });
    }

    @Override
    public Set<String> setMembers(String key) {
        return locked(key, () -> Collections.unmodifiableSet(readSet(setsDir.resolve(fileName(key)))));
    }

    @Override
    public Map<String, String> getFields(String key) {
        return locked(key, () -> Collections.unmodifiableMap(readHash(hashesDir.resolve(fileName(key)))));
    }

    @Override
    public void setFields(String key, Map<String, String> fields) {
        locked(key, () -> {
            final var path = hashesDir.resolve(fileName(key));
            final var hash = readHash(path);
            hash.putAll(fields);
            FileUtils.replace(path, mapper.writeValueAsBytes(hash));
            return null;
        });
    }

    @Override
    public Map<String, Long> incrementFields(String key, Map<String, Long> deltas) {
        return locked(key, () -> {
            final var path = hashesDir.resolve(fileName(key));
            final var hash = readHash(path);
            final var result = new HashMap<String, Long>();
            deltas.forEach((field, delta) -> {
                final var current = Objects.requireNonNullElse(
                        Longs.tryParse(Strings.nullToEmpty(hash.get(field)).trim()), 0L);
                final var next = current + delta;
                hash.put(field, Long.toString(next));
                result.put(field, next);
            });
            FileUtils.replace(path, mapper.writeValueAsBytes(hash));
            return result;
        });
    }

    @Override
    public void append(String key, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        locked(key, () -> {
            final var lines = new StringBuilder();
            for (final var value : values) {
                lines.append(mapper.writeValueAsString(value)).append('\n');
            }
            FileUtils.append(listsDir.resolve(fileName(key)), lines.toString().getBytes(StandardCharsets.UTF_8));
            return null;
        });
    }

    @Override
    public List<String> readList(String key) {
        return locked(key, () -> {
            final var path = listsDir.resolve(fileName(key));
            if (!Files.exists(path)) {
                return List.of();
            }
            final var values = new ArrayList<String>();
            for (final var line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    values.add(mapper.readValue(line, String.class));
                }
            }
            return Collections.unmodifiableList(values);
        });
    }

    @Override
    public void delete(String key) {
        locked(key, () -> {
            final var name = fileName(key);
            Files.deleteIfExists(setsDir.resolve(name));
            Files.deleteIfExists(hashesDir.resolve(name));
            Files.deleteIfExists(listsDir.resolve(name));
            return null;
        });
    }

    /**
     * Keys contain characters that are not valid in file names. Keys are base32 encoded, or hashed when too long.
     */
    static String fileName(String key) {
        final var encoded = BaseEncoding.base32Hex()
                .omitPadding()
                .encode(key.getBytes(StandardCharsets.UTF_8))
                .toLowerCase(Locale.ROOT);
        if (encoded.length() <= MAX_ENCODED_KEY_LENGTH) {
            return encoded;
        }
        return "h-" + Hashing.sha256().hashString(key, StandardCharsets.UTF_8);
    }

    private TreeSet<String> readSet(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new TreeSet<>();
        }
        return mapper.readValue(path.toFile(), SET_TYPE);
    }

    private LinkedHashMap<String, String> readHash(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(path.toFile(), HASH_TYPE);
    }

    private <T> T locked(String key, Callable<T> action) {
        final var lock = locks.get(key);
        lock.lock();
        try {
            return action.call();
        }
        catch (IOException e) {
            log.error("Storage operation on key {} failed: {}", key, e.getMessage());
            throw new CouncilException(CouncilError.error(ErrorType.STORAGE_FAILURE, e), e);
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new CouncilException(CouncilError.error(ErrorType.STORAGE_FAILURE, e), e);
        }
        finally {
            lock.unlock();
        }
    }
}
