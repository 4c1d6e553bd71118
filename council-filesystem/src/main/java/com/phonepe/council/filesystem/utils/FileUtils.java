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

package com.phonepe.council.filesystem.utils;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable and writable directory. If the path does not exist and
     * createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid, does not have the required permissions, or cannot be
     *                                  created when requested.
     */
    public static Path ensurePath(String path, boolean createIfNotExists) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.info("Created data directory {}", absolutePath);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException(
                    "Sanity check for %s Failed. Please check it is a directory and has the required permissions"
                            .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Appends data to a file in a single write, creating the file if needed
     */
    public static void append(Path filePath, byte[] data) throws IOException {
        Files.write(filePath, data, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /**
     * Replaces the contents of a file. Data is written to a temporary file in the same directory which is then moved
     * over the target, so readers see either the old or the new contents.
     */
    public static void replace(Path filePath, byte[] data) throws IOException {
        final var temp = Files.createTempFile(filePath.getParent(), filePath.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, data, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }
}
