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

package com.phonepe.council.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Various small utilities used across modules
 */
@UtilityClass
public class AgentUtils {
    private static final String INVALID_NAME_CHARS = "[^A-Za-z0-9_]";
    private static final Pattern CHECKSUM_SUFFIX = Pattern.compile(".*_[0-9a-f]{8}");

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public static <T> T safeGet(Supplier<T> supplier, T defaultValue) {
        return Objects.requireNonNullElse(supplier.get(), defaultValue);
    }

    public static int safeGetInt(Supplier<Integer> supplier, int defaultValue) {
        return safeGet(supplier, defaultValue);
    }

    public static int safeGetInt(Supplier<Integer> supplier) {
        return safeGetInt(supplier, 0);
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with {@code _}
     */
    public static String sanitizeName(String input) {
        return Strings.nullToEmpty(input).replaceAll(INVALID_NAME_CHARS, "_");
    }

    /**
     * Sanitized form of the input that stays distinct for distinct inputs. If sanitizing changed the input, or the
     * input already ends like a checksum suffix, a hex CRC32 of the raw value is appended. Names returned unchanged
     * therefore never end in {@code _xxxxxxxx}, so they cannot clash with suffixed ones.
     */
    public static String uniqueSanitizedName(String input) {
        final var raw = Strings.nullToEmpty(input);
        final var sanitized = sanitizeName(raw);
        if (sanitized.equals(raw) && !CHECKSUM_SUFFIX.matcher(raw).matches()) {
            return sanitized;
        }
        final var crc = new CRC32();
        crc.update(raw.getBytes(StandardCharsets.UTF_8));
        return "%s_%08x".formatted(sanitized, crc.getValue());
    }

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isBlank(String value) {
        return Strings.isNullOrEmpty(value) || value.isBlank();
    }
}
