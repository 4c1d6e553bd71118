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

import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Loads variables from a {@code .env} file (if present) or the environment. The file name can be changed using the
 * {@code dotenv.file} system property.
 */
@UtilityClass
public class EnvLoader {
    private static final Dotenv DOTENV = Dotenv.configure()
            .filename(Objects.requireNonNullElse(System.getProperty("dotenv.file"), ".env"))
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    /**
     * Reads a variable
     *
     * @param variable the name of the variable
     * @return the value of the variable, if set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(readEnv(DOTENV, variable, null));
    }

    /**
     * Reads a variable, falling back to a default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(DOTENV, variable, defaultValue);
    }

    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromFile = dotenv.get(variable);
        if (null != fromFile) {
            return fromFile;
        }
        return Objects.requireNonNullElse(System.getenv(variable), defaultValue);
    }
}
