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

package com.phonepe.council.core.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;
import com.phonepe.council.core.errors.CouncilException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Transports supported for remote tool servers
 */
@Getter
@AllArgsConstructor
public enum TransportType {
    /**
     * Streamable HTTP
     */
    HTTP("http"),
    /**
     * Server sent events
     */
    SSE("sse"),
    ;

    @JsonValue
    private final String value;

    /**
     * Parses a stored or user supplied transport. Missing values default to {@link #HTTP}.
     *
     * @throws CouncilException with {@link com.phonepe.council.core.errors.ErrorType#INVALID_INPUT} for anything
     *                          else
     */
    @JsonCreator
    public static TransportType fromValue(String value) {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            return HTTP;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "http", "streamable-http", "streamable_http", "http-streaming" -> HTTP;
            case "sse", "server-sent-events" -> SSE;
            default -> throw CouncilException.invalidInput("Unsupported transport: " + value);
        };
    }
}
