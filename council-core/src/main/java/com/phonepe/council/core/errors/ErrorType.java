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

package com.phonepe.council.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure types along with their message template, retryability and category
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false, ErrorCategory.TOOL),
    INVALID_INPUT("Invalid input: %s", false, ErrorCategory.INVALID_INPUT),
    NOT_FOUND("Not found: %s", false, ErrorCategory.NOT_FOUND),
    CONFLICT("Conflict: %s", false, ErrorCategory.CONFLICT),
    STORAGE_FAILURE("Storage operation failed: %s", true, ErrorCategory.STORAGE),
    TOOL_DISCOVERY_FAILURE("Could not load tools from server %s: %s", true, ErrorCategory.UPSTREAM),
    NO_RESPONSE("No response", true, ErrorCategory.UPSTREAM),
    REFUSED("Refused: Reason: %s", false, ErrorCategory.UPSTREAM),
    FILTERED("Content filtered", false, ErrorCategory.UPSTREAM),
    LENGTH_EXCEEDED("Content length exceeded", false, ErrorCategory.UPSTREAM),
    UNKNOWN_FINISH_REASON("Unknown finish reason: %s", true, ErrorCategory.UPSTREAM),
    GENERIC_MODEL_CALL_FAILURE("Model call failed with error: %s", true, ErrorCategory.UPSTREAM),
    MODEL_CALL_COMMUNICATION_ERROR("Network error: %s", true, ErrorCategory.UPSTREAM),
    MODEL_CALL_RATE_LIMIT_EXCEEDED("Rate limit exceeded: %s", true, ErrorCategory.UPSTREAM),
    MODEL_CALL_HTTP_FAILURE("Error making HTTP Call: %s", true, ErrorCategory.UPSTREAM),
    MAX_ITERATIONS_EXCEEDED("Model did not finish within %d iterations", false, ErrorCategory.UPSTREAM),
    STREAMING_IO_FAILURE("Could not stream output to caller: %s", false, ErrorCategory.STREAMING_IO),
    TOOL_CALL_PERMANENT_FAILURE("Tool call failed permanently for tool: %s", false, ErrorCategory.TOOL),
    TOOL_CALL_TEMPORARY_FAILURE("Tool call failed temporarily for tool: %s", true, ErrorCategory.TOOL),
    TOOL_CALL_APPROVAL_DENIED("Tool call was not approved for tool: %s", false, ErrorCategory.TOOL),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", true, ErrorCategory.TOOL),
    ;

    private final String message;
    private final boolean retryable;
    private final ErrorCategory category;
}
