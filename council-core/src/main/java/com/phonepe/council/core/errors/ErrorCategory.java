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

/**
 * Coarse classification of errors as seen by callers. Lets a caller tell "fix your input" apart from "try again
 * later" without looking at individual {@link ErrorType}s.
 */
public enum ErrorCategory {
    INVALID_INPUT,
    NOT_FOUND,
    CONFLICT,
    UPSTREAM,
    STREAMING_IO,
    STORAGE,
    /**
     * Outcome of a tool run. These are recorded in the transcript and fed back to the model, never thrown.
     */
    TOOL,
}
