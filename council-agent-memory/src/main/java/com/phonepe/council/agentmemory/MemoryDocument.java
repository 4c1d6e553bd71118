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

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Memory notes written by an agent on one day
 */
@Value
@Builder
@With
@Jacksonized
@JsonClassDescription("Notes an agent recorded on one day")
public class MemoryDocument {
    @JsonPropertyDescription("Day the notes were written on in YYYY-MM-DD format (UTC)")
    String id;

    @JsonPropertyDescription("Agent that owns the notes")
    String agentId;

    @JsonPropertyDescription("Notes, one per line, each prefixed with the time it was recorded")
    String text;

    @JsonPropertyDescription("Number of notes recorded on the day")
    int entries;

    @JsonPropertyDescription("When the first note of the day was recorded")
    Instant createdAt;

    @JsonPropertyDescription("When the last note of the day was recorded")
    Instant updatedAt;
}
