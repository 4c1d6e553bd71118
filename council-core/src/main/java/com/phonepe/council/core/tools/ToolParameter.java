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

package com.phonepe.council.core.tools;

import com.fasterxml.jackson.databind.JavaType;
import lombok.NonNull;
import lombok.Value;

/**
 * Parameter to a tool that will be called by the LLM
 */
@Value
public class ToolParameter {
    @NonNull
    String name;
    @NonNull
    String description;
    @NonNull
    JavaType type;
}
