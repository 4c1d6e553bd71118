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

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.council.core.errors.ErrorType;
import com.phonepe.council.core.model.ModelRunContext;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.function.TriFunction;

/**
 * A tool whose implementation lives outside this process. The parameter schema is supplied by the source and passed
 * to the model as is.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExternalTool extends ExecutableTool {
    public record ExternalToolResponse(Object response,
                                       ErrorType error) {
    }

    JsonNode parameterSchema;

    /**
     * Called with the run context, the advertised tool id and the raw JSON arguments
     */
    TriFunction<ModelRunContext, String, String, ExternalToolResponse> callable;

    public ExternalTool(
            ToolDefinition toolDefinition,
            JsonNode parameterSchema,
            TriFunction<ModelRunContext, String, String, ExternalToolResponse> callable) {
        super(toolDefinition);
        this.parameterSchema = parameterSchema;
        this.callable = callable;
    }

    /**
     * Copy of this tool advertised under a different id. Used to scope remote tools.
     */
    public ExternalTool withId(String id) {
        return new ExternalTool(getToolDefinition().withId(id), parameterSchema, callable);
    }

    @Override
    public <T> T accept(ExecutableToolVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
