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

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.google.common.base.CaseFormat;
import com.google.common.base.Strings;
import com.phonepe.council.core.model.ModelRunContext;
import com.phonepe.council.core.tools.*;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.util.*;
import java.util.function.Function;

import static java.util.stream.Collectors.toMap;

/**
 * Reads tools from a class and creates a map of tool names to the tools
 */
@Slf4j
@UtilityClass
public class ToolUtils {
    public static Map<String, ExecutableTool> readTools(String prefix, Object instance) {
        Class<?> type = instance.getClass();
        final var tools = new HashMap<String, ExecutableTool>();
        while (type != Object.class) { // Traverse up till we reach Object
            final var className = type.getSimpleName();
            tools.putAll(Arrays.stream(type.getDeclaredMethods())
                                 .filter(method -> method.isAnnotationPresent(Tool.class))
                                 .map(method -> {
                                     final var metadata = toolMetadata(prefix, method);
                                     final var tool = new InternalTool(metadata.getFirst(),
                                                                       metadata.getSecond(),
                                                                       instance);
                                     log.debug("Created tool: {} from {}::{}",
                                               tool.getToolDefinition().getId(),
                                               className,
                                               method.getName());
                                     return tool;
                                 })
                                 .collect(toMap(tool -> tool.getToolDefinition().getId(), Function.identity())));
            type = type.getSuperclass();
        }
        return tools;
    }

    public static Pair<ToolDefinition, ToolMethodInfo> toolMetadata(String prefix, Method method) {
        final var toolDef = method.getAnnotation(Tool.class);
        final var params = new ArrayList<ToolParameter>();
        final var paramTypes = method.getParameterTypes();
        final var declParams = method.getParameters();
        boolean hasContext = false;
        for (var i = 0; i < declParams.length; i++) {
            final var paramType = paramTypes[i];
            final var param = declParams[i];
            if (paramType.equals(ModelRunContext.class)) {
                hasContext = true;
                continue;
            }

            final var paramAnnotation = param.getAnnotation(JsonPropertyDescription.class);
            final var description = (null != paramAnnotation) ? paramAnnotation.value() : "";
            params.add(new ToolParameter(param.getName(),
                                         description,
                                         TypeFactory.defaultInstance().constructType(paramType)));
        }
        final var methodName = toolDef.name().isBlank() ? method.getName() : toolDef.name();
        final var baseName = CaseFormat.LOWER_CAMEL.converterTo(CaseFormat.LOWER_UNDERSCORE).convert(methodName);
        final var toolName = Strings.isNullOrEmpty(prefix) ? baseName : prefix + "_" + baseName;
        return Pair.of(
                ToolDefinition.builder()
                        .id(toolName)
                        .name(methodName)
                        .description(toolDef.value())
                        .contextAware(hasContext)
                        .strictSchema(true)
                        .build(),
                new ToolMethodInfo(params,
                                   method,
                                   method.getReturnType()));
    }

    @SneakyThrows
    public static List<Object> convertToRealParams(
            ToolMethodInfo methodInfo,
            String params,
            ObjectMapper objectMapper) {
        final var paramNodes = objectMapper.readTree(Strings.isNullOrEmpty(params) ? "{}" : params);
        return methodInfo.parameters()
                .stream()
                .map(param -> {
                    final var paramNode = paramNodes.get(param.getName());
                    return objectMapper.convertValue(paramNode, param.getType());
                })
                .toList();
    }
}
