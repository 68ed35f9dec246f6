package com.deepansh.sectools.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One inbound tool invocation. Built per request, never stored.
 */
@Value
@Builder
public class ToolCall {

    String toolName;

    @Builder.Default
    Map<String, Object> arguments = Map.of();

    public static ToolCall of(String toolName, Map<String, Object> arguments) {
        return ToolCall.builder()
                .toolName(toolName)
                .arguments(arguments != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                        : Map.of())
                .build();
    }
}
