package com.deepansh.sectools.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema as published to clients.
 * Decouples the wire format from the SecurityTool implementation.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(SecurityTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription().strip())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /**
     * MCP tools/list entry: { "name", "description", "inputSchema" }
     */
    public Map<String, Object> toMcpSchema() {
        return Map.of(
                "name", name,
                "description", description,
                "inputSchema", inputSchema
        );
    }
}
