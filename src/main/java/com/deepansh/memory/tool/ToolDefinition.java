package com.deepansh.memory.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema, for callers that advertise the
 * available tools.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(MemoryTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }
}
