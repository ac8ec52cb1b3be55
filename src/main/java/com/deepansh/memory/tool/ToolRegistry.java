package com.deepansh.memory.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for all MemoryTool implementations.
 *
 * Spring injects every MemoryTool bean; they are indexed by name for dispatch.
 * Failures, including unexpected exceptions, come back as "ERROR: ..." strings.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, MemoryTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<MemoryTool> toolBeans) {
        toolBeans.forEach(tool -> {
            MemoryTool previous = tools.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        log.info("Total tools registered: {}", tools.size());
    }

    /** Sorted by name. */
    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .sorted(Comparator.comparing(MemoryTool::getName))
                .map(ToolDefinition::from)
                .toList();
    }

    public String execute(String toolName, Map<String, Object> arguments) {
        MemoryTool tool = tools.get(toolName);

        if (tool == null) {
            String msg = String.format(
                    "ERROR: Unknown tool '%s'. Available tools: %s",
                    toolName, tools.keySet().stream().sorted().toList()
            );
            log.warn(msg);
            return msg;
        }

        log.info("Executing tool: [{}] with args: {}", toolName, arguments);

        try {
            String result = tool.execute(arguments == null ? Map.of() : arguments);
            log.debug("Tool [{}] returned: {}", toolName, result);
            return result;
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolName, e);
            return "ERROR: Tool execution failed: " + e.getMessage();
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
