package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.KnowledgeService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.model.KnowledgeUsage;
import com.deepansh.memory.model.UsageType;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reports that a knowledge item was recalled or applied in a session, which
 * feeds its ranking and the project's value metrics.
 */
@Component
@RequiredArgsConstructor
public class UseKnowledgeTool implements MemoryTool {

    private final KnowledgeService knowledgeService;

    @Override
    public String getName() {
        return "use_knowledge";
    }

    @Override
    public String getDescription() {
        return """
                Record that a knowledge item was used in a session: 'recalled' when consulted,
                'applied' when a pattern or error resolution was put into practice.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "knowledgeId", Map.of("type", "string", "description", "Knowledge item ID"),
                        "sessionId", Map.of("type", "string", "description", "Session in which it was used"),
                        "usageType", Map.of("type", "string",
                                "enum", List.of("surfaced", "recalled", "applied"),
                                "description", "How it was used")
                ),
                "required", List.of("knowledgeId", "sessionId", "usageType")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String knowledgeId;
        String sessionId;
        UsageType usageType;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            knowledgeId = args.requireString("knowledgeId");
            sessionId = args.requireString("sessionId");
            usageType = UsageType.fromValue(args.requireString("usageType"));
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<KnowledgeUsage> result = knowledgeService.recordUsage(knowledgeId, sessionId, usageType);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }
        return "Knowledge usage recorded: " + usageType.value() + " " + knowledgeId
                + " (" + result.value().getUsageId() + ")";
    }
}
