package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.KnowledgeService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GetKnowledgeTool implements MemoryTool {

    private final KnowledgeService knowledgeService;

    @Override
    public String getName() {
        return "get_knowledge";
    }

    @Override
    public String getDescription() {
        return "List a project's promoted knowledge, newest first, optionally of one type.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "projectPath", Map.of("type", "string", "description", "Project root path"),
                        "knowledgeType", Map.of("type", "string",
                                "enum", List.of("decision", "pattern", "error_resolved", "milestone"),
                                "description", "Filter by knowledge type"),
                        "limit", Map.of("type", "integer", "minimum", 1, "maximum", 100,
                                "description", "Max results (default 20)")
                ),
                "required", List.of("projectPath")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String projectPath;
        KnowledgeType type;
        Integer limit;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            projectPath = args.requireString("projectPath");
            type = args.optionalValue("knowledgeType", KnowledgeType::fromValue);
            limit = args.optionalInt("limit");
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<List<PromotedKnowledge>> result = knowledgeService.list(projectPath, type, limit);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }

        List<PromotedKnowledge> items = result.value();
        if (items.isEmpty()) {
            return "No promoted knowledge found for " + projectPath + ".";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Project knowledge (" + items.size() + " items):");
        for (PromotedKnowledge k : items) {
            lines.add("");
            lines.add("[" + k.getKnowledgeType().value() + "] " + k.getTitle() + " (" + k.getKnowledgeId() + ")");
            lines.add("  " + k.getContent());
            if (!k.getTags().isEmpty()) {
                lines.add("  Tags: " + String.join(", ", k.getTags()));
            }
            if (k.getUsageCount() > 0) {
                lines.add("  Used: " + k.getUsageCount() + " time(s)");
            }
        }
        return String.join("\n", lines);
    }
}
