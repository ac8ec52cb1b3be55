package com.deepansh.memory.tool.impl;

import com.deepansh.memory.context.DuplicateCandidate;
import com.deepansh.memory.context.MatchType;
import com.deepansh.memory.core.KnowledgeService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.PromoteKnowledgeRequest;
import com.deepansh.memory.core.PromotionOutcome;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Promotes a finding to project knowledge. A detected duplicate is reported,
 * not written, unless allowDuplicate is set.
 */
@Component
@RequiredArgsConstructor
public class PromoteKnowledgeTool implements MemoryTool {

    private final KnowledgeService knowledgeService;

    @Override
    public String getName() {
        return "promote_knowledge";
    }

    @Override
    public String getDescription() {
        return """
                Save a decision, pattern, resolved error or milestone as durable project knowledge.
                Near-identical knowledge is detected and reported instead of stored twice.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("projectPath", Map.of("type", "string", "description", "Project root path"));
        properties.put("title", Map.of("type", "string", "description", "Short title for this knowledge"));
        properties.put("content", Map.of("type", "string",
                "description", "Detailed content (decision rationale, pattern description, etc.)"));
        properties.put("knowledgeType", Map.of("type", "string",
                "enum", List.of("decision", "pattern", "error_resolved", "milestone"),
                "description", "Type of knowledge"));
        properties.put("tags", Map.of("type", "array", "items", Map.of("type", "string"),
                "description", "Tags for categorization"));
        properties.put("sessionId", Map.of("type", "string", "description", "Source session ID"));
        properties.put("sourceEventId", Map.of("type", "string", "description", "Source event ID"));
        properties.put("allowDuplicate", Map.of("type", "boolean",
                "description", "Force promotion even if a duplicate is detected"));
        properties.put("supersedes", Map.of("type", "string",
                "description", "Knowledge ID this replaces (the old item is marked superseded)"));
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", List.of("projectPath", "title", "content", "knowledgeType")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        PromoteKnowledgeRequest request;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            request = PromoteKnowledgeRequest.builder()
                    .projectPath(args.requireString("projectPath"))
                    .title(args.requireString("title"))
                    .content(args.requireString("content"))
                    .knowledgeType(KnowledgeType.fromValue(args.requireString("knowledgeType")))
                    .tags(args.stringList("tags"))
                    .sessionId(args.optionalString("sessionId"))
                    .sourceEventId(args.optionalString("sourceEventId"))
                    .allowDuplicate(args.flag("allowDuplicate"))
                    .supersedes(args.optionalString("supersedes"))
                    .build();
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<PromotionOutcome> result = knowledgeService.promote(request);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }

        PromotionOutcome outcome = result.value();
        if (outcome.isDuplicate()) {
            DuplicateCandidate dup = outcome.duplicate();
            String kind = dup.matchType() == MatchType.EXACT ? "identical content" : "similar title";
            return String.join("\n",
                    String.format("Duplicate detected (%s, similarity: %.0f%%):", kind, dup.similarity() * 100),
                    "  Existing: [" + dup.existing().getKnowledgeType().value() + "] " + dup.existing().getTitle(),
                    "  ID: " + dup.existing().getKnowledgeId(),
                    "",
                    "To promote anyway, set allowDuplicate: true",
                    "To supersede the existing item, set supersedes: \"<knowledge_id>\"");
        }

        PromotedKnowledge k = outcome.knowledge();
        List<String> lines = new ArrayList<>();
        lines.add("Knowledge promoted: " + k.getTitle() + " (" + k.getKnowledgeId() + ")");
        lines.add("Type: " + k.getKnowledgeType().value());
        if (k.getBranch() != null) {
            lines.add("Branch: " + k.getBranch());
        }
        lines.add("");
        lines.add("Project now has " + outcome.projectTotal() + " promoted knowledge item(s).");
        if (outcome.supersededId() != null) {
            lines.add("Superseded: " + outcome.supersededId());
        }
        return String.join("\n", lines);
    }
}
