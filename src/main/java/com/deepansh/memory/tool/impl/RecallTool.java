package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.HistoryService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.RecallQuery;
import com.deepansh.memory.core.RecallResult;
import com.deepansh.memory.core.SessionDigest;
import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionEvent;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RecallTool implements MemoryTool {

    private final HistoryService historyService;

    @Override
    public String getName() {
        return "recall";
    }

    @Override
    public String getDescription() {
        return """
                Search past sessions of a project by summary text, optionally on one branch.
                With only an eventType, lists the most recent events of that type instead.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "projectPath", Map.of("type", "string", "description", "Project root path to search"),
                        "query", Map.of("type", "string", "description", "Search term for session summaries"),
                        "branch", Map.of("type", "string", "description", "Filter by git branch"),
                        "eventType", Map.of("type", "string",
                                "enum", List.of("file_read", "file_write", "file_edit", "tool_call",
                                        "decision", "pattern", "error_resolved", "milestone"),
                                "description", "Filter by event type"),
                        "limit", Map.of("type", "integer", "minimum", 1, "maximum", 50,
                                "description", "Max results (default 10)")
                ),
                "required", List.of("projectPath")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        RecallQuery query;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            Integer limit = args.optionalInt("limit");
            query = RecallQuery.builder()
                    .projectPath(args.requireString("projectPath"))
                    .query(args.optionalString("query"))
                    .branch(args.optionalString("branch"))
                    .eventType(args.optionalValue("eventType", EventType::fromValue))
                    .limit(limit == null ? RecallQuery.DEFAULT_LIMIT : limit)
                    .build();
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<RecallResult> result = historyService.recall(query);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }
        return render(query, result.value());
    }

    private String render(RecallQuery query, RecallResult result) {
        if (result.eventMode()) {
            String type = result.eventType().value();
            if (result.events().isEmpty()) {
                return "No " + type + " events found for " + query.getProjectPath() + ".";
            }
            List<String> lines = new ArrayList<>();
            lines.add("Recent " + type + " events (" + result.events().size() + "):");
            for (SessionEvent e : result.events()) {
                lines.add("  [" + e.getTimestamp() + "] " + e.getDetail().describe());
            }
            return String.join("\n", lines);
        }

        if (result.sessions().isEmpty()) {
            String matching = query.getQuery() != null && !query.getQuery().isBlank()
                    ? " matching \"" + query.getQuery() + "\""
                    : "";
            return "No sessions found for " + query.getProjectPath() + matching + ".";
        }

        List<String> lines = new ArrayList<>();
        lines.add("Found " + result.sessions().size() + " session(s):");
        for (SessionDigest digest : result.sessions()) {
            Session s = digest.session();
            lines.add("");
            lines.add("Session: " + s.getSessionId());
            lines.add("  Branch: " + s.getBranch() + " | " + s.getStartedAt()
                    + (s.getEndedAt() != null ? " - " + s.getEndedAt() : ""));
            lines.add("  Status: " + s.getStatus().value());
            if (s.getSummary() != null) {
                lines.add("  Summary: " + s.getSummary());
            }
            for (SessionEvent e : digest.highlights()) {
                lines.add("  [" + e.getEventType().value() + "] " + e.getDetail().describe());
            }
        }
        return String.join("\n", lines);
    }
}
