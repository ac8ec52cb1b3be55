package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.EndSessionRequest;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.SessionLifecycleService;
import com.deepansh.memory.model.SessionMetrics;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SessionEndTool implements MemoryTool {

    private final SessionLifecycleService lifecycleService;

    @Override
    public String getName() {
        return "session_end";
    }

    @Override
    public String getDescription() {
        return "End an active session with an optional summary and get its activity metrics.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "sessionId", Map.of("type", "string", "description", "Session ID to end"),
                        "summary", Map.of("type", "string", "description", "Summary of what was accomplished"),
                        "gitCommit", Map.of("type", "string", "description", "HEAD commit SHA at session end")
                ),
                "required", List.of("sessionId")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        EndSessionRequest request;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            request = EndSessionRequest.builder()
                    .sessionId(args.requireString("sessionId"))
                    .summary(args.optionalString("summary"))
                    .gitCommit(args.optionalString("gitCommit"))
                    .build();
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<SessionMetrics> result = lifecycleService.endSession(request);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }

        SessionMetrics m = result.value();
        List<String> lines = new ArrayList<>(List.of(
                "Session " + request.getSessionId() + " completed.",
                "",
                "Duration: " + Formats.duration(m.getDurationSecs()),
                "Events: " + m.getEventsTotal(),
                "Files read: " + m.getFilesRead() + " | modified: " + m.getFilesModified(),
                "Decisions: " + m.getDecisionsRecorded() + " | Patterns: " + m.getPatternsDiscovered(),
                "Errors resolved: " + m.getErrorsResolved()));
        if (request.getSummary() != null) {
            lines.add("");
            lines.add("Summary: " + request.getSummary());
        }
        return String.join("\n", lines);
    }
}
