package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.HistoryService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.model.SessionStats;
import com.deepansh.memory.model.StatsPeriod;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StatsTool implements MemoryTool {

    private final HistoryService historyService;

    @Override
    public String getName() {
        return "stats";
    }

    @Override
    public String getDescription() {
        return "Session statistics for a project over a period: time spent, most-touched files, event categories.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "projectPath", Map.of("type", "string", "description", "Project root path"),
                        "period", Map.of("type", "string",
                                "enum", List.of("day", "week", "month", "all"),
                                "description", "Time period (default: week)")
                ),
                "required", List.of("projectPath")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String projectPath;
        StatsPeriod period;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            projectPath = args.requireString("projectPath");
            period = StatsPeriod.fromValue(args.optionalString("period"));
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<SessionStats> result = historyService.stats(projectPath, period);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }

        SessionStats stats = result.value();
        List<String> lines = new ArrayList<>(List.of(
                "Project stats for " + projectPath + " (" + stats.getPeriod().value() + "):",
                "",
                "Sessions: " + stats.getTotalSessions(),
                "Total time: " + Formats.duration(stats.getTotalDurationSecs()),
                "Patterns discovered: " + stats.getPatternsDiscovered()));

        if (!stats.getTopFiles().isEmpty()) {
            lines.add("");
            lines.add("Most-touched files:");
            stats.getTopFiles().forEach(f -> lines.add("  " + f.path() + " (" + f.touches() + ")"));
        }
        if (!stats.getCategoryBreakdown().isEmpty()) {
            lines.add("");
            lines.add("Event categories:");
            stats.getCategoryBreakdown().forEach(c -> lines.add("  " + c.category().value() + ": " + c.count()));
        }
        if (!stats.getAgentBreakdown().isEmpty()) {
            lines.add("");
            lines.add("Agents:");
            stats.getAgentBreakdown().forEach(a ->
                    lines.add("  " + a.agentType().displayName() + ": " + a.sessions() + " session(s)"));
        }
        return String.join("\n", lines);
    }
}
