package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.HistoryService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.ValueReport;
import com.deepansh.memory.model.AgentInfo;
import com.deepansh.memory.model.KnowledgeCounts;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.ValueMetrics;
import com.deepansh.memory.model.ValueSummary;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ValueMetricsTool implements MemoryTool {

    private final HistoryService historyService;

    @Override
    public String getName() {
        return "value_metrics";
    }

    @Override
    public String getDescription() {
        return "Estimate the time and money the stored history has saved for a project.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "projectPath", Map.of("type", "string", "description", "Project root path"),
                        "hourlyRate", Map.of("type", "number",
                                "description", "Hourly rate for the value calculation (default 50)")
                ),
                "required", List.of("projectPath")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String projectPath;
        Double hourlyRate;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            projectPath = args.requireString("projectPath");
            hourlyRate = args.optionalDouble("hourlyRate");
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<Optional<ValueReport>> result = historyService.valueReport(projectPath, hourlyRate);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }
        if (result.value().isEmpty()) {
            return "No data yet for " + projectPath + ". Start a session to begin tracking value.";
        }

        ValueReport report = result.value().get();
        ValueMetrics metrics = report.metrics();
        KnowledgeCounts counts = report.knowledge();
        ValueSummary summary = report.summary();

        List<String> lines = new ArrayList<>(List.of(
                "--- Session Memory Value Report ---",
                "Project: " + projectPath,
                "",
                "Sessions tracked: " + metrics.getTotalSessions(),
                "Sessions that reused context: " + metrics.getContextReuseCount(),
                String.format("Knowledge items: %d (%d decisions, %d patterns, %d errors resolved)",
                        counts.total(),
                        counts.byType().get(KnowledgeType.DECISION),
                        counts.byType().get(KnowledgeType.PATTERN),
                        counts.byType().get(KnowledgeType.ERROR_RESOLVED)),
                "",
                "Value delivered:",
                "  Knowledge surfaced: " + summary.knowledgeSurfaced() + " times across sessions",
                "  Decisions recalled: " + summary.decisionsRecalled() + " times",
                "  Patterns applied: " + summary.patternsApplied() + " times",
                "  Errors prevented (same error resolved before): " + summary.errorsPrevented() + " times",
                "",
                "Time savings estimate:",
                String.format("  %s saved (~$%.2f at $%s/hr)",
                        Formats.minutes(summary.timeSavedMinutes()),
                        summary.estimatedValue(),
                        formatRate(summary.hourlyRate())),
                "",
                "Calculation basis:",
                "  Each knowledge surface: ~" + ValueMetrics.SECS_PER_SURFACED / 60 + " min saved",
                "  Each decision recall: ~" + ValueMetrics.SECS_PER_DECISION_RECALL / 60 + " min saved",
                "  Each pattern application: ~" + ValueMetrics.SECS_PER_PATTERN_APPLIED / 60 + " min saved",
                "  Each error prevention: ~" + ValueMetrics.SECS_PER_ERROR_PREVENTED / 60 + " min saved"));

        if (!report.agents().isEmpty()) {
            lines.add("");
            lines.add("Agents seen:");
            for (AgentInfo agent : report.agents()) {
                lines.add("  " + agent.getDisplayName() + ": " + agent.getTotalSessions() + " session(s)");
            }
        }
        return String.join("\n", lines);
    }

    private static String formatRate(double rate) {
        return rate == Math.rint(rate) ? String.valueOf((long) rate) : String.valueOf(rate);
    }
}
