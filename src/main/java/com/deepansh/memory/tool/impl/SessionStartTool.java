package com.deepansh.memory.tool.impl;

import com.deepansh.memory.context.ScoredKnowledge;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.SessionContext;
import com.deepansh.memory.core.SessionDigest;
import com.deepansh.memory.core.SessionLifecycleService;
import com.deepansh.memory.core.StartSessionRequest;
import com.deepansh.memory.model.AgentType;
import com.deepansh.memory.model.FileImportance;
import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionEvent;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Opens a session and answers with the context bundle: recent sessions with
 * their decisions and patterns, ranked project knowledge and hot files.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionStartTool implements MemoryTool {

    private final SessionLifecycleService lifecycleService;

    @Override
    public String getName() {
        return "session_start";
    }

    @Override
    public String getDescription() {
        return """
                Start a work session for a project and get relevant context from earlier sessions.
                Any still-active session of the project is marked abandoned.
                Branch, commit and agent are detected when omitted.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "projectPath", Map.of("type", "string", "description", "Working directory / project root path"),
                        "branch", Map.of("type", "string", "description", "Git branch name (auto-detected if omitted)"),
                        "gitCommit", Map.of("type", "string", "description", "Current HEAD commit SHA"),
                        "agentType", Map.of("type", "string",
                                "enum", List.of("claude-code", "cursor", "aider", "openclaw", "unknown"),
                                "description", "Agent driving the session (detected from the environment if omitted)"),
                        "agentVersion", Map.of("type", "string", "description", "Agent version")
                ),
                "required", List.of("projectPath")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        StartSessionRequest request;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            request = StartSessionRequest.builder()
                    .projectPath(args.requireString("projectPath"))
                    .branch(args.optionalString("branch"))
                    .gitCommit(args.optionalString("gitCommit"))
                    .agentType(args.optionalValue("agentType", AgentType::fromValue))
                    .agentVersion(args.optionalString("agentVersion"))
                    .build();
        } catch (IllegalArgumentException e) {
            return "ERROR: " + e.getMessage();
        }

        OperationResult<SessionContext> result = lifecycleService.startSession(request);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }
        return render(result.value());
    }

    private String render(SessionContext context) {
        Session session = context.getSession();
        List<String> lines = new ArrayList<>();
        lines.add("Session started: " + session.getSessionId());
        lines.add("Project: " + session.getProjectPath());
        lines.add("Branch: " + session.getBranch());
        lines.add("Agent: " + session.getAgentType().displayName());

        if (context.getAbandonedSessions() > 0) {
            lines.add("Cleaned up " + context.getAbandonedSessions() + " stale session(s).");
        }

        if (!context.getRecentSessions().isEmpty()) {
            lines.add("");
            lines.add("--- Recent Sessions ---");
            for (SessionDigest digest : context.getRecentSessions()) {
                Session s = digest.session();
                lines.add("[" + s.getStartedAt() + "] (" + s.getBranch() + ") "
                        + (s.getSummary() != null ? s.getSummary() : "(no summary)"));
                for (SessionEvent e : digest.decisions()) {
                    lines.add("  Decision: " + e.getDetail().describe());
                }
                for (SessionEvent e : digest.patterns()) {
                    lines.add("  Pattern: " + e.getDetail().describe());
                }
            }
        }

        if (!context.getKnowledge().isEmpty()) {
            lines.add("");
            lines.add("--- Project Knowledge ---");
            for (ScoredKnowledge scored : context.getKnowledge()) {
                PromotedKnowledge k = scored.knowledge();
                lines.add("[" + k.getKnowledgeType().value() + "] " + k.getTitle() + ": " + k.getContent()
                        + " (id: " + k.getKnowledgeId() + ")");
            }
        }

        if (!context.getImportantFiles().isEmpty()) {
            lines.add("");
            lines.add("--- Important Files ---");
            for (FileImportance f : context.getImportantFiles()) {
                lines.add(String.format("%s (reads: %d, edits: %d, score: %.2f)",
                        f.getFilePath(), f.getReadCount(), f.getEditCount(), f.getImportanceScore()));
            }
        }
        return String.join("\n", lines);
    }
}
