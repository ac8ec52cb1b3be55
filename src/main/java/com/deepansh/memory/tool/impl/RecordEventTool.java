package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.SessionLifecycleService;
import com.deepansh.memory.model.EventDetail;
import com.deepansh.memory.model.SessionEvent;
import com.deepansh.memory.tool.MemoryTool;
import com.deepansh.memory.tool.ToolArguments;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Records one event in an active session. The event type is derived from
 * the detail's "type"; an eventType argument is accepted but ignored.
 */
@Component
@RequiredArgsConstructor
public class RecordEventTool implements MemoryTool {

    private final SessionLifecycleService lifecycleService;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "record_event";
    }

    @Override
    public String getDescription() {
        return """
                Record an event in the current session: a file operation, tool call, decision,
                discovered pattern, resolved error or milestone.
                The detail object's "type" selects its shape.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "sessionId", Map.of("type", "string", "description", "Session ID to record the event for"),
                        "eventType", Map.of("type", "string", "description",
                                "Informational only; the type is derived from detail"),
                        "detail", Map.of(
                                "type", "object",
                                "description", """
                                        One of: {type: file_op, path, operation: read|write|edit},
                                        {type: tool_call, toolName, params?}, {type: decision, title, rationale},
                                        {type: pattern, description, files[]},
                                        {type: error_resolved, error, resolution, files[]},
                                        {type: milestone, summary}""",
                                "required", List.of("type"))
                ),
                "required", List.of("sessionId", "detail")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String sessionId;
        EventDetail detail;
        try {
            ToolArguments args = ToolArguments.of(arguments);
            sessionId = args.requireString("sessionId");
            detail = objectMapper.convertValue(args.requireObject("detail"), EventDetail.class);
        } catch (IllegalArgumentException e) {
            return "ERROR: Invalid arguments: " + e.getMessage();
        }

        OperationResult<SessionEvent> result = lifecycleService.recordEvent(sessionId, detail);
        if (!result.success()) {
            return "ERROR: " + result.message();
        }
        SessionEvent event = result.value();
        return "Event recorded: " + event.getEventType().value() + " (" + event.getEventId() + ")";
    }
}
