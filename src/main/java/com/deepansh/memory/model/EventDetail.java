package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed payload of a session event, stored as JSON in detail_json with a
 * "type" discriminator. The event type is derived from the payload, never
 * taken from the caller.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventDetail.FileOp.class, name = "file_op"),
        @JsonSubTypes.Type(value = EventDetail.ToolCall.class, name = "tool_call"),
        @JsonSubTypes.Type(value = EventDetail.Decision.class, name = "decision"),
        @JsonSubTypes.Type(value = EventDetail.Pattern.class, name = "pattern"),
        @JsonSubTypes.Type(value = EventDetail.ErrorResolved.class, name = "error_resolved"),
        @JsonSubTypes.Type(value = EventDetail.Milestone.class, name = "milestone")
})
public sealed interface EventDetail permits EventDetail.FileOp, EventDetail.ToolCall,
        EventDetail.Decision, EventDetail.Pattern, EventDetail.ErrorResolved, EventDetail.Milestone {

    EventType eventType();

    /** One-line human readable rendering used in context bundles and recall output */
    String describe();

    enum FileOperation {
        READ, WRITE, EDIT;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @JsonTypeName("file_op")
    record FileOp(String path, FileOperation operation) implements EventDetail {
        public FileOp {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(operation, "operation");
        }

        @Override
        public EventType eventType() {
            return switch (operation) {
                case READ -> EventType.FILE_READ;
                case WRITE -> EventType.FILE_WRITE;
                case EDIT -> EventType.FILE_EDIT;
            };
        }

        @Override
        public String describe() {
            return operation.value() + " " + path;
        }
    }

    @JsonTypeName("tool_call")
    record ToolCall(String toolName, String params) implements EventDetail {
        public ToolCall {
            Objects.requireNonNull(toolName, "toolName");
        }

        @Override
        public EventType eventType() {
            return EventType.TOOL_CALL;
        }

        @Override
        public String describe() {
            return params == null || params.isEmpty() ? toolName : toolName + " (" + params + ")";
        }
    }

    @JsonTypeName("decision")
    record Decision(String title, String rationale) implements EventDetail {
        public Decision {
            Objects.requireNonNull(title, "title");
            rationale = rationale == null ? "" : rationale;
        }

        @Override
        public EventType eventType() {
            return EventType.DECISION;
        }

        @Override
        public String describe() {
            return title + ": " + rationale;
        }
    }

    @JsonTypeName("pattern")
    record Pattern(String description, List<String> files) implements EventDetail {
        public Pattern {
            Objects.requireNonNull(description, "description");
            files = files == null ? List.of() : List.copyOf(files);
        }

        @Override
        public EventType eventType() {
            return EventType.PATTERN;
        }

        @Override
        public String describe() {
            return description;
        }
    }

    @JsonTypeName("error_resolved")
    record ErrorResolved(String error, String resolution, List<String> files) implements EventDetail {
        public ErrorResolved {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(resolution, "resolution");
            files = files == null ? List.of() : List.copyOf(files);
        }

        @Override
        public EventType eventType() {
            return EventType.ERROR_RESOLVED;
        }

        @Override
        public String describe() {
            return error + " -> " + resolution;
        }
    }

    @JsonTypeName("milestone")
    record Milestone(String summary) implements EventDetail {
        public Milestone {
            Objects.requireNonNull(summary, "summary");
        }

        @Override
        public EventType eventType() {
            return EventType.MILESTONE;
        }

        @Override
        public String describe() {
            return summary;
        }
    }
}
