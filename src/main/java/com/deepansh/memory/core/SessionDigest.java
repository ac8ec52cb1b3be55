package com.deepansh.memory.core;

import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionEvent;

import java.util.List;

/**
 * A past session with the events worth repeating: decisions then patterns,
 * or only the requested event type. score is null outside ranked contexts.
 */
public record SessionDigest(Session session, Double score, List<SessionEvent> highlights) {

    public SessionDigest {
        highlights = List.copyOf(highlights);
    }

    public List<SessionEvent> decisions() {
        return ofType(EventType.DECISION);
    }

    public List<SessionEvent> patterns() {
        return ofType(EventType.PATTERN);
    }

    private List<SessionEvent> ofType(EventType type) {
        return highlights.stream().filter(e -> e.getEventType() == type).toList();
    }
}
