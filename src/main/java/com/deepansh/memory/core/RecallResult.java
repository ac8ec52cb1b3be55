package com.deepansh.memory.core;

import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.SessionEvent;

import java.util.List;

/**
 * Recall answers with either a flat list of recent events of one type
 * (event mode) or matching sessions with their highlights.
 */
public record RecallResult(boolean eventMode, EventType eventType, List<SessionEvent> events, List<SessionDigest> sessions) {

    public static RecallResult ofEvents(EventType eventType, List<SessionEvent> events) {
        return new RecallResult(true, eventType, List.copyOf(events), List.of());
    }

    public static RecallResult ofSessions(EventType eventType, List<SessionDigest> sessions) {
        return new RecallResult(false, eventType, List.of(), List.copyOf(sessions));
    }

    public boolean isEmpty() {
        return eventMode ? events.isEmpty() : sessions.isEmpty();
    }
}
