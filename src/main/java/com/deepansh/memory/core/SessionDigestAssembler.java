package com.deepansh.memory.core;

import com.deepansh.memory.memory.SessionEventRepository;
import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class SessionDigestAssembler {

    private final SessionEventRepository eventRepository;

    /** Decisions then patterns. */
    public SessionDigest digest(Session session, Double score) {
        List<SessionEvent> highlights = new ArrayList<>(
                eventRepository.findBySession(session.getSessionId(), EventType.DECISION));
        highlights.addAll(eventRepository.findBySession(session.getSessionId(), EventType.PATTERN));
        return new SessionDigest(session, score, highlights);
    }

    /** Only events of the given type; falls back to decisions and patterns when type is null. */
    public SessionDigest digest(Session session, Double score, EventType type) {
        if (type == null) {
            return digest(session, score);
        }
        return new SessionDigest(session, score, eventRepository.findBySession(session.getSessionId(), type));
    }
}
