package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionEvent {

    private String eventId;
    private String sessionId;
    private Instant timestamp;
    private EventType eventType;
    private EventCategory category;
    private EventDetail detail;

    /** Builds an event whose type and category come from the payload. */
    public static SessionEvent of(String eventId, String sessionId, Instant timestamp, EventDetail detail) {
        EventType type = detail.eventType();
        return SessionEvent.builder()
                .eventId(eventId)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .eventType(type)
                .category(type.category())
                .detail(detail)
                .build();
    }
}
