package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetrics {

    private String sessionId;
    private long durationSecs;
    private int eventsTotal;

    /** Every category is present, zero-filled */
    @Builder.Default
    private Map<EventCategory, Integer> eventsByCategory = new EnumMap<>(EventCategory.class);

    private int filesRead;
    private int filesModified;
    private int decisionsRecorded;
    private int patternsDiscovered;
    private int errorsResolved;
}
