package com.deepansh.memory.model;

import java.util.Map;

/** Non-superseded knowledge counts for a project; byType holds every type, zero-filled. */
public record KnowledgeCounts(int total, Map<KnowledgeType, Integer> byType) {

    public KnowledgeCounts {
        byType = Map.copyOf(byType);
    }
}
