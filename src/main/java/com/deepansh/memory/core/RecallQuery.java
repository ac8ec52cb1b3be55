package com.deepansh.memory.core;

import com.deepansh.memory.model.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecallQuery {

    public static final int DEFAULT_LIMIT = 10;

    private String projectPath;

    /** Substring of session summaries */
    private String query;

    private String branch;
    private EventType eventType;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;
}
