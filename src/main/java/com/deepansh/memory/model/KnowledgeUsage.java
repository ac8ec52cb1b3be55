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
public class KnowledgeUsage {

    private String usageId;
    private String knowledgeId;
    private String sessionId;
    private UsageType usageType;
    private Instant timestamp;
}
