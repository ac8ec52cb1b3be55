package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A durable knowledge item lifted out of session history. Superseded items
 * stay in the store but drop out of every listing and duplicate check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotedKnowledge {

    private String knowledgeId;
    private String projectPath;
    private String sessionId;
    private String sourceEventId;
    private String title;
    private String content;
    private KnowledgeType knowledgeType;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant createdAt;
    private String branch;

    /** SHA-256 of the normalized content */
    private String contentHash;

    private int usageCount;
    private String supersededBy;
    private Instant syncedAt;
    private String remoteKnowledgeId;

    public boolean isSuperseded() {
        return supersededBy != null;
    }
}
