package com.deepansh.memory.support;

import com.deepansh.memory.context.DeduplicationService;
import com.deepansh.memory.model.AgentType;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.PromotedKnowledge;
import com.deepansh.memory.model.Session;

import java.time.Instant;
import java.util.List;

/** Builders for rows the store tests seed directly. */
public final class Fixtures {

    public static final String PROJECT = "/work/payments";

    private Fixtures() {
    }

    public static Session session(String id, String branch, Instant startedAt) {
        return Session.builder()
                .sessionId(id)
                .projectPath(PROJECT)
                .branch(branch)
                .startedAt(startedAt)
                .agentType(AgentType.UNKNOWN)
                .build();
    }

    public static PromotedKnowledge knowledge(String id, KnowledgeType type, String title, String content,
                                              String branch, Instant createdAt) {
        return PromotedKnowledge.builder()
                .knowledgeId(id)
                .projectPath(PROJECT)
                .title(title)
                .content(content)
                .knowledgeType(type)
                .tags(List.of("test"))
                .branch(branch)
                .createdAt(createdAt)
                .contentHash(DeduplicationService.contentHash(content))
                .build();
    }
}
