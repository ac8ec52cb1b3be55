package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.KnowledgeService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.model.KnowledgeUsage;
import com.deepansh.memory.model.UsageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UseKnowledgeToolTest {

    private KnowledgeService knowledgeService;
    private UseKnowledgeTool tool;

    @BeforeEach
    void setUp() {
        knowledgeService = mock(KnowledgeService.class);
        tool = new UseKnowledgeTool(knowledgeService);
    }

    @Test
    void execute_recordsUsage() {
        when(knowledgeService.recordUsage(eq("k1"), eq("s1"), eq(UsageType.APPLIED)))
                .thenReturn(OperationResult.success(KnowledgeUsage.builder().usageId("u1").build()));

        String result = tool.execute(Map.of("knowledgeId", "k1", "sessionId", "s1", "usageType", "applied"));

        assertThat(result).isEqualTo("Knowledge usage recorded: applied k1 (u1)");
    }

    @Test
    void execute_unknownUsageType_returnsError() {
        String result = tool.execute(Map.of("knowledgeId", "k1", "sessionId", "s1", "usageType", "ignored"));

        assertThat(result).startsWith("ERROR:");
        verifyNoInteractions(knowledgeService);
    }

    @Test
    void execute_unknownKnowledge_returnsServiceMessage() {
        when(knowledgeService.recordUsage(eq("ghost"), eq("s1"), eq(UsageType.RECALLED)))
                .thenReturn(OperationResult.failure("Knowledge ghost not found."));

        assertThat(tool.execute(Map.of("knowledgeId", "ghost", "sessionId", "s1", "usageType", "recalled")))
                .isEqualTo("ERROR: Knowledge ghost not found.");
    }
}
