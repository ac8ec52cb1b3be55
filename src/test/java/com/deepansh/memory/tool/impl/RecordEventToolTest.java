package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.SessionLifecycleService;
import com.deepansh.memory.model.EventDetail;
import com.deepansh.memory.model.SessionEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RecordEventToolTest {

    private SessionLifecycleService lifecycleService;
    private RecordEventTool tool;

    @BeforeEach
    void setUp() {
        lifecycleService = mock(SessionLifecycleService.class);
        tool = new RecordEventTool(lifecycleService, new ObjectMapper());
        when(lifecycleService.recordEvent(any(), any())).thenAnswer(inv -> OperationResult.success(
                SessionEvent.of("e1", inv.getArgument(0), Instant.EPOCH, inv.getArgument(1))));
    }

    @Test
    void execute_fileOp_parsesTypedDetail() {
        String result = tool.execute(Map.of("sessionId", "s1",
                "detail", Map.of("type", "file_op", "path", "src/App.java", "operation", "edit")));

        assertThat(result).isEqualTo("Event recorded: file_edit (e1)");
        verify(lifecycleService).recordEvent(eq("s1"),
                eq(new EventDetail.FileOp("src/App.java", EventDetail.FileOperation.EDIT)));
    }

    @Test
    void execute_errorResolved_parsesFiles() {
        tool.execute(Map.of("sessionId", "s1", "detail", Map.of(
                "type", "error_resolved", "error", "NPE", "resolution", "null check",
                "files", List.of("a.java", "b.java"))));

        verify(lifecycleService).recordEvent(eq("s1"),
                eq(new EventDetail.ErrorResolved("NPE", "null check", List.of("a.java", "b.java"))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"rumour", "file_read"})
    void execute_unknownDetailType_returnsInvalidArguments(String type) {
        String result = tool.execute(Map.of("sessionId", "s1", "detail", Map.of("type", type, "path", "x")));

        assertThat(result).startsWith("ERROR: Invalid arguments:");
        verifyNoInteractions(lifecycleService);
    }

    @Test
    void execute_missingRequiredField_returnsInvalidArguments() {
        String result = tool.execute(Map.of("sessionId", "s1", "detail", Map.of("type", "decision")));

        assertThat(result).startsWith("ERROR: Invalid arguments:");
    }

    @Test
    void execute_missingDetail_returnsInvalidArguments() {
        assertThat(tool.execute(Map.of("sessionId", "s1"))).isEqualTo("ERROR: Invalid arguments: 'detail' is required");
    }

    @Test
    void execute_inactiveSession_returnsServiceMessage() {
        doReturn(OperationResult.failure("Session s1 is completed, not active."))
                .when(lifecycleService).recordEvent(any(), any());

        String result = tool.execute(Map.of("sessionId", "s1", "detail", Map.of("type", "milestone", "summary", "m")));

        assertThat(result).isEqualTo("ERROR: Session s1 is completed, not active.");
    }
}
