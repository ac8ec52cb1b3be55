package com.deepansh.memory.core;

import com.deepansh.memory.context.ScoredKnowledge;
import com.deepansh.memory.model.FileImportance;
import com.deepansh.memory.model.Session;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Everything handed to a caller when a session starts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionContext {

    private Session session;
    private int abandonedSessions;

    @Builder.Default
    private List<SessionDigest> recentSessions = new ArrayList<>();

    @Builder.Default
    private List<ScoredKnowledge> knowledge = new ArrayList<>();

    @Builder.Default
    private List<FileImportance> importantFiles = new ArrayList<>();

    public boolean hasHistory() {
        return !recentSessions.isEmpty() || !knowledge.isEmpty();
    }
}
