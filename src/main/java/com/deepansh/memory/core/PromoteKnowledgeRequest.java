package com.deepansh.memory.core;

import com.deepansh.memory.model.KnowledgeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromoteKnowledgeRequest {

    private String projectPath;
    private String title;
    private String content;
    private KnowledgeType knowledgeType;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String sessionId;
    private String sourceEventId;

    /** Write even when a duplicate is detected */
    private boolean allowDuplicate;

    /** Id of an existing item the new one replaces */
    private String supersedes;
}
