package com.deepansh.memory.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EndSessionRequest {

    private String sessionId;
    private String summary;
    private String gitCommit;
}
