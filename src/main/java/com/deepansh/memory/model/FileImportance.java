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
public class FileImportance {

    private String projectPath;
    private String filePath;
    private int readCount;
    private int editCount;
    private Instant lastAccessedAt;
    private double importanceScore;
}
