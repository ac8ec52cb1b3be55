package com.deepansh.memory.probe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GitWorkspaceProbeTest {

    private final GitWorkspaceProbe probe = new GitWorkspaceProbe();

    @Test
    void currentBranch_missingDirectory_isUnknown() {
        assertThat(probe.currentBranch("/definitely/not/a/real/dir")).isEqualTo(WorkspaceProbe.UNKNOWN_BRANCH);
    }

    @Test
    void currentCommit_missingDirectory_isEmpty() {
        assertThat(probe.currentCommit("/definitely/not/a/real/dir")).isEmpty();
    }

    @Test
    void currentBranch_directoryOutsideRepository_isUnknown(@TempDir Path dir) {
        assertThat(probe.currentBranch(dir.toString())).isEqualTo(WorkspaceProbe.UNKNOWN_BRANCH);
        assertThat(probe.currentCommit(dir.toString())).isEmpty();
    }
}
