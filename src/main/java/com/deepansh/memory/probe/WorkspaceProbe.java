package com.deepansh.memory.probe;

import java.util.Optional;

/**
 * Reads version-control state of a project directory.
 * Implementations never throw: failures surface as the documented fallbacks.
 */
public interface WorkspaceProbe {

    String UNKNOWN_BRANCH = "unknown";

    /** Current branch name, or {@link #UNKNOWN_BRANCH} when it cannot be determined. */
    String currentBranch(String projectPath);

    /** Current HEAD commit, empty when it cannot be determined. */
    Optional<String> currentCommit(String projectPath);
}
