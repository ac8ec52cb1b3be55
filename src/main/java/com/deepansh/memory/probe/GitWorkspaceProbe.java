package com.deepansh.memory.probe;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Asks the git CLI via "git rev-parse". Each call is capped at 5 seconds.
 */
@Component
@Slf4j
public class GitWorkspaceProbe implements WorkspaceProbe {

    static final long TIMEOUT_SECONDS = 5;

    @Override
    public String currentBranch(String projectPath) {
        return run(projectPath, List.of("git", "rev-parse", "--abbrev-ref", "HEAD"))
                .orElse(UNKNOWN_BRANCH);
    }

    @Override
    public Optional<String> currentCommit(String projectPath) {
        return run(projectPath, List.of("git", "rev-parse", "HEAD"));
    }

    private Optional<String> run(String projectPath, List<String> command) {
        File dir = new File(projectPath);
        if (!dir.isDirectory()) {
            log.debug("Not a directory, skipping git probe: {}", projectPath);
            return Optional.empty();
        }

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(dir);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        try {
            Process process = pb.start();
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("git probe timed out after {}s in {}", TIMEOUT_SECONDS, projectPath);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.debug("git exited {} in {}", process.exitValue(), projectPath);
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            return output.isEmpty() ? Optional.empty() : Optional.of(output);
        } catch (IOException e) {
            log.debug("git not runnable in {}: {}", projectPath, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("git probe interrupted in {}", projectPath);
            return Optional.empty();
        }
    }
}
