package com.elis.analysis.tool;

import java.util.List;

/**
 * Outcome of one tool run. {@code success} means the tool exited 0 within its time limits;
 * a timed-out run carries no artifacts.
 */
public record InvocationResult(boolean success, String message, int exitCode, List<Artifact> artifacts,
                               boolean timedOut, String stdout, String stderr) {

    public static final int NO_EXIT_CODE = -1;

    public InvocationResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static InvocationResult exited(String tool, int exitCode, List<Artifact> artifacts,
                                          String stdout, String stderr) {
        String message = exitCode == 0
                ? tool + " finished with " + artifacts.size() + " artifact(s)"
                : tool + " exited with code " + exitCode;
        return new InvocationResult(exitCode == 0, message, exitCode, artifacts, false, stdout, stderr);
    }

    public static InvocationResult timeout(String message, String stdout, String stderr) {
        return new InvocationResult(false, "Timeout: " + message, NO_EXIT_CODE, List.of(), true, stdout, stderr);
    }
}
