package com.elis.analysis.exception;

/**
 * The container runtime could not start a tool: docker missing, daemon down, image absent.
 * Tool-side failures are reported through {@link com.elis.analysis.tool.InvocationResult} instead.
 */
public class ToolUnavailableException extends Exception {

    private final String tool;

    public ToolUnavailableException(String tool, String message) {
        super(tool + " unavailable: " + message);
        this.tool = tool;
    }

    public ToolUnavailableException(String tool, String message, Throwable cause) {
        super(tool + " unavailable: " + message, cause);
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }
}
