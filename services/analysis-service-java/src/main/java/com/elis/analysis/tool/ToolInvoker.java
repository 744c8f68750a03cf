package com.elis.analysis.tool;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.exception.ToolUnavailableException;

import java.nio.file.Path;
import java.util.Map;

public interface ToolInvoker {

    /**
     * Runs {@code tool} once in an ephemeral environment and enumerates what it wrote to
     * {@code outputDir}. Tool-side failures and timeouts are reported in the result.
     *
     * @param inputs   logical input role to host file, e.g. {@code input_pdf}
     * @param options  tool parameters, validated against the tool's accepted values
     * @throws ConfigurationException  options or inputs the tool cannot accept; nothing was started
     * @throws ToolUnavailableException the tool could not be started at all
     */
    InvocationResult invoke(ToolRef tool, Map<String, Path> inputs, Map<String, String> options,
                            Path outputDir, TimeLimits limits)
            throws ConfigurationException, ToolUnavailableException;
}
