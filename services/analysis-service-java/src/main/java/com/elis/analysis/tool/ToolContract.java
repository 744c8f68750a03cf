package com.elis.analysis.tool;

import com.elis.analysis.exception.ConfigurationException;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fixed command-line contract of one containerized tool: where its input and output are
 * mounted, which environment and arguments it expects, and which output files count as artifacts.
 */
public interface ToolContract {

    String INPUT_MOUNT = "/INPUT";
    String OUTPUT_MOUNT = "/OUTPUT";

    String name();

    /**
     * Logical role of the single input file, e.g. {@code input_pdf}.
     */
    String inputRole();

    /**
     * Checks supplied options against the accepted values and fills in defaults.
     */
    Map<String, String> normalizeOptions(Map<String, String> options) throws ConfigurationException;

    Map<String, String> environment(Path input, Map<String, String> options);

    List<String> arguments(Path input, Map<String, String> options);

    boolean isArtifact(Path file);
}
