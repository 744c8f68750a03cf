package com.elis.analysis.tool;

import java.io.IOException;
import java.util.List;

/**
 * Starts operating system processes for the invoker.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process start(List<String> command, ProcessBuilder.Redirect stdout, ProcessBuilder.Redirect stderr)
            throws IOException;

    static ProcessLauncher system() {
        return (command, stdout, stderr) -> new ProcessBuilder(command)
                .redirectOutput(stdout)
                .redirectError(stderr)
                .start();
    }
}
