package com.elis.analysis.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reports whether the container runtime answers and which tool images are present locally.
 */
@Component
public class ContainerRuntimeProbe {

    private static final Logger log = LoggerFactory.getLogger(ContainerRuntimeProbe.class);
    private static final long PROBE_TIMEOUT_SECONDS = 10;

    private final ToolCatalog catalog;
    private final ToolProperties properties;
    private final ProcessLauncher launcher;

    public ContainerRuntimeProbe(ToolCatalog catalog, ToolProperties properties, ProcessLauncher launcher) {
        this.catalog = catalog;
        this.properties = properties;
        this.launcher = launcher;
    }

    public RuntimeStatus probe() {
        ProbeResult version = run(List.of(properties.dockerCommand(), "--version"));
        Map<String, Boolean> images = new LinkedHashMap<>();
        if (version.exitCode() == 0) {
            for (ToolRef tool : catalog.tools()) {
                images.put(tool.image(), imageAvailable(tool));
            }
        }
        return new RuntimeStatus(version.exitCode() == 0,
                version.exitCode() == 0 ? version.output().strip() : null,
                version.exitCode() == 0 ? null : version.output().strip(),
                images);
    }

    public boolean imageAvailable(ToolRef tool) {
        boolean present = run(List.of(properties.dockerCommand(), "image", "inspect", tool.image())).exitCode() == 0;
        if (!present) {
            log.warn("Docker image not found: {}", tool.image());
        }
        return present;
    }

    private ProbeResult run(List<String> command) {
        Path output = null;
        try {
            output = Files.createTempFile("elis-probe-", ".out");
            Process process = launcher.start(command,
                    ProcessBuilder.Redirect.appendTo(output.toFile()), ProcessBuilder.Redirect.appendTo(output.toFile()));
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new ProbeResult(-1, String.join(" ", command) + " timed out");
            }
            try (InputStream in = Files.newInputStream(output)) {
                return new ProbeResult(process.exitValue(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Probe {} failed", command, e);
            return new ProbeResult(-1, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ProbeResult(-1, "interrupted");
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Could not delete {}", output, e);
                }
            }
        }
    }

    private record ProbeResult(int exitCode, String output) {
    }

    public record RuntimeStatus(boolean dockerAvailable, String dockerVersion, String error,
                                Map<String, Boolean> images) {
    }
}
