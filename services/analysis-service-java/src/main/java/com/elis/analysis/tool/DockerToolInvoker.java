package com.elis.analysis.tool;

import com.elis.analysis.exception.ConfigurationException;
import com.elis.analysis.exception.ToolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs tools with {@code docker run --rm}. The input file's directory is mounted read-only at
 * {@link ToolContract#INPUT_MOUNT} and the job's output directory at {@link ToolContract#OUTPUT_MOUNT}.
 *
 * <p>At the soft limit the docker client receives SIGTERM, which it forwards to the container.
 * At the hard limit the client is killed and the container removed with {@code docker rm -f}.
 */
@Component
public class DockerToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(DockerToolInvoker.class);

    // docker run: 125 daemon error, 126 command cannot be invoked, 127 command not found
    private static final Set<Integer> RUNTIME_EXIT_CODES = Set.of(125, 126, 127);

    private final ToolCatalog catalog;
    private final ToolProperties properties;
    private final ProcessLauncher launcher;

    public DockerToolInvoker(ToolCatalog catalog, ToolProperties properties, ProcessLauncher launcher) {
        this.catalog = catalog;
        this.properties = properties;
        this.launcher = launcher;
    }

    @Override
    public InvocationResult invoke(ToolRef tool, Map<String, Path> inputs, Map<String, String> options,
                                   Path outputDir, TimeLimits limits)
            throws ConfigurationException, ToolUnavailableException {
        ToolContract contract = catalog.contract(tool);
        Map<String, String> normalized = contract.normalizeOptions(options);

        Path input = inputs.get(contract.inputRole());
        if (input == null) {
            throw new ConfigurationException(contract.inputRole(), "required input missing for " + tool.name());
        }
        input = input.toAbsolutePath();
        if (!Files.isRegularFile(input)) {
            throw new ConfigurationException(contract.inputRole(), "input file not found: " + input);
        }

        Path output = outputDir.toAbsolutePath();
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new ToolUnavailableException(tool.name(), "cannot prepare output directory " + output, e);
        }

        String containerName = "elis-" + tool.name() + "-" + UUID.randomUUID();
        List<String> command = buildCommand(contract, tool, containerName, input, output, normalized);
        log.info("Running {} in container {}: {}", tool.image(), containerName, String.join(" ", command));

        Path stdoutFile;
        Path stderrFile;
        try {
            stdoutFile = Files.createTempFile("elis-tool-", ".out");
            stderrFile = Files.createTempFile("elis-tool-", ".err");
        } catch (IOException e) {
            throw new ToolUnavailableException(tool.name(), "cannot capture tool output", e);
        }

        try {
            Process process;
            try {
                process = launcher.start(command,
                        ProcessBuilder.Redirect.to(stdoutFile.toFile()),
                        ProcessBuilder.Redirect.to(stderrFile.toFile()));
            } catch (IOException e) {
                throw new ToolUnavailableException(tool.name(),
                        "failed to launch " + properties.dockerCommand() + ": " + e.getMessage(), e);
            }
            return await(tool, contract, containerName, process, output, limits, stdoutFile, stderrFile);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    List<String> buildCommand(ToolContract contract, ToolRef tool, String containerName,
                              Path input, Path output, Map<String, String> options) {
        List<String> command = new ArrayList<>();
        command.add(properties.dockerCommand());
        command.add("run");
        command.add("--rm");
        command.add("--name");
        command.add(containerName);
        command.add("-v");
        command.add(input.getParent() + ":" + ToolContract.INPUT_MOUNT + ":ro");
        command.add("-v");
        command.add(output + ":" + ToolContract.OUTPUT_MOUNT);
        contract.environment(input, options).forEach((key, value) -> {
            command.add("-e");
            command.add(key + "=" + value);
        });
        command.add(tool.image());
        command.addAll(contract.arguments(input, options));
        return command;
    }

    private InvocationResult await(ToolRef tool, ToolContract contract, String containerName, Process process,
                                   Path output, TimeLimits limits, Path stdoutFile, Path stderrFile)
            throws ToolUnavailableException {
        boolean forcedTeardown = false;
        try {
            if (!process.waitFor(limits.soft().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} exceeded soft time limit {}, stopping container {}", tool.name(), limits.soft(), containerName);
                process.destroy();
                if (!process.waitFor(limits.grace().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("{} exceeded hard time limit {}, killing container {}", tool.name(), limits.hard(), containerName);
                }
                forcedTeardown = true;
                return InvocationResult.timeout(tool.name() + " did not finish within " + limits.soft(),
                        tail(stdoutFile), tail(stderrFile));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forcedTeardown = true;
            log.warn("Interrupted while waiting for {} in container {}", tool.name(), containerName);
            return InvocationResult.timeout(tool.name() + " was interrupted", tail(stdoutFile), tail(stderrFile));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            if (forcedTeardown) {
                removeContainer(containerName);
            }
        }

        int exitCode = process.exitValue();
        String stdout = tail(stdoutFile);
        String stderr = tail(stderrFile);
        if (!stdout.isEmpty()) {
            log.debug("{} stdout:\n{}", tool.name(), stdout);
        }
        if (!stderr.isEmpty()) {
            log.warn("{} stderr:\n{}", tool.name(), stderr);
        }

        if (RUNTIME_EXIT_CODES.contains(exitCode)) {
            throw new ToolUnavailableException(tool.name(),
                    "container runtime exited with code " + exitCode + (stderr.isEmpty() ? "" : ": " + stderr.strip()));
        }

        List<Artifact> artifacts = collectArtifacts(contract, output);
        log.info("{} exited with code {} and produced {} artifact(s)", tool.name(), exitCode, artifacts.size());
        return InvocationResult.exited(tool.name(), exitCode, artifacts, stdout, stderr);
    }

    private List<Artifact> collectArtifacts(ToolContract contract, Path output) throws ToolUnavailableException {
        if (!Files.isDirectory(output)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(output)) {
            List<Path> produced = files.filter(Files::isRegularFile)
                    .filter(contract::isArtifact)
                    .sorted(Comparator.naturalOrder())
                    .toList();
            List<Artifact> artifacts = new ArrayList<>(produced.size());
            for (Path file : produced) {
                artifacts.add(new Artifact(output.relativize(file).toString(), file, Files.size(file)));
            }
            return artifacts;
        } catch (IOException e) {
            throw new ToolUnavailableException(contract.name(), "cannot read output directory " + output, e);
        }
    }

    private void removeContainer(String containerName) {
        List<String> command = List.of(properties.dockerCommand(), "rm", "-f", containerName);
        // an interrupted worker must still get its container removed
        boolean interrupted = Thread.interrupted();
        try {
            Process rm = launcher.start(command, ProcessBuilder.Redirect.DISCARD, ProcessBuilder.Redirect.DISCARD);
            Duration timeout = properties.teardownTimeout();
            if (!rm.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                rm.destroyForcibly();
                log.warn("Timed out removing container {}", containerName);
            }
        } catch (IOException e) {
            log.warn("Failed to remove container {}", containerName, e);
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Interrupted while removing container {}", containerName);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String tail(Path file) {
        try (SeekableByteChannel channel = Files.newByteChannel(file)) {
            long size = channel.size();
            long start = Math.max(0, size - properties.outputCaptureLimit());
            channel.position(start);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            int read;
            do {
                read = channel.read(buffer);
            } while (read > 0 && buffer.hasRemaining());
            return new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read captured output {}", file, e);
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}", file, e);
        }
    }
}
