package com.elis.analysis.service;

import com.elis.analysis.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Per-user file layout under {@code elis.storage.root}:
 * {@code <owner>/documents/<id>/}, {@code <owner>/images/<id>/} and {@code <owner>/jobs/<id>/output/}.
 * Every job gets its own output directory, so concurrent tool runs never share one.
 */
@Component
public class WorkspaceStorage {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStorage.class);

    private final Path root;

    public WorkspaceStorage(StorageProperties properties) {
        this.root = properties.root().toAbsolutePath().normalize();
    }

    public Path documentDir(UUID ownerId, UUID documentId) {
        return root.resolve(ownerId.toString()).resolve("documents").resolve(documentId.toString());
    }

    public Path imageDir(UUID ownerId, UUID imageId) {
        return root.resolve(ownerId.toString()).resolve("images").resolve(imageId.toString());
    }

    public Path jobDir(UUID ownerId, UUID jobId) {
        return root.resolve(ownerId.toString()).resolve("jobs").resolve(jobId.toString());
    }

    public Path store(MultipartFile file, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(safeFilename(file.getOriginalFilename()));
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    /**
     * Empty output directory for one attempt of a job. Leftovers of an earlier attempt are removed.
     */
    public Path prepareJobOutput(UUID ownerId, UUID jobId) throws IOException {
        Path output = jobDir(ownerId, jobId).resolve("output");
        deleteTree(output);
        return Files.createDirectories(output);
    }

    public void deleteTree(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        if (!directory.toAbsolutePath().normalize().startsWith(root)) {
            throw new IOException("Refusing to delete outside workspace: " + directory);
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    public void deleteQuietly(Path directory) {
        try {
            deleteTree(directory);
        } catch (IOException e) {
            log.warn("Could not delete {}", directory, e);
        }
    }

    static String safeFilename(String original) {
        String name = original == null ? "" : original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isEmpty() || name.startsWith(".")) {
            name = "upload" + name;
        }
        return name;
    }
}
