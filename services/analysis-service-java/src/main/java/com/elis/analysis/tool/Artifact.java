package com.elis.analysis.tool;

import java.nio.file.Path;

/**
 * A file a tool left in its output directory. {@code name} is relative to that directory.
 */
public record Artifact(String name, Path path, long size) {
}
