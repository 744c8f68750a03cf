package com.elis.analysis.tool;

/**
 * A containerized tool and the image (with tag) that implements it.
 */
public record ToolRef(String name, String image) {
}
