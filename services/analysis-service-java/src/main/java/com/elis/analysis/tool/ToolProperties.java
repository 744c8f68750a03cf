package com.elis.analysis.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * @param images             tool name to image reference; unset tools use {@code <name>:latest}
 * @param outputCaptureLimit bytes of stdout/stderr kept from each run
 * @param teardownTimeout    how long to wait for {@code docker rm -f} after a timeout
 */
@ConfigurationProperties(prefix = "elis.tools")
public record ToolProperties(
        @DefaultValue("docker") String dockerCommand,
        Map<String, String> images,
        @DefaultValue("16384") int outputCaptureLimit,
        @DefaultValue("30s") Duration teardownTimeout
) {

    public ToolProperties {
        images = images == null ? Map.of() : Map.copyOf(images);
    }
}
