package com.elis.analysis.controller;

import com.elis.analysis.tool.ContainerRuntimeProbe;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service status plus availability of the container runtime and each tool image.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final ContainerRuntimeProbe probe;

    public HealthController(ContainerRuntimeProbe probe) {
        this.probe = probe;
    }

    @GetMapping
    public Map<String, Object> health() {
        var runtime = probe.probe();
        boolean toolsReady = runtime.dockerAvailable() && !runtime.images().containsValue(false);

        Map<String, Object> docker = new LinkedHashMap<>();
        docker.put("available", runtime.dockerAvailable());
        docker.put("version", runtime.dockerVersion());
        docker.put("error", runtime.error());
        docker.put("images", runtime.images());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", toolsReady ? "RUNNING" : "DEGRADED");
        body.put("docker", docker);
        return body;
    }
}
