package com.elis.analysis.service.handler;

import com.elis.analysis.tool.ToolRef;

import java.nio.file.Path;
import java.util.Map;

public record PreparedInvocation(ToolRef tool, Map<String, Path> inputs, Map<String, String> options) {

    public PreparedInvocation {
        inputs = Map.copyOf(inputs);
        options = Map.copyOf(options);
    }
}
