package com.elis.analysis.service.handler;

import com.elis.analysis.tool.Artifact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A finished tool run as the executor sees it: artifacts plus the errors the tool reported.
 */
public record ToolOutcome(String tool, String message, int exitCode, List<Artifact> artifacts,
                          List<String> errors, Map<String, Object> details) {

    public ToolOutcome {
        artifacts = List.copyOf(artifacts);
        errors = List.copyOf(errors);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ToolOutcome withError(String error) {
        List<String> all = new ArrayList<>(errors);
        all.add(error);
        return new ToolOutcome(tool, message, exitCode, artifacts, all, details);
    }

    public String summary() {
        if (artifacts.isEmpty()) {
            String cause = errors.isEmpty() ? message : String.join("; ", errors);
            return cause + "; no output files produced";
        }
        return errors.isEmpty() ? message : String.join("; ", errors);
    }

    public Map<String, Object> toResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tool", tool);
        result.put("message", message);
        result.put("exitCode", exitCode);
        List<Map<String, Object>> files = new ArrayList<>();
        for (Artifact artifact : artifacts) {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("name", artifact.name());
            file.put("path", artifact.path().toString());
            file.put("size", artifact.size());
            files.add(file);
        }
        result.put("artifacts", files);
        result.put("errors", errors);
        result.putAll(details);
        return result;
    }
}
