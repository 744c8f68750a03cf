package com.elis.analysis.tool;

import com.elis.analysis.exception.ConfigurationException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

public abstract class AbstractToolContract implements ToolContract {

    private final String name;
    private final String inputRole;
    private final Map<String, OptionSpec> options;
    private final Set<String> artifactExtensions;

    protected AbstractToolContract(String name, String inputRole, List<OptionSpec> options,
                                   Set<String> artifactExtensions) {
        this.name = name;
        this.inputRole = inputRole;
        this.options = options.stream()
                .collect(Collectors.toMap(OptionSpec::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        this.artifactExtensions = Set.copyOf(artifactExtensions);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String inputRole() {
        return inputRole;
    }

    @Override
    public Map<String, String> normalizeOptions(Map<String, String> supplied) throws ConfigurationException {
        Map<String, String> given = supplied == null ? Map.of() : supplied;
        for (String key : given.keySet()) {
            if (!options.containsKey(key)) {
                throw new ConfigurationException(key, "unknown option for " + name);
            }
        }

        Map<String, String> normalized = new LinkedHashMap<>();
        for (OptionSpec spec : options.values()) {
            String value = given.getOrDefault(spec.name(), spec.defaultValue());
            if (!spec.allowedValues().contains(value)) {
                throw new ConfigurationException(spec.name(),
                        "must be one of " + new TreeSet<>(spec.allowedValues()) + ", got " + value);
            }
            normalized.put(spec.name(), value);
        }
        return normalized;
    }

    @Override
    public Map<String, String> environment(Path input, Map<String, String> options) {
        return Map.of();
    }

    @Override
    public boolean isArtifact(Path file) {
        String filename = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && artifactExtensions.contains(filename.substring(dot + 1));
    }

    protected static String containerInput(Path input) {
        return INPUT_MOUNT + "/" + input.getFileName();
    }

    protected static String stem(Path file) {
        String filename = file.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
