package com.elis.analysis.tool;

import java.util.Set;

public record OptionSpec(String name, Set<String> allowedValues, String defaultValue) {
}
