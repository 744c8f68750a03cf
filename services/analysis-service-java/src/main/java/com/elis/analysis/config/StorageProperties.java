package com.elis.analysis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "elis.storage")
public record StorageProperties(@DefaultValue("./data/workspace") Path root) {
}
