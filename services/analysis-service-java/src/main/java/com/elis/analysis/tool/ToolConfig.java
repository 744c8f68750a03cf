package com.elis.analysis.tool;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolConfig {

    @Bean
    public ProcessLauncher processLauncher() {
        return ProcessLauncher.system();
    }
}
