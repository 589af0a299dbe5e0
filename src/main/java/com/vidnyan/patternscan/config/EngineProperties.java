package com.vidnyan.patternscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "patternscan.engine")
public class EngineProperties {
    
    /**
     * Upper bound for one submission, all plugins included.
     */
    private Duration submissionTimeout = Duration.ofSeconds(30);
    
    /**
     * Threads running plugins. Shared by all submissions: time a plugin waits
     * for a free thread counts against its submission's timeout, and a plugin
     * that ignores interruption holds its thread past the timeout. Sized for
     * every built-in plugin of each submission thread, plus two spare.
     */
    private int pluginThreads = 12;
    
    /**
     * Threads driving submissions through their lifecycle.
     */
    private int submissionThreads = 2;
    
    /**
     * Built-in plugin names left out of the registry.
     */
    private List<String> disabledPlugins = new ArrayList<>();
    
    /**
     * JSON file holding history and usage counters across restarts.
     * Default: none, statistics live in memory only
     */
    private String statsFile;
}
