package com.vidnyan.patternscan.domain.plugin;

import com.vidnyan.patternscan.domain.model.Issue;

import java.util.List;
import java.util.Map;

/**
 * Issues and metrics produced by one plugin run.
 */
public record PluginResult(
    List<Issue> issues,
    Map<String, Double> metrics
) {
    
    public PluginResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
    
    public static PluginResult empty() {
        return new PluginResult(List.of(), Map.of());
    }
}
