package com.vidnyan.patternscan.domain.model;

import java.time.Duration;

/**
 * Outcome of running one plugin against one submission.
 */
public record PluginExecution(
    String pluginName,
    ExecutionStatus status,
    int issueCount,
    Duration duration,
    String message
) {
    
    public enum ExecutionStatus {
        SUCCESS,
        SKIPPED,
        FAULT,
        CANCELLED
    }
    
    public static PluginExecution success(String pluginName, int issueCount, Duration duration) {
        return new PluginExecution(pluginName, ExecutionStatus.SUCCESS, issueCount, duration, null);
    }
    
    public static PluginExecution skipped(String pluginName, String reason, Duration duration) {
        return new PluginExecution(pluginName, ExecutionStatus.SKIPPED, 0, duration, reason);
    }
    
    public static PluginExecution fault(String pluginName, String message) {
        return new PluginExecution(pluginName, ExecutionStatus.FAULT, 0, Duration.ZERO, message);
    }
    
    public static PluginExecution cancelled(String pluginName, String reason) {
        return new PluginExecution(pluginName, ExecutionStatus.CANCELLED, 0, Duration.ZERO, reason);
    }
    
    public boolean isSkipped() {
        return status == ExecutionStatus.SKIPPED;
    }
}
