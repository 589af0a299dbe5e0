package com.vidnyan.patternscan.domain.model;

/**
 * Why a submission ended FAILED. {@code plugin} names the plugin that faulted,
 * or the plugins still running when the deadline passed.
 */
public record AnalysisFailure(
    FailureKind kind,
    String plugin,
    String description
) {
    
    public String format() {
        return plugin == null
                ? kind + ": " + description
                : kind + " [" + plugin + "]: " + description;
    }
}
