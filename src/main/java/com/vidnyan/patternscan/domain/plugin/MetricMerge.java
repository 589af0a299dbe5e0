package com.vidnyan.patternscan.domain.plugin;

/**
 * Rule for combining two values of the same metric key.
 */
public enum MetricMerge {
    MAX,
    SUM,
    REPLACE;
    
    public double apply(double existing, double incoming) {
        return switch (this) {
            case MAX -> Math.max(existing, incoming);
            case SUM -> existing + incoming;
            case REPLACE -> incoming;
        };
    }
}
