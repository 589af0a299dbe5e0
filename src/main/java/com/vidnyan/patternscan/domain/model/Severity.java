package com.vidnyan.patternscan.domain.model;

import java.util.Locale;

/**
 * Issue severity, ordered from least to most severe.
 */
public enum Severity {
    LOW(0.3),
    MEDIUM(1.0),
    HIGH(2.5),
    CRITICAL(4.0);
    
    private final double penalty;
    
    Severity(double penalty) {
        this.penalty = penalty;
    }
    
    /**
     * Score points removed from a 0-10 sub-score per issue of this severity.
     */
    public double penalty() {
        return penalty;
    }
    
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
    
    /**
     * Lenient parse used by catalog loading and submission config.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL", "BLOCKER" -> CRITICAL;
            case "HIGH", "ERROR" -> HIGH;
            case "LOW", "INFO" -> LOW;
            default -> MEDIUM;
        };
    }
}
