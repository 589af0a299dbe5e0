package com.vidnyan.patternscan.domain.model;

import java.util.Locale;

public enum Category {
    SECURITY,
    QUALITY,
    PERFORMANCE;
    
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static Category parse(String value) {
        if (value == null || value.isBlank()) {
            return QUALITY;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SECURITY" -> SECURITY;
            case "PERFORMANCE" -> PERFORMANCE;
            default -> QUALITY;
        };
    }
}
