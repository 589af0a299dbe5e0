package com.vidnyan.patternscan.domain.plugin;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Optional per-submission settings handed to every plugin.
 * Entries with a null key or value are treated as unset and dropped.
 */
public record AnalysisConfig(Map<String, Object> values) {
    
    public static final String DISABLED_RULES = "disabledRules";
    public static final String MIN_SEVERITY = "minSeverity";
    
    public AnalysisConfig {
        Map<String, Object> copy = new HashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }
    
    public static AnalysisConfig empty() {
        return new AnalysisConfig(Map.of());
    }
    
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
    
    public Optional<String> string(String key) {
        return Optional.ofNullable(values.get(key)).map(Object::toString);
    }
    
    /**
     * Value as a list of strings; a single scalar becomes a one-element list.
     */
    public List<String> stringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }
}
