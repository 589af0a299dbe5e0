package com.vidnyan.patternscan.domain.plugin;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    @Test
    void constructor_ShouldDropNullKeysAndValues() {
        Map<String, Object> values = new HashMap<>();
        values.put(AnalysisConfig.MIN_SEVERITY, null);
        values.put(null, "x");
        values.put(AnalysisConfig.DISABLED_RULES, List.of("eval_usage"));

        AnalysisConfig config = new AnalysisConfig(values);

        assertEquals(Map.of(AnalysisConfig.DISABLED_RULES, List.of("eval_usage")), config.values());
        assertTrue(config.string(AnalysisConfig.MIN_SEVERITY).isEmpty());
        assertEquals(List.of("eval_usage"), config.stringList(AnalysisConfig.DISABLED_RULES));
    }

    @Test
    void constructor_ShouldCopyAndFreezeValues() {
        Map<String, Object> values = new HashMap<>();
        values.put(AnalysisConfig.MIN_SEVERITY, "high");

        AnalysisConfig config = new AnalysisConfig(values);
        values.put(AnalysisConfig.MIN_SEVERITY, "low");

        assertEquals("high", config.string(AnalysisConfig.MIN_SEVERITY).orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> config.values().put("k", "v"));
        assertTrue(new AnalysisConfig(null).values().isEmpty());
    }
}
