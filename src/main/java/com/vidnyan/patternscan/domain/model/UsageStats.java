package com.vidnyan.patternscan.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of the running usage counters.
 */
public record UsageStats(
    long totalAnalyses,
    Map<String, Long> analysesByAnalyzer,
    Map<String, Long> analysesByDate,
    long errorCount,
    Instant lastAnalysisAt
) {
    
    public UsageStats {
        analysesByAnalyzer = analysesByAnalyzer == null
                ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(analysesByAnalyzer));
        analysesByDate = analysesByDate == null
                ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(analysesByDate));
    }
    
    public static UsageStats empty() {
        return new UsageStats(0, Map.of(), Map.of(), 0, null);
    }
    
    /**
     * Failed analyses over all recorded analyses, 0 when nothing was recorded.
     */
    public double errorRate() {
        return totalAnalyses == 0 ? 0.0 : (double) errorCount / totalAnalyses;
    }
}
