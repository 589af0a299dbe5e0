package com.vidnyan.patternscan.application.port.out;

import com.vidnyan.patternscan.domain.model.HistoryRecord;
import com.vidnyan.patternscan.domain.model.UsageStats;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Port for persisting history and usage counters between runs.
 */
public interface StatisticsStore {
    
    Optional<Snapshot> load() throws IOException;
    
    void save(Snapshot snapshot) throws IOException;
    
    /**
     * Store that keeps nothing beyond the process lifetime.
     */
    static StatisticsStore inMemory() {
        return new StatisticsStore() {
            @Override
            public Optional<Snapshot> load() {
                return Optional.empty();
            }
            
            @Override
            public void save(Snapshot snapshot) {
            }
        };
    }
    
    /**
     * Everything the statistics service holds.
     */
    record Snapshot(
        List<HistoryRecord> history,
        UsageStats usage
    ) {
        public Snapshot {
            history = history == null ? List.of() : List.copyOf(history);
            usage = usage == null ? UsageStats.empty() : usage;
        }
    }
}
