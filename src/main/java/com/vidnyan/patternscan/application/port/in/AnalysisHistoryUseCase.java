package com.vidnyan.patternscan.application.port.in;

import com.vidnyan.patternscan.domain.model.HistoryRecord;
import com.vidnyan.patternscan.domain.model.StatisticsSummary;
import com.vidnyan.patternscan.domain.model.UsageStats;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the history log and usage counters.
 */
public interface AnalysisHistoryUseCase {
    
    /**
     * Whole history, newest first.
     */
    List<HistoryRecord> getHistory();
    
    /**
     * At most {@code limit} records, newest first.
     */
    List<HistoryRecord> getHistory(int limit);
    
    UsageStats getUsageStats();
    
    StatisticsSummary getSummary();
    
    StatisticsExport export();
    
    /**
     * Administrative reset of history and counters.
     */
    void clear();
    
    record StatisticsExport(
        List<HistoryRecord> history,
        UsageStats usageStats,
        StatisticsSummary summary,
        Instant exportTime
    ) {}
}
