package com.vidnyan.patternscan.domain.model;

import java.time.Instant;

/**
 * Append-only log entry for one completed analysis.
 */
public record HistoryRecord(
    String analysisId,
    String filename,
    String analyzerUsed,
    int issuesCount,
    double complexity,
    double score,
    Instant timestamp
) {}
