package com.vidnyan.patternscan.domain.model;

import java.time.Instant;

/**
 * Dashboard-level derivation of history and usage counters.
 */
public record StatisticsSummary(
    long totalFilesAnalyzed,
    double averageScore,
    long totalIssuesFound,
    double averageComplexity,
    double errorRate,
    Instant lastAnalysis
) {}
