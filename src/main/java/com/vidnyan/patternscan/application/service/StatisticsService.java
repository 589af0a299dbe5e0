package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.application.port.in.AnalysisHistoryUseCase;
import com.vidnyan.patternscan.application.port.out.StatisticsStore;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import com.vidnyan.patternscan.domain.model.HistoryRecord;
import com.vidnyan.patternscan.domain.model.MetricKeys;
import com.vidnyan.patternscan.domain.model.StatisticsSummary;
import com.vidnyan.patternscan.domain.model.UsageStats;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only analysis history plus running usage counters.
 * The single shared-mutable hot path of the engine: every update happens
 * under one write lock, so concurrent completions never lose an increment
 * and readers never see a half-applied record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService implements AnalysisHistoryUseCase {
    
    private final StatisticsStore store;
    private final Clock clock;
    
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<HistoryRecord> history = new ArrayList<>();
    private final Map<String, Long> analysesByAnalyzer = new TreeMap<>();
    private final Map<String, Long> analysesByDate = new TreeMap<>();
    private long totalAnalyses;
    private long errorCount;
    private Instant lastAnalysisAt;
    
    /**
     * Reload a previously persisted snapshot, if the store has one.
     */
    @PostConstruct
    public void restore() {
        Optional<StatisticsStore.Snapshot> snapshot;
        try {
            snapshot = store.load();
        } catch (IOException e) {
            log.warn("Could not load statistics snapshot, starting empty: {}", e.getMessage());
            return;
        }
        snapshot.ifPresent(s -> {
            lock.writeLock().lock();
            try {
                resetState();
                history.addAll(s.history());
                UsageStats usage = s.usage();
                totalAnalyses = usage.totalAnalyses();
                analysesByAnalyzer.putAll(usage.analysesByAnalyzer());
                analysesByDate.putAll(usage.analysesByDate());
                errorCount = usage.errorCount();
                lastAnalysisAt = usage.lastAnalysisAt();
            } finally {
                lock.writeLock().unlock();
            }
            log.info("Restored statistics: {} history records, {} analyses", s.history().size(), totalAnalyses);
        });
    }
    
    /**
     * Record one terminal analysis. COMPLETED appends a history record;
     * FAILED only moves the counters, including the error counter.
     *
     * @param analyzers names of the plugins that took part
     */
    public void record(Analysis analysis, Collection<String> analyzers) {
        if (!analysis.isTerminal()) {
            throw new IllegalArgumentException("Analysis " + analysis.id() + " is " + analysis.status());
        }
        Instant timestamp = analysis.updatedAt() != null ? analysis.updatedAt() : clock.instant();
        String dateKey = LocalDate.ofInstant(timestamp, clock.getZone()).toString();
        boolean failed = analysis.status() == AnalysisStatus.FAILED;
        HistoryRecord entry = failed ? null : new HistoryRecord(
                analysis.id(),
                analysis.filename(),
                analyzers.isEmpty() ? "none" : String.join("+", analyzers),
                analysis.issues().size(),
                analysis.metric(MetricKeys.COMPLEXITY),
                analysis.scores() == null ? 0.0 : analysis.scores().global(),
                timestamp);
        
        lock.writeLock().lock();
        try {
            totalAnalyses++;
            for (String analyzer : analyzers) {
                analysesByAnalyzer.merge(analyzer, 1L, Long::sum);
            }
            analysesByDate.merge(dateKey, 1L, Long::sum);
            if (failed) {
                errorCount++;
            } else {
                history.add(entry);
            }
            if (lastAnalysisAt == null || timestamp.isAfter(lastAnalysisAt)) {
                lastAnalysisAt = timestamp;
            }
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Recorded analysis {} ({})", analysis.id(), analysis.status());
    }
    
    @Override
    public List<HistoryRecord> getHistory() {
        return getHistory(Integer.MAX_VALUE);
    }
    
    @Override
    public List<HistoryRecord> getHistory(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        lock.readLock().lock();
        try {
            List<HistoryRecord> newestFirst = new ArrayList<>(history);
            Collections.reverse(newestFirst);
            return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public UsageStats getUsageStats() {
        lock.readLock().lock();
        try {
            return usageSnapshot();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public StatisticsSummary getSummary() {
        lock.readLock().lock();
        try {
            return summary();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public StatisticsExport export() {
        lock.readLock().lock();
        try {
            List<HistoryRecord> newestFirst = new ArrayList<>(history);
            Collections.reverse(newestFirst);
            return new StatisticsExport(List.copyOf(newestFirst), usageSnapshot(), summary(), clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            resetState();
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Statistics cleared");
    }
    
    private StatisticsSummary summary() {
        double averageScore = history.stream().mapToDouble(HistoryRecord::score).average().orElse(0.0);
        double averageComplexity = history.stream().mapToDouble(HistoryRecord::complexity).average().orElse(0.0);
        long totalIssues = history.stream().mapToLong(HistoryRecord::issuesCount).sum();
        UsageStats usage = usageSnapshot();
        return new StatisticsSummary(usage.totalAnalyses(), averageScore, totalIssues,
                averageComplexity, usage.errorRate(), usage.lastAnalysisAt());
    }
    
    private UsageStats usageSnapshot() {
        return new UsageStats(totalAnalyses, analysesByAnalyzer, analysesByDate, errorCount, lastAnalysisAt);
    }
    
    private void resetState() {
        history.clear();
        analysesByAnalyzer.clear();
        analysesByDate.clear();
        totalAnalyses = 0;
        errorCount = 0;
        lastAnalysisAt = null;
    }
    
    // caller holds the write lock
    private void persist() {
        try {
            store.save(new StatisticsStore.Snapshot(history, usageSnapshot()));
        } catch (IOException e) {
            log.warn("Could not persist statistics snapshot: {}", e.getMessage());
        }
    }
}
