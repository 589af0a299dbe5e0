package com.vidnyan.patternscan.adapter.out.persistence;

import com.vidnyan.patternscan.application.port.out.AnalysisRepository;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analysis store backed by a concurrent map. Records are immutable, so a
 * save is a single reference swap.
 */
@Repository
public class InMemoryAnalysisRepository implements AnalysisRepository {
    
    private static final Comparator<Analysis> NEWEST_FIRST = Comparator
            .comparing(Analysis::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Analysis::id);
    
    private final Map<String, Analysis> analyses = new ConcurrentHashMap<>();
    
    @Override
    public void save(Analysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        analyses.put(analysis.id(), analysis);
    }
    
    @Override
    public List<Analysis> findByUser(String userId, int offset, int limit) {
        return analyses.values().stream()
                .filter(a -> Objects.equals(a.userId(), userId))
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .toList();
    }
    
    @Override
    public List<Analysis> findByStatus(AnalysisStatus status) {
        return analyses.values().stream()
                .filter(a -> a.status() == status)
                .sorted(NEWEST_FIRST)
                .toList();
    }
    
    @Override
    public Optional<Analysis> findWithMetrics(String analysisId) {
        return analysisId == null ? Optional.empty() : Optional.ofNullable(analyses.get(analysisId));
    }
}
