package com.vidnyan.patternscan.application.port.out;

import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;

import java.util.List;
import java.util.Optional;

/**
 * Port for storing analysis records.
 * A save replaces the whole record at once; readers never see a partial one.
 */
public interface AnalysisRepository {
    
    /**
     * Create or replace an analysis.
     */
    void save(Analysis analysis);
    
    /**
     * A user's analyses, newest first.
     */
    List<Analysis> findByUser(String userId, int offset, int limit);
    
    List<Analysis> findByStatus(AnalysisStatus status);
    
    /**
     * Analysis with its issues and metrics, empty when the id is unknown.
     */
    Optional<Analysis> findWithMetrics(String analysisId);
}
