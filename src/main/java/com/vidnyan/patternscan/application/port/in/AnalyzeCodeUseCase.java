package com.vidnyan.patternscan.application.port.in;

import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisFailure;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Primary use case: submit source for analysis and read the outcome.
 * This is the in-process contract any transport can wrap.
 */
public interface AnalyzeCodeUseCase {
    
    /**
     * Accept a submission and schedule it.
     * @return id of the new analysis, PENDING at the time of return
     */
    String submit(SubmissionRequest request);
    
    /**
     * @throws com.vidnyan.patternscan.domain.error.NotFoundException for an unknown id
     */
    StatusView getStatus(String analysisId);
    
    /**
     * @throws com.vidnyan.patternscan.domain.error.NotFoundException for an unknown id
     */
    Analysis getResult(String analysisId);
    
    List<Analysis> getByUser(String userId, int offset, int limit);
    
    List<Analysis> getByStatus(AnalysisStatus status);
    
    /**
     * Submission parameters.
     */
    record SubmissionRequest(
        byte[] source,
        String filename,
        String language,
        String userId,
        Map<String, Object> config
    ) {
        public static SubmissionRequest ofText(String source, String filename, String language, String userId) {
            return new SubmissionRequest(source.getBytes(StandardCharsets.UTF_8),
                    filename, language, userId, Map.of());
        }
    }
    
    /**
     * Lifecycle view of a submission. Progress is a percentage.
     */
    record StatusView(
        String analysisId,
        AnalysisStatus status,
        int progress,
        AnalysisFailure failure
    ) {}
}
