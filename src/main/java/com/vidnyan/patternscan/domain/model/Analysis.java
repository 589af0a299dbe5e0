package com.vidnyan.patternscan.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Full result record of one submission.
 * Immutable: every state transition returns a new instance, so a saved
 * analysis is never observed half-written.
 */
public record Analysis(
    String id,
    String userId,
    String language,
    String filename,
    AnalysisStatus status,
    Map<String, Double> metrics,
    List<Issue> issues,
    List<String> suggestions,
    Scores scores,
    List<PluginExecution> executions,
    AnalysisFailure failure,
    Instant createdAt,
    Instant updatedAt
) {
    
    public Analysis {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metrics));
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        executions = executions == null ? List.of() : List.copyOf(executions);
    }
    
    /**
     * New submission, accepted but not yet picked up.
     */
    public static Analysis pending(String id, String userId, String language, String filename, Instant now) {
        return new Analysis(id, userId, language, filename, AnalysisStatus.PENDING,
                Map.of(), List.of(), List.of(), null, List.of(), null, now, now);
    }
    
    public Analysis startProcessing(Instant now) {
        checkTransition(AnalysisStatus.PROCESSING);
        return new Analysis(id, userId, language, filename, AnalysisStatus.PROCESSING,
                Map.of(), List.of(), List.of(), null, List.of(), null, createdAt, now);
    }
    
    public Analysis complete(List<Issue> mergedIssues, Map<String, Double> mergedMetrics,
                             List<String> newSuggestions, Scores newScores,
                             List<PluginExecution> newExecutions, Instant now) {
        checkTransition(AnalysisStatus.COMPLETED);
        return new Analysis(id, userId, language, filename, AnalysisStatus.COMPLETED,
                mergedMetrics, mergedIssues, newSuggestions, newScores, newExecutions, null,
                createdAt, now);
    }
    
    /**
     * Terminal failure. Issues and metrics collected so far are dropped.
     */
    public Analysis fail(AnalysisFailure cause, List<PluginExecution> newExecutions, Instant now) {
        checkTransition(AnalysisStatus.FAILED);
        return new Analysis(id, userId, language, filename, AnalysisStatus.FAILED,
                Map.of(), List.of(), List.of(), null, newExecutions, cause, createdAt, now);
    }
    
    public boolean isTerminal() {
        return status.isTerminal();
    }
    
    public double metric(String key) {
        return metrics.getOrDefault(key, 0.0);
    }
    
    private void checkTransition(AnalysisStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Analysis " + id + " cannot move from " + status + " to " + next);
        }
    }
}
