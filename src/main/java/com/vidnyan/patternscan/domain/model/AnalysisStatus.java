package com.vidnyan.patternscan.domain.model;

/**
 * Submission lifecycle: PENDING -> PROCESSING -> {COMPLETED, FAILED}.
 */
public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    public boolean canTransitionTo(AnalysisStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }
}
