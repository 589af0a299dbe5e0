package com.vidnyan.patternscan.domain.error;

/**
 * Base type of every error the engine reports.
 */
public abstract class AnalysisEngineException extends RuntimeException {
    
    private final ErrorKind kind;
    
    protected AnalysisEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    protected AnalysisEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public ErrorKind kind() {
        return kind;
    }
}
