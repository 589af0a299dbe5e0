package com.vidnyan.patternscan.domain.error;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * The submission-level deadline passed before every plugin finished.
 */
public class AnalysisTimeoutException extends AnalysisEngineException {
    
    private final Collection<String> pendingPlugins;
    
    public AnalysisTimeoutException(Duration timeout, Collection<String> pendingPlugins) {
        super(ErrorKind.TIMEOUT, "Analysis exceeded " + timeout.toMillis() + "ms; still running: " + pendingPlugins);
        this.pendingPlugins = List.copyOf(pendingPlugins);
    }
    
    public Collection<String> pendingPlugins() {
        return pendingPlugins;
    }
}
