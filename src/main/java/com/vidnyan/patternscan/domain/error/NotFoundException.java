package com.vidnyan.patternscan.domain.error;

/**
 * Unknown plugin name or analysis id.
 */
public class NotFoundException extends AnalysisEngineException {
    
    public NotFoundException(String what, String key) {
        super(ErrorKind.NOT_FOUND, what + " '" + key + "' not found");
    }
}
