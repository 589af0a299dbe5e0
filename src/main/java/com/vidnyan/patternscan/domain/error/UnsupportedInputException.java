package com.vidnyan.patternscan.domain.error;

/**
 * Thrown by a plugin that cannot process the submitted content at all
 * (binary data, undecodable bytes). The plugin is skipped, the submission goes on.
 */
public class UnsupportedInputException extends AnalysisEngineException {
    
    public UnsupportedInputException(String message) {
        super(ErrorKind.UNSUPPORTED_INPUT, message);
    }
    
    public UnsupportedInputException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_INPUT, message, cause);
    }
}
