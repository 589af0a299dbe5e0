package com.vidnyan.patternscan.domain.error;

/**
 * A type offered to the plugin registry does not honour the plugin contract.
 */
public class TypeContractViolationException extends AnalysisEngineException {
    
    public TypeContractViolationException(String pluginName, Class<?> type, String reason) {
        super(ErrorKind.TYPE_CONTRACT_VIOLATION,
                "Plugin '" + pluginName + "' (" + (type == null ? "null" : type.getName()) + "): " + reason);
    }
}
