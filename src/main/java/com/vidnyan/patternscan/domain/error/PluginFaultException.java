package com.vidnyan.patternscan.domain.error;

/**
 * Unexpected failure inside a plugin. Fails the whole submission.
 */
public class PluginFaultException extends AnalysisEngineException {
    
    private final String pluginName;
    
    public PluginFaultException(String pluginName, Throwable cause) {
        super(ErrorKind.PLUGIN_FAULT, describe(cause), cause);
        this.pluginName = pluginName;
    }
    
    public String pluginName() {
        return pluginName;
    }
    
    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown fault";
        }
        return cause.getMessage() == null
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
