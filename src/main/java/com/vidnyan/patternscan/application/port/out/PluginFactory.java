package com.vidnyan.patternscan.application.port.out;

import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;

/**
 * Port that turns a registered plugin type into a usable instance.
 */
@FunctionalInterface
public interface PluginFactory {
    
    AnalyzerPlugin create(String name, Class<? extends AnalyzerPlugin> type);
}
