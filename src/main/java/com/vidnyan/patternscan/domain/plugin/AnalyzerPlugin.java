package com.vidnyan.patternscan.domain.plugin;

import com.vidnyan.patternscan.domain.model.Category;

import java.util.Locale;
import java.util.Set;

/**
 * Capability contract of an analyzer plugin.
 * Implementations are registered by type in the plugin registry and must be
 * safe to call from several submissions at once.
 */
public interface AnalyzerPlugin {
    
    /**
     * Language marker for plugins that apply to every submission.
     */
    String ANY_LANGUAGE = "*";
    
    /**
     * Languages this plugin understands, lower case, or {@link #ANY_LANGUAGE}.
     */
    Set<String> supportedLanguages();
    
    /**
     * Issue categories this plugin can report.
     */
    Set<Category> supportedCategories();
    
    /**
     * Analyze one source artifact.
     * No finding is not an error: return an empty issue list and zeroed metrics.
     *
     * @throws com.vidnyan.patternscan.domain.error.UnsupportedInputException
     *         when the content cannot be processed at all
     */
    PluginResult analyze(SourceArtifact source, String language, AnalysisConfig config);
    
    /**
     * How a metric reported by this plugin combines with the same key
     * reported by another plugin. Default keeps the larger value.
     */
    default MetricMerge metricMerge(String metricKey) {
        return MetricMerge.MAX;
    }
    
    default boolean isLanguageAgnostic() {
        return supportedLanguages().contains(ANY_LANGUAGE);
    }
    
    default boolean supports(String language) {
        return isLanguageAgnostic() || supportedLanguages().contains(normalizeLanguage(language));
    }
    
    static String normalizeLanguage(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }
}
