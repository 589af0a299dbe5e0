package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.plugin.AnalysisConfig;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import com.vidnyan.patternscan.domain.plugin.MetricMerge;
import com.vidnyan.patternscan.domain.plugin.PluginResult;
import com.vidnyan.patternscan.domain.plugin.SourceArtifact;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Configurable plugin for service tests. Registered by type; the instances
 * themselves come from a test plugin factory.
 */
public class StubPlugin implements AnalyzerPlugin {

    private final Set<String> languages;
    private final Function<SourceArtifact, PluginResult> behaviour;
    private final MetricMerge merge;

    public StubPlugin() {
        this(Set.of(ANY_LANGUAGE), source -> PluginResult.empty(), MetricMerge.MAX);
    }

    public StubPlugin(Set<String> languages, Function<SourceArtifact, PluginResult> behaviour, MetricMerge merge) {
        this.languages = languages;
        this.behaviour = behaviour;
        this.merge = merge;
    }

    static StubPlugin returning(Set<String> languages, List<Issue> issues, Map<String, Double> metrics) {
        return new StubPlugin(languages, source -> new PluginResult(issues, metrics), MetricMerge.MAX);
    }

    static StubPlugin failingWith(RuntimeException error) {
        return new StubPlugin(Set.of(ANY_LANGUAGE), source -> {
            throw error;
        }, MetricMerge.MAX);
    }

    static StubPlugin sleeping(long millis) {
        return new StubPlugin(Set.of(ANY_LANGUAGE), source -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return PluginResult.empty();
        }, MetricMerge.MAX);
    }

    static Issue issue(String type, Severity severity, Category category, int line) {
        return Issue.builder()
                .type(type)
                .severity(severity)
                .category(category)
                .message(type)
                .file("app.ts")
                .line(line)
                .column(1)
                .build();
    }

    @Override
    public Set<String> supportedLanguages() {
        return languages;
    }

    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.values());
    }

    @Override
    public PluginResult analyze(SourceArtifact source, String language, AnalysisConfig config) {
        source.text();
        return behaviour.apply(source);
    }

    @Override
    public MetricMerge metricMerge(String metricKey) {
        return merge;
    }
}
