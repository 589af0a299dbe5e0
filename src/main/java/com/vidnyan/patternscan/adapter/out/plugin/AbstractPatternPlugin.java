package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.MetricKeys;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.pattern.DetectionRule;
import com.vidnyan.patternscan.domain.pattern.RuleCatalog;
import com.vidnyan.patternscan.domain.plugin.AnalysisConfig;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import com.vidnyan.patternscan.domain.plugin.MetricMerge;
import com.vidnyan.patternscan.domain.plugin.PluginResult;
import com.vidnyan.patternscan.domain.plugin.SourceArtifact;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Base class for plugins that scan a submission with one rule catalog.
 * Subclasses only declare their name, languages, categories and which
 * catalog they read.
 */
@Slf4j
public abstract class AbstractPatternPlugin implements AnalyzerPlugin {
    
    private final PatternRepository patternRepository;
    
    protected AbstractPatternPlugin(PatternRepository patternRepository) {
        this.patternRepository = patternRepository;
    }
    
    /**
     * Name used in log output.
     */
    protected abstract String name();
    
    /**
     * Catalog language used for the given submission language.
     */
    protected String catalogLanguage(String language) {
        return language;
    }
    
    @Override
    public PluginResult analyze(SourceArtifact source, String language, AnalysisConfig config) {
        String text = source.text();
        RuleCatalog catalog = patternRepository.getCatalog(catalogLanguage(language));
        if (catalog.isEmpty()) {
            log.debug("{}: no rules for '{}'", name(), language);
            return new PluginResult(List.of(), categoryCounts(List.of()));
        }
        
        List<Issue> issues = catalog.scan(text, source.filename(), ruleFilter(config));
        log.debug("{}: {} issues in {}", name(), issues.size(), source.filename());
        return new PluginResult(issues, categoryCounts(issues));
    }
    
    /**
     * Per-category issue counts from different plugins add up.
     */
    @Override
    public MetricMerge metricMerge(String metricKey) {
        return metricKey.endsWith(MetricKeys.ISSUES_SUFFIX) ? MetricMerge.SUM : MetricMerge.MAX;
    }
    
    private Predicate<DetectionRule> ruleFilter(AnalysisConfig config) {
        Set<String> disabled = new HashSet<>(config.stringList(AnalysisConfig.DISABLED_RULES));
        Optional<Severity> minSeverity = config.string(AnalysisConfig.MIN_SEVERITY).map(Severity::parse);
        Set<Category> categories = supportedCategories();
        return rule -> categories.contains(rule.category())
                && !disabled.contains(rule.id())
                && minSeverity.map(min -> rule.severity().isAtLeast(min)).orElse(true);
    }
    
    private Map<String, Double> categoryCounts(List<Issue> issues) {
        Map<String, Double> counts = new TreeMap<>();
        for (Category category : supportedCategories()) {
            counts.put(MetricKeys.issues(category), 0.0);
        }
        for (Issue issue : issues) {
            counts.merge(MetricKeys.issues(issue.category()), 1.0, Double::sum);
        }
        return counts;
    }
}
