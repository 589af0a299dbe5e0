package com.vidnyan.patternscan.domain.scoring;

import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.MetricKeys;
import com.vidnyan.patternscan.domain.model.Scores;
import com.vidnyan.patternscan.domain.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns merged issues and metrics into normalized scores.
 * Every function is pure: same inputs, same result, no state.
 */
public final class ScoringEngine {
    
    public static final double MAX_SCORE = 10.0;
    
    public static final double SECURITY_WEIGHT = 0.4;
    public static final double QUALITY_WEIGHT = 0.3;
    public static final double COMPLEXITY_WEIGHT = 0.2;
    public static final double PERFORMANCE_WEIGHT = 0.1;
    
    // complexity at which the complexity score halves
    static final double COMPLEXITY_SCALE = 10.0;
    
    static final double COMPLEXITY_ALERT = 15.0;
    static final double DUPLICATION_ALERT = 0.2;
    static final double COMMENT_RATIO_ALERT = 0.05;
    static final int COMMENT_CHECK_MIN_LOC = 20;
    
    private ScoringEngine() {
    }
    
    public static Scores score(List<Issue> issues, Map<String, Double> metrics) {
        double security = securityScore(issues);
        double complexity = complexityScore(metrics);
        double performance = performanceScore(issues);
        double quality = qualityScore(issues, metrics);
        return new Scores(security, complexity, performance, quality,
                globalScore(security, quality, complexity, performance));
    }
    
    /**
     * 10 minus the severity penalty of every security issue, floored at 0.
     */
    public static double securityScore(List<Issue> issues) {
        return categoryScore(issues, Category.SECURITY);
    }
    
    public static double performanceScore(List<Issue> issues) {
        return categoryScore(issues, Category.PERFORMANCE);
    }
    
    /**
     * Inverse of the raw complexity metric: 10 at zero, 5 at {@value #COMPLEXITY_SCALE}.
     */
    public static double complexityScore(Map<String, Double> metrics) {
        double complexity = Math.max(0.0, metric(metrics, MetricKeys.COMPLEXITY));
        return clamp(MAX_SCORE / (1.0 + complexity / COMPLEXITY_SCALE), 0.0, MAX_SCORE);
    }
    
    /**
     * 0-1 quality from duplication, quality-issue density and a small
     * comment bonus that can only offset penalties.
     */
    public static double qualityScore(List<Issue> issues, Map<String, Double> metrics) {
        double duplication = clamp(metric(metrics, MetricKeys.DUPLICATION_RATIO), 0.0, 1.0);
        double commentRatio = clamp(metric(metrics, MetricKeys.COMMENT_RATIO), 0.0, 1.0);
        double loc = Math.max(1.0, metric(metrics, MetricKeys.LINES_OF_CODE));
        
        double density = Math.min(1.0, penalty(issues, Category.QUALITY) / loc);
        double commentBonus = Math.min(0.1, 0.5 * commentRatio);
        return clamp(1.0 - 0.5 * duplication - 0.5 * density + commentBonus, 0.0, 1.0);
    }
    
    /**
     * Fixed-weight average on the 0-10 scale; quality is rescaled from 0-1.
     */
    public static double globalScore(double security, double quality, double complexity, double performance) {
        return SECURITY_WEIGHT * security
                + QUALITY_WEIGHT * (quality * MAX_SCORE)
                + COMPLEXITY_WEIGHT * complexity
                + PERFORMANCE_WEIGHT * performance;
    }
    
    /**
     * Distinct issue suggestions in issue order, then score-driven advice.
     */
    public static List<String> suggestions(List<Issue> issues, Map<String, Double> metrics) {
        Set<String> suggestions = new LinkedHashSet<>();
        for (Issue issue : issues) {
            if (issue.suggestion() != null && !issue.suggestion().isBlank()) {
                suggestions.add(issue.suggestion());
            }
        }
        
        List<String> advice = new ArrayList<>();
        if (count(issues, Category.SECURITY, Severity.CRITICAL) > 0) {
            advice.add("Fix critical vulnerabilities immediately");
        }
        if (count(issues, Category.SECURITY, Severity.HIGH) > 0) {
            advice.add("Resolve high severity vulnerabilities");
        }
        if (count(issues, Category.SECURITY, Severity.MEDIUM) > 2) {
            advice.add("Reduce the number of medium severity vulnerabilities");
        }
        if (metric(metrics, MetricKeys.COMPLEXITY) > COMPLEXITY_ALERT) {
            advice.add("Reduce cyclomatic complexity by splitting large functions");
        }
        if (metric(metrics, MetricKeys.DUPLICATION_RATIO) > DUPLICATION_ALERT) {
            advice.add("Extract duplicated code into shared functions");
        }
        if (metric(metrics, MetricKeys.LINES_OF_CODE) >= COMMENT_CHECK_MIN_LOC
                && metrics.containsKey(MetricKeys.COMMENT_RATIO)
                && metric(metrics, MetricKeys.COMMENT_RATIO) < COMMENT_RATIO_ALERT) {
            advice.add("Document non-obvious code paths with comments");
        }
        suggestions.addAll(advice);
        return List.copyOf(suggestions);
    }
    
    private static double categoryScore(List<Issue> issues, Category category) {
        return Math.max(0.0, MAX_SCORE - penalty(issues, category));
    }
    
    private static double penalty(List<Issue> issues, Category category) {
        double penalty = 0.0;
        for (Issue issue : issues) {
            if (issue.category() == category) {
                penalty += issue.severity().penalty();
            }
        }
        return penalty;
    }
    
    private static long count(List<Issue> issues, Category category, Severity severity) {
        return issues.stream()
                .filter(i -> i.category() == category && i.severity() == severity)
                .count();
    }
    
    private static double metric(Map<String, Double> metrics, String key) {
        if (metrics == null) {
            return 0.0;
        }
        Double value = metrics.get(key);
        return value == null || value.isNaN() ? 0.0 : value;
    }
    
    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
