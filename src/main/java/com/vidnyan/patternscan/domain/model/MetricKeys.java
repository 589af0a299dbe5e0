package com.vidnyan.patternscan.domain.model;

/**
 * Well-known metric names shared by plugins and scoring.
 */
public final class MetricKeys {
    
    public static final String TOTAL_LINES = "total_lines";
    public static final String LINES_OF_CODE = "lines_of_code";
    public static final String COMMENT_LINES = "comment_lines";
    public static final String COMMENT_RATIO = "comment_ratio";
    public static final String FUNCTIONS = "functions";
    public static final String COMPLEXITY = "complexity";
    public static final String MAX_NESTING = "max_nesting";
    public static final String DUPLICATION_RATIO = "duplication_ratio";
    
    public static final String ISSUES_SUFFIX = "_issues";
    
    /**
     * Issue count of one category, summed over every pattern plugin.
     */
    public static String issues(Category category) {
        return category.key() + ISSUES_SUFFIX;
    }
    
    private MetricKeys() {
    }
}
