package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * SQL injection signatures and query anti-patterns.
 */
@Component
public class SqlAnalyzerPlugin extends AbstractPatternPlugin {
    
    public static final String NAME = "sql";
    
    public SqlAnalyzerPlugin(PatternRepository patternRepository) {
        super(patternRepository);
    }
    
    @Override
    protected String name() {
        return NAME;
    }
    
    @Override
    public Set<String> supportedLanguages() {
        return Set.of("sql");
    }
    
    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.SECURITY, Category.QUALITY, Category.PERFORMANCE);
    }
}
