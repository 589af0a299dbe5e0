package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * TypeScript and JavaScript rules: injection sinks, XSS, secrets, prototype
 * pollution, loose typing and blocking calls.
 */
@Component
public class TypeScriptAnalyzerPlugin extends AbstractPatternPlugin {
    
    public static final String NAME = "typescript";
    
    public TypeScriptAnalyzerPlugin(PatternRepository patternRepository) {
        super(patternRepository);
    }
    
    @Override
    protected String name() {
        return NAME;
    }
    
    @Override
    public Set<String> supportedLanguages() {
        return Set.of("typescript", "javascript", "ts", "js");
    }
    
    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.SECURITY, Category.QUALITY, Category.PERFORMANCE);
    }
}
