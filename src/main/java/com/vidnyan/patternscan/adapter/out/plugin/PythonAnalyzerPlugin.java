package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Python rules: eval/exec, unsafe deserialization, shell injection, weak
 * hashing and common style problems.
 */
@Component
public class PythonAnalyzerPlugin extends AbstractPatternPlugin {
    
    public static final String NAME = "python";
    
    public PythonAnalyzerPlugin(PatternRepository patternRepository) {
        super(patternRepository);
    }
    
    @Override
    protected String name() {
        return NAME;
    }
    
    @Override
    public Set<String> supportedLanguages() {
        return Set.of("python", "py");
    }
    
    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.SECURITY, Category.QUALITY, Category.PERFORMANCE);
    }
}
