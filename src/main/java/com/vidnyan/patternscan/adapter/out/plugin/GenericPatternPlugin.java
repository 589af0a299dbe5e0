package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Language-agnostic rules applied to every submission: hard-coded secrets,
 * private keys, cloud credentials and housekeeping markers.
 */
@Component
public class GenericPatternPlugin extends AbstractPatternPlugin {
    
    public static final String NAME = "generic";
    
    public GenericPatternPlugin(PatternRepository patternRepository) {
        super(patternRepository);
    }
    
    @Override
    protected String name() {
        return NAME;
    }
    
    @Override
    public Set<String> supportedLanguages() {
        return Set.of(ANY_LANGUAGE);
    }
    
    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.SECURITY, Category.QUALITY);
    }
    
    /**
     * Always reads the language-agnostic catalog.
     */
    @Override
    protected String catalogLanguage(String language) {
        return PatternRepository.ANY_LANGUAGE;
    }
}
