package com.vidnyan.patternscan.application.port.out;

import com.vidnyan.patternscan.domain.pattern.DetectionRule;
import com.vidnyan.patternscan.domain.pattern.RuleCatalog;

import java.util.Map;
import java.util.Set;

/**
 * Port for per-language rule catalogs.
 * Implemented by adapters that load declarative rule tables.
 */
public interface PatternRepository {
    
    /**
     * Key of the catalog that applies to every language.
     */
    String ANY_LANGUAGE = "*";
    
    /**
     * Read-only rules for a language, keyed by rule id. Repeated calls return
     * the same compiled rules; an unknown language yields an empty map.
     */
    Map<String, DetectionRule> getPatterns(String language);
    
    /**
     * Compiled catalog for a language, empty when none is registered.
     */
    RuleCatalog getCatalog(String language);
    
    /**
     * Languages (aliases included) that have a catalog.
     */
    Set<String> languages();
}
