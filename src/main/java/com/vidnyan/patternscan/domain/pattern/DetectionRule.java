package com.vidnyan.patternscan.domain.pattern;

import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Severity;

import java.util.regex.Pattern;

/**
 * A compiled detection rule plus the metadata copied onto every issue it
 * raises. Immutable; compiled once when its catalog is loaded.
 *
 * @param multiline when true the matcher runs over the whole file instead of line by line
 */
public record DetectionRule(
    String id,
    Pattern matcher,
    Severity severity,
    Category category,
    String description,
    String reference,
    String suggestion,
    boolean multiline
) {}
