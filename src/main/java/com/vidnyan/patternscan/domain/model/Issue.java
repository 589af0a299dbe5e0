package com.vidnyan.patternscan.domain.model;

import java.util.Comparator;

/**
 * One detected problem instance.
 * Immutable value object.
 */
public record Issue(
    String type,
    Severity severity,
    Category category,
    String message,
    String file,
    int line,
    Integer column,
    String snippet,
    String suggestion,
    String reference
) {
    
    /**
     * Merge order: file, line, then most severe first. Column and type keep
     * the order total so merged output is deterministic.
     */
    public static final Comparator<Issue> MERGE_ORDER = Comparator
            .comparing(Issue::file, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Issue::line)
            .thenComparing(Issue::severity, Comparator.reverseOrder())
            .thenComparing(i -> i.column() == null ? 0 : i.column())
            .thenComparing(Issue::type, Comparator.nullsFirst(Comparator.naturalOrder()));
    
    /**
     * Format location for display.
     */
    public String location() {
        return column == null
                ? file + ":" + line
                : file + ":" + line + ":" + column;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String type;
        private Severity severity = Severity.MEDIUM;
        private Category category = Category.QUALITY;
        private String message;
        private String file;
        private int line;
        private Integer column;
        private String snippet = "";
        private String suggestion;
        private String reference;
        
        public Builder type(String type) { this.type = type; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(Integer column) { this.column = column; return this; }
        public Builder snippet(String snippet) { this.snippet = snippet; return this; }
        public Builder suggestion(String suggestion) { this.suggestion = suggestion; return this; }
        public Builder reference(String reference) { this.reference = reference; return this; }
        
        public Issue build() {
            return new Issue(type, severity, category, message, file, line, column,
                    snippet, suggestion, reference);
        }
    }
}
