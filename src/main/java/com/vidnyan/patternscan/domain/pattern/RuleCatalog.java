package com.vidnyan.patternscan.domain.pattern;

import com.vidnyan.patternscan.domain.model.Issue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiled rule set for one language.
 * Line-wise rules are also folded into a single alternation used as a
 * prefilter: a line the combined matcher rejects is not tried rule by rule.
 * Instances are immutable and shared between concurrent scans.
 */
public final class RuleCatalog {
    
    private static final int MAX_SNIPPET = 160;
    private static final Pattern BACK_REFERENCE = Pattern.compile("\\\\[1-9]|\\\\k<");
    
    private final String language;
    private final Map<String, DetectionRule> rules;
    private final List<DetectionRule> lineRules;
    private final List<DetectionRule> multilineRules;
    private final Pattern linePrefilter;
    
    public RuleCatalog(String language, Collection<DetectionRule> rules) {
        this.language = language;
        Map<String, DetectionRule> byId = new LinkedHashMap<>();
        for (DetectionRule rule : rules) {
            byId.put(rule.id(), rule);
        }
        this.rules = Collections.unmodifiableMap(byId);
        this.lineRules = byId.values().stream().filter(r -> !r.multiline()).toList();
        this.multilineRules = byId.values().stream().filter(DetectionRule::multiline).toList();
        this.linePrefilter = combine(lineRules);
    }
    
    public static RuleCatalog empty(String language) {
        return new RuleCatalog(language, List.of());
    }
    
    public String language() {
        return language;
    }
    
    /**
     * Read-only view of the rules keyed by rule id.
     */
    public Map<String, DetectionRule> rules() {
        return rules;
    }
    
    public boolean isEmpty() {
        return rules.isEmpty();
    }
    
    boolean hasPrefilter() {
        return linePrefilter != null;
    }
    
    /**
     * Scan source text with every rule accepted by {@code filter}.
     * A rule raises at most one issue per line: the first match wins and later
     * matches on the same line are suppressed.
     */
    public List<Issue> scan(String source, String file, Predicate<DetectionRule> filter) {
        List<DetectionRule> activeLineRules = lineRules.stream().filter(filter).toList();
        List<DetectionRule> activeMultiline = multilineRules.stream().filter(filter).toList();
        if (source.isEmpty() || (activeLineRules.isEmpty() && activeMultiline.isEmpty())) {
            return List.of();
        }
        
        List<Issue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String[] lines = source.split("\n", -1);
        
        if (!activeLineRules.isEmpty()) {
            Matcher prefilter = linePrefilter == null ? null : linePrefilter.matcher("");
            for (int i = 0; i < lines.length; i++) {
                checkInterrupted();
                String line = stripCarriageReturn(lines[i]);
                if (prefilter != null && !prefilter.reset(line).find()) {
                    continue;
                }
                for (DetectionRule rule : activeLineRules) {
                    Matcher m = rule.matcher().matcher(line);
                    if (m.find() && seen.add(rule.id() + ":" + (i + 1))) {
                        issues.add(toIssue(rule, file, i + 1, m.start() + 1, line));
                    }
                }
            }
        }
        
        if (!activeMultiline.isEmpty()) {
            int[] lineStarts = lineStarts(source);
            for (DetectionRule rule : activeMultiline) {
                checkInterrupted();
                Matcher m = rule.matcher().matcher(source);
                while (m.find()) {
                    int lineIndex = lineIndexOf(lineStarts, m.start());
                    if (seen.add(rule.id() + ":" + (lineIndex + 1))) {
                        int column = m.start() - lineStarts[lineIndex] + 1;
                        issues.add(toIssue(rule, file, lineIndex + 1, column,
                                stripCarriageReturn(lines[lineIndex])));
                    }
                }
            }
        }
        return issues;
    }
    
    private Issue toIssue(DetectionRule rule, String file, int line, int column, String lineText) {
        return Issue.builder()
                .type(rule.id())
                .severity(rule.severity())
                .category(rule.category())
                .message(rule.description())
                .file(file)
                .line(line)
                .column(column)
                .snippet(snippet(lineText))
                .suggestion(rule.suggestion())
                .reference(rule.reference())
                .build();
    }
    
    private static String snippet(String line) {
        String trimmed = line.strip();
        return trimmed.length() <= MAX_SNIPPET ? trimmed : trimmed.substring(0, MAX_SNIPPET) + "...";
    }
    
    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
    
    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
    
    private static int lineIndexOf(int[] lineStarts, int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }
    
    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Pattern scan interrupted");
        }
    }
    
    /**
     * Build the combined line prefilter, or null when some rule cannot be
     * embedded safely (back references, flags without an inline form).
     */
    private static Pattern combine(List<DetectionRule> rules) {
        if (rules.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (DetectionRule rule : rules) {
            String embedded = embed(rule.matcher());
            if (embedded == null) {
                return null;
            }
            parts.add(embedded);
        }
        try {
            return Pattern.compile(parts.stream().collect(Collectors.joining("|")));
        } catch (PatternSyntaxException e) {
            return null;
        }
    }
    
    private static String embed(Pattern pattern) {
        if (BACK_REFERENCE.matcher(pattern.pattern()).find()) {
            return null;
        }
        int flags = pattern.flags();
        StringBuilder inline = new StringBuilder();
        if ((flags & Pattern.CASE_INSENSITIVE) != 0) inline.append('i');
        if ((flags & Pattern.MULTILINE) != 0) inline.append('m');
        if ((flags & Pattern.DOTALL) != 0) inline.append('s');
        if ((flags & Pattern.UNICODE_CASE) != 0) inline.append('u');
        if ((flags & Pattern.UNIX_LINES) != 0) inline.append('d');
        int supported = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL
                | Pattern.UNICODE_CASE | Pattern.UNIX_LINES;
        if ((flags & ~supported) != 0) {
            return null;
        }
        return "(?" + inline + ":" + pattern.pattern() + ")";
    }
}
