package com.vidnyan.patternscan.adapter.out.plugin;

import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.MetricKeys;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.plugin.AnalysisConfig;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import com.vidnyan.patternscan.domain.plugin.PluginResult;
import com.vidnyan.patternscan.domain.plugin.SourceArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Size, comment, complexity, nesting and duplication metrics for any
 * language. Line based heuristics; no parsing.
 */
@Slf4j
@Component
public class CodeMetricsPlugin implements AnalyzerPlugin {

    public static final String NAME = "metrics";

    static final int DUPLICATE_BLOCK_SIZE = 6;
    static final int COMPLEXITY_THRESHOLD = 20;
    static final int NESTING_THRESHOLD = 5;

    private static final Pattern DECISION_POINT = Pattern.compile(
            "\\b(?:if|elif|for|foreach|while|case|catch|except|when)\\b|&&|\\|\\|");
    private static final Pattern PYTHON_BOOLEAN = Pattern.compile("\\b(?:and|or)\\b");

    private static final Pattern PYTHON_FUNCTION = Pattern.compile("^\\s*(?:async\\s+)?def\\s+\\w+");
    private static final Pattern SQL_FUNCTION = Pattern.compile(
            "\\bcreate\\s+(?:or\\s+replace\\s+)?(?:function|procedure)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_FUNCTION = Pattern.compile(
            "\\bfunction\\b|=>|^\\s*(?:(?:public|private|protected|static|async)\\s+)*"
            + "(?!(?:if|for|while|switch|catch|return)\\b)\\w+\\s*\\([^)]*\\)\\s*\\{");
    private static final Pattern ANY_FUNCTION = Pattern.compile(
            "\\bfunction\\b|=>|\\bdef\\s+\\w+|\\bfunc\\s+\\w+|\\bfn\\s+\\w+");

    @Override
    public Set<String> supportedLanguages() {
        return Set.of(ANY_LANGUAGE);
    }

    @Override
    public Set<Category> supportedCategories() {
        return Set.of(Category.QUALITY);
    }

    @Override
    public PluginResult analyze(SourceArtifact source, String language, AnalysisConfig config) {
        String text = source.text();
        Syntax syntax = Syntax.of(language);
        List<String> lines = text.isEmpty() ? List.of() : splitLines(text);

        List<String> codeLines = new ArrayList<>();
        int commentLines = 0;
        boolean inBlock = false;
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (inBlock) {
                commentLines++;
                inBlock = !line.contains("*/");
                continue;
            }
            if (syntax.blockComments && line.startsWith("/*")) {
                commentLines++;
                inBlock = !line.substring(2).contains("*/");
                continue;
            }
            if (syntax.isLineComment(line)) {
                commentLines++;
                continue;
            }
            codeLines.add(raw);
        }

        int loc = codeLines.size();
        int complexity = complexity(codeLines, syntax);
        int functions = functions(codeLines, syntax);
        int nesting = syntax == Syntax.PYTHON ? indentNesting(codeLines) : braceNesting(codeLines);
        double duplication = duplicationRatio(codeLines);
        double commentRatio = commentLines + loc == 0 ? 0.0 : (double) commentLines / (commentLines + loc);

        Map<String, Double> metrics = new TreeMap<>();
        metrics.put(MetricKeys.TOTAL_LINES, (double) lines.size());
        metrics.put(MetricKeys.LINES_OF_CODE, (double) loc);
        metrics.put(MetricKeys.COMMENT_LINES, (double) commentLines);
        metrics.put(MetricKeys.COMMENT_RATIO, commentRatio);
        metrics.put(MetricKeys.FUNCTIONS, (double) functions);
        metrics.put(MetricKeys.COMPLEXITY, (double) complexity);
        metrics.put(MetricKeys.MAX_NESTING, (double) nesting);
        metrics.put(MetricKeys.DUPLICATION_RATIO, duplication);

        Set<String> disabled = new HashSet<>(config.stringList(AnalysisConfig.DISABLED_RULES));
        List<Issue> issues = new ArrayList<>();
        if (complexity > COMPLEXITY_THRESHOLD && !disabled.contains("high_complexity")) {
            issues.add(fileIssue(source, "high_complexity", Severity.MEDIUM,
                    "Cyclomatic complexity too high (" + complexity + " decision points)",
                    "Split the logic into smaller functions"));
        }
        if (nesting > NESTING_THRESHOLD && !disabled.contains("deep_nesting")) {
            issues.add(fileIssue(source, "deep_nesting", Severity.LOW,
                    "Nesting depth " + nesting + " exceeds " + NESTING_THRESHOLD,
                    "Use early returns or extract nested blocks"));
        }
        log.debug("metrics: {} loc, complexity {}, nesting {} in {}", loc, complexity, nesting, source.filename());
        return new PluginResult(issues, metrics);
    }

    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        // a trailing newline does not open another line
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static int complexity(List<String> codeLines, Syntax syntax) {
        int count = 0;
        for (String line : codeLines) {
            count += occurrences(DECISION_POINT, line);
            if (syntax == Syntax.PYTHON) {
                count += occurrences(PYTHON_BOOLEAN, line);
            }
        }
        return count;
    }

    private static int functions(List<String> codeLines, Syntax syntax) {
        Pattern pattern = switch (syntax) {
            case PYTHON -> PYTHON_FUNCTION;
            case SQL -> SQL_FUNCTION;
            case SCRIPT -> SCRIPT_FUNCTION;
            case OTHER -> ANY_FUNCTION;
        };
        int count = 0;
        for (String line : codeLines) {
            if (pattern.matcher(line).find()) {
                count++;
            }
        }
        return count;
    }

    private static int occurrences(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    static int braceNesting(List<String> codeLines) {
        int depth = 0;
        int max = 0;
        for (String line : codeLines) {
            char quote = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quote != 0) {
                    if (c == '\\') {
                        i++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '"' || c == '\'' || c == '`') {
                    quote = c;
                } else if (c == '{') {
                    max = Math.max(max, ++depth);
                } else if (c == '}') {
                    depth = Math.max(0, depth - 1);
                }
            }
        }
        return max;
    }

    static int indentNesting(List<String> codeLines) {
        int unit = Integer.MAX_VALUE;
        int deepest = 0;
        for (String line : codeLines) {
            int indent = indentWidth(line);
            if (indent > 0) {
                unit = Math.min(unit, indent);
            }
            deepest = Math.max(deepest, indent);
        }
        return unit == Integer.MAX_VALUE ? 0 : deepest / unit;
    }

    private static int indentWidth(String line) {
        int width = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') width++;
            else if (c == '\t') width += 4;
            else break;
        }
        return width;
    }

    /**
     * Share of code lines that belong to a block of {@value #DUPLICATE_BLOCK_SIZE}
     * consecutive code lines appearing more than once.
     */
    static double duplicationRatio(List<String> codeLines) {
        int loc = codeLines.size();
        if (loc < 2 * DUPLICATE_BLOCK_SIZE) {
            return 0.0;
        }
        List<String> normalized = codeLines.stream().map(String::strip).toList();
        Map<String, List<Integer>> blocks = new HashMap<>();
        for (int i = 0; i + DUPLICATE_BLOCK_SIZE <= loc; i++) {
            String block = String.join("\n", normalized.subList(i, i + DUPLICATE_BLOCK_SIZE));
            blocks.computeIfAbsent(block, k -> new ArrayList<>()).add(i);
        }
        boolean[] duplicated = new boolean[loc];
        for (List<Integer> starts : blocks.values()) {
            if (starts.size() < 2) {
                continue;
            }
            for (int start : starts) {
                for (int j = start; j < start + DUPLICATE_BLOCK_SIZE; j++) {
                    duplicated[j] = true;
                }
            }
        }
        int count = 0;
        for (boolean d : duplicated) {
            if (d) count++;
        }
        return (double) count / loc;
    }

    private static Issue fileIssue(SourceArtifact source, String type, Severity severity,
                                   String message, String suggestion) {
        return Issue.builder()
                .type(type)
                .severity(severity)
                .category(Category.QUALITY)
                .message(message)
                .file(source.filename())
                .line(1)
                .suggestion(suggestion)
                .build();
    }

    private enum Syntax {
        PYTHON(false),
        SQL(true),
        SCRIPT(true),
        OTHER(true);

        final boolean blockComments;

        Syntax(boolean blockComments) {
            this.blockComments = blockComments;
        }

        static Syntax of(String language) {
            return switch (AnalyzerPlugin.normalizeLanguage(language)) {
                case "python", "py" -> PYTHON;
                case "sql" -> SQL;
                case "typescript", "javascript", "ts", "js" -> SCRIPT;
                default -> OTHER;
            };
        }

        boolean isLineComment(String stripped) {
            return switch (this) {
                case PYTHON -> stripped.startsWith("#");
                case SQL -> stripped.startsWith("--");
                case SCRIPT -> stripped.startsWith("//") || stripped.startsWith("*");
                case OTHER -> stripped.startsWith("//") || stripped.startsWith("#") || stripped.startsWith("--");
            };
        }
    }
}
