package com.vidnyan.patternscan.adapter.in.cli;

import com.vidnyan.patternscan.application.port.in.AnalysisHistoryUseCase;
import com.vidnyan.patternscan.application.port.in.AnalyzeCodeUseCase.SubmissionRequest;
import com.vidnyan.patternscan.application.service.AnalysisApplicationService;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.PluginExecution;
import com.vidnyan.patternscan.domain.model.Scores;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.model.UsageStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * CLI Runner for analysing a single file.
 * Runs when patternscan.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_ISSUES = 100;

    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.of(
            "ts", "typescript",
            "tsx", "typescript",
            "js", "javascript",
            "jsx", "javascript",
            "mjs", "javascript",
            "py", "python",
            "sql", "sql");

    private final AnalysisApplicationService analysisService;
    private final AnalysisHistoryUseCase history;
    private final ConfigurableApplicationContext context;

    @Value("${patternscan.analyze.path:}")
    private String sourcePath;

    @Value("${patternscan.analyze.language:}")
    private String language;

    @Value("${patternscan.analyze.user:cli}")
    private String userId;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set patternscan.analyze.path property.");
            return;
        }

        try {
            Path path = Path.of(sourcePath);
            String lang = language == null || language.isBlank() ? inferLanguage(path) : language;

            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              PatternScan - Code Analysis Engine              ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("║ Language:  {}", lang);
            log.info("╚══════════════════════════════════════════════════════════════╝");

            byte[] content = Files.readAllBytes(path);
            String fileName = path.getFileName() != null ? path.getFileName().toString() : sourcePath;
            String id = analysisService.submit(
                    new SubmissionRequest(content, fileName, lang, userId, Map.of()));
            Analysis analysis = analysisService.completion(id).get();

            printResults(analysis);
            printUsage(history.getUsageStats());

            log.info("");
            log.info("Analysis complete!");
        } finally {
            // Ensure application shuts down after analysis
            SpringApplication.exit(context, () -> 0);
        }
    }

    static String inferLanguage(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return "text";
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return LANGUAGE_BY_EXTENSION.getOrDefault(extension, extension);
    }

    private void printResults(Analysis analysis) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS {} - {}", analysis.id(), analysis.status());
        log.info("═══════════════════════════════════════════════════════════════");
        for (PluginExecution execution : analysis.executions()) {
            log.info(" {} {} ({} issues, {}ms){}", execution.status(), execution.pluginName(),
                    execution.issueCount(), execution.duration().toMillis(),
                    execution.message() != null ? " - " + execution.message() : "");
        }
        log.info("───────────────────────────────────────────────────────────────");

        if (analysis.failure() != null) {
            log.info(" FAILED: {}", analysis.failure().format());
            return;
        }

        Scores scores = analysis.scores();
        log.info(" SCORES:");
        log.info("   Global:      {} ({})", format(scores.global()), scores.grade());
        log.info("   Security:    {}", format(scores.security()));
        log.info("   Complexity:  {}", format(scores.complexity()));
        log.info("   Performance: {}", format(scores.performance()));
        log.info("   Quality:     {}", format(scores.quality()));
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" ISSUES:");
        for (Severity severity : Severity.values()) {
            long count = analysis.issues().stream().filter(i -> i.severity() == severity).count();
            log.info("   {}: {}", String.format("%-8s", severity), count);
        }
        log.info("═══════════════════════════════════════════════════════════════");

        if (analysis.issues().isEmpty()) {
            log.info("");
            log.info("✅ No issues found!");
        }

        int count = 0;
        for (Issue issue : analysis.issues()) {
            count++;
            if (count > MAX_LISTED_ISSUES) {
                log.info(" ... and {} more issues", analysis.issues().size() - MAX_LISTED_ISSUES);
                break;
            }
            log.info("");
            log.info(" {} [{}] {}", issue.severity(), issue.category().key(), issue.type());
            log.info(" Location: {}", issue.location());
            log.info(" Message:  {}", issue.message());
            if (issue.reference() != null) {
                log.info(" Ref:      {}", issue.reference());
            }
        }

        if (!analysis.suggestions().isEmpty()) {
            log.info("");
            log.info(" SUGGESTIONS:");
            analysis.suggestions().forEach(s -> log.info("   💡 {}", s));
        }
    }

    private void printUsage(UsageStats usage) {
        log.info("");
        log.info(" Usage: {} analyses, {} errors, by analyzer {}",
                usage.totalAnalyses(), usage.errorCount(), usage.analysesByAnalyzer());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
