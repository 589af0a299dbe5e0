package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.application.port.out.AnalysisRepository;
import com.vidnyan.patternscan.application.port.out.PluginFactory;
import com.vidnyan.patternscan.domain.error.AnalysisTimeoutException;
import com.vidnyan.patternscan.domain.error.PluginFaultException;
import com.vidnyan.patternscan.domain.error.UnsupportedInputException;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisFailure;
import com.vidnyan.patternscan.domain.model.FailureKind;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.PluginExecution;
import com.vidnyan.patternscan.domain.model.Scores;
import com.vidnyan.patternscan.domain.plugin.AnalysisConfig;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import com.vidnyan.patternscan.domain.plugin.MetricMerge;
import com.vidnyan.patternscan.domain.plugin.PluginResult;
import com.vidnyan.patternscan.domain.plugin.SourceArtifact;
import com.vidnyan.patternscan.domain.scoring.ScoringEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one submission through PENDING -> PROCESSING -> {COMPLETED, FAILED}.
 * Applicable plugins run in parallel on the plugin executor; their results
 * are merged only once all of them finished. An unexpected plugin fault or
 * the submission deadline cancels the sibling plugins and fails the whole
 * submission, dropping every partial issue.
 * <p>
 * All submissions share the plugin executor. A plugin that ignores
 * interruption keeps its thread past the deadline; such overdue runs are
 * counted and logged until they return.
 */
@Slf4j
public class AnalysisOrchestrator {

    private final PluginRegistry registry;
    private final PluginFactory pluginFactory;
    private final AnalysisRepository repository;
    private final StatisticsService statistics;
    private final ExecutorService pluginExecutor;
    private final Clock clock;
    private final Duration submissionTimeout;

    private final AtomicInteger overdueRuns = new AtomicInteger();

    public AnalysisOrchestrator(PluginRegistry registry,
                                PluginFactory pluginFactory,
                                AnalysisRepository repository,
                                StatisticsService statistics,
                                ExecutorService pluginExecutor,
                                Clock clock,
                                Duration submissionTimeout) {
        this.registry = registry;
        this.pluginFactory = pluginFactory;
        this.repository = repository;
        this.statistics = statistics;
        this.pluginExecutor = pluginExecutor;
        this.clock = clock;
        this.submissionTimeout = submissionTimeout;
    }

    /**
     * Receives (completed plugins, applicable plugins) while a submission runs.
     */
    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = (completed, total) -> { };

        void onProgress(int completed, int total);
    }

    /**
     * Run a pending analysis to a terminal state, persist it and record it
     * in the statistics.
     */
    public Analysis process(Analysis pending, SourceArtifact source, AnalysisConfig config,
                            ProgressListener progress) {
        Instant start = clock.instant();
        Analysis processing = pending.startProcessing(start);
        repository.save(processing);
        log.info("Analysis {} PROCESSING: {} ({} bytes, language={})",
                processing.id(), source.filename(), source.sizeBytes(), processing.language());

        Map<String, AnalyzerPlugin> plugins = new LinkedHashMap<>();
        Map<String, PluginRun> finished = new TreeMap<>();
        Analysis terminal;
        try {
            plugins.putAll(resolvePlugins(processing.language()));
            progress.onProgress(0, plugins.size());
            runPlugins(plugins, source, processing.language(), config, progress, finished);
            terminal = complete(processing, finished);
        } catch (PluginFaultException e) {
            log.error("Analysis {} FAILED: plugin '{}' faulted: {}", processing.id(), e.pluginName(), e.getMessage());
            terminal = processing.fail(
                    new AnalysisFailure(FailureKind.PLUGIN_FAULT, e.pluginName(), e.getMessage()),
                    executions(plugins, finished, e.pluginName(), "cancelled after fault in " + e.pluginName()),
                    clock.instant());
        } catch (AnalysisTimeoutException e) {
            String stuck = String.join(",", e.pendingPlugins());
            log.error("Analysis {} FAILED: {}", processing.id(), e.getMessage());
            terminal = processing.fail(
                    new AnalysisFailure(FailureKind.TIMEOUT, stuck, e.getMessage()),
                    executions(plugins, finished, null, "timed out"),
                    clock.instant());
        } catch (CancellationException e) {
            log.warn("Analysis {} FAILED: cancelled", processing.id());
            terminal = processing.fail(
                    new AnalysisFailure(FailureKind.CANCELLED, null, String.valueOf(e.getMessage())),
                    executions(plugins, finished, null, "cancelled"),
                    clock.instant());
        } catch (RuntimeException e) {
            log.error("Analysis {} FAILED: internal error while merging results", processing.id(), e);
            terminal = processing.fail(
                    new AnalysisFailure(FailureKind.INTERNAL_ERROR, null,
                            e.getClass().getSimpleName() + ": " + e.getMessage()),
                    executions(plugins, finished, null, "aborted"),
                    clock.instant());
        }

        repository.save(terminal);
        statistics.record(terminal, new ArrayList<>(plugins.keySet()));
        log.info("Analysis {} {} in {}ms: {} issues",
                terminal.id(), terminal.status(),
                Duration.between(start, terminal.updatedAt()).toMillis(),
                terminal.issues().size());
        return terminal;
    }

    /**
     * Fail a submission that never got to run (e.g. the submission executor
     * rejected it).
     */
    public Analysis reject(Analysis pending, String reason) {
        Instant now = clock.instant();
        Analysis failed = pending.startProcessing(now)
                .fail(new AnalysisFailure(FailureKind.CANCELLED, null, reason), List.of(), now);
        repository.save(failed);
        statistics.record(failed, List.of());
        log.warn("Analysis {} FAILED before processing: {}", failed.id(), reason);
        return failed;
    }

    /**
     * Release the plugin executor.
     */
    public void shutdown() {
        pluginExecutor.shutdownNow();
    }

    /**
     * Plugin runs that outlived their submission deadline and still hold a
     * plugin thread.
     */
    public int overdueRuns() {
        return overdueRuns.get();
    }

    /**
     * Registered plugins that declare the language, plus language-agnostic ones,
     * in registry (name) order.
     */
    Map<String, AnalyzerPlugin> resolvePlugins(String language) {
        Map<String, AnalyzerPlugin> applicable = new LinkedHashMap<>();
        for (Map.Entry<String, Class<? extends AnalyzerPlugin>> binding : registry.list().entrySet()) {
            String name = binding.getKey();
            AnalyzerPlugin plugin;
            try {
                plugin = pluginFactory.create(name, binding.getValue());
            } catch (RuntimeException e) {
                throw new PluginFaultException(name, e);
            }
            if (plugin.supports(language)) {
                applicable.put(name, plugin);
            }
        }
        log.debug("Applicable plugins for '{}': {}", language, applicable.keySet());
        return applicable;
    }

    private void runPlugins(Map<String, AnalyzerPlugin> plugins, SourceArtifact source, String language,
                            AnalysisConfig config, ProgressListener progress, Map<String, PluginRun> finished) {
        if (plugins.isEmpty()) {
            return;
        }
        CompletionService<PluginRun> completion = new ExecutorCompletionService<>(pluginExecutor);
        Map<Future<PluginRun>, PluginTask> running = new HashMap<>();
        for (Map.Entry<String, AnalyzerPlugin> entry : plugins.entrySet()) {
            PluginTask task = new PluginTask(entry.getKey(), entry.getValue());
            running.put(completion.submit(() -> task.call(source, language, config)), task);
        }

        long deadline = System.nanoTime() + submissionTimeout.toNanos();
        Future<PluginRun> current = null;
        try {
            for (int i = 0; i < plugins.size(); i++) {
                long remaining = deadline - System.nanoTime();
                current = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (current == null) {
                    List<PluginTask> stuck = running.entrySet().stream()
                            .filter(e -> !e.getKey().isDone())
                            .map(Map.Entry::getValue)
                            .toList();
                    stuck.forEach(PluginTask::markOverdue);
                    throw new AnalysisTimeoutException(submissionTimeout,
                            stuck.stream().map(PluginTask::name).sorted().toList());
                }
                PluginRun run = current.get();
                finished.put(run.name(), run);
                progress.onProgress(finished.size(), plugins.size());
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PluginFaultException fault) {
                throw fault;
            }
            throw new PluginFaultException(running.get(current).name(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for plugins");
        } finally {
            running.keySet().forEach(f -> f.cancel(true));
        }
    }

    private PluginRun runOne(String name, AnalyzerPlugin plugin, SourceArtifact source,
                             String language, AnalysisConfig config) {
        Instant start = clock.instant();
        try {
            PluginResult result = plugin.analyze(source, language, config);
            checkResult(result);
            Duration took = Duration.between(start, clock.instant());
            log.debug("  {} found {} issues in {}ms", name, result.issues().size(), took.toMillis());
            return new PluginRun(name, plugin, result,
                    PluginExecution.success(name, result.issues().size(), took));
        } catch (UnsupportedInputException e) {
            log.warn("  {} skipped: {}", name, e.getMessage());
            return new PluginRun(name, plugin, PluginResult.empty(),
                    PluginExecution.skipped(name, e.getMessage(), Duration.between(start, clock.instant())));
        } catch (RuntimeException e) {
            throw new PluginFaultException(name, e);
        }
    }

    private static void checkResult(PluginResult result) {
        if (result == null) {
            throw new IllegalStateException("plugin returned no result");
        }
        for (Issue issue : result.issues()) {
            if (issue.type() == null || issue.severity() == null || issue.category() == null) {
                throw new IllegalStateException("issue without type, severity or category: " + issue);
            }
            if (issue.line() < 1) {
                throw new IllegalStateException("issue '" + issue.type() + "' has line " + issue.line());
            }
        }
    }

    private Analysis complete(Analysis processing, Map<String, PluginRun> finished) {
        List<Issue> issues = new ArrayList<>();
        Map<String, Double> metrics = new TreeMap<>();
        List<PluginExecution> executions = new ArrayList<>();

        for (PluginRun run : finished.values()) {
            issues.addAll(run.result().issues());
            run.result().metrics().forEach((key, value) ->
                    metrics.merge(key, value, (existing, incoming) ->
                            mergeRule(run, key).apply(existing, incoming)));
            executions.add(run.execution());
        }
        issues.sort(Issue.MERGE_ORDER);

        Scores scores = ScoringEngine.score(issues, metrics);
        List<String> suggestions = ScoringEngine.suggestions(issues, metrics);
        return processing.complete(issues, metrics, suggestions, scores, executions, clock.instant());
    }

    private static MetricMerge mergeRule(PluginRun run, String key) {
        MetricMerge rule = run.plugin().metricMerge(key);
        if (rule == null) {
            throw new PluginFaultException(run.name(),
                    new IllegalStateException("no merge rule for metric '" + key + "'"));
        }
        return rule;
    }

    private static List<PluginExecution> executions(Map<String, AnalyzerPlugin> plugins,
                                                    Map<String, PluginRun> finished,
                                                    String faultedPlugin, String reason) {
        List<PluginExecution> executions = new ArrayList<>();
        for (String name : plugins.keySet()) {
            PluginRun run = finished.get(name);
            if (run != null) {
                executions.add(run.execution());
            } else if (name.equals(faultedPlugin)) {
                executions.add(PluginExecution.fault(name, "unexpected fault"));
            } else {
                executions.add(PluginExecution.cancelled(name, reason));
            }
        }
        return executions;
    }

    /**
     * One plugin scheduled for one submission. Tracks whether the run still
     * holds its thread after the submission gave up on it.
     */
    private final class PluginTask {

        private final String name;
        private final AnalyzerPlugin plugin;
        private boolean started;
        private boolean finished;
        private boolean overdue;
        private long overdueSince;

        PluginTask(String name, AnalyzerPlugin plugin) {
            this.name = name;
            this.plugin = plugin;
        }

        String name() {
            return name;
        }

        PluginRun call(SourceArtifact source, String language, AnalysisConfig config) {
            synchronized (this) {
                started = true;
            }
            try {
                return runOne(name, plugin, source, language, config);
            } finally {
                finish();
            }
        }

        synchronized void markOverdue() {
            if (started && !finished && !overdue) {
                overdue = true;
                overdueSince = System.nanoTime();
                int held = overdueRuns.incrementAndGet();
                log.warn("Plugin '{}' missed the submission deadline; {} plugin thread(s) now held by overdue runs",
                        name, held);
            }
        }

        private synchronized void finish() {
            finished = true;
            if (overdue) {
                int held = overdueRuns.decrementAndGet();
                log.warn("Plugin '{}' released its thread {}ms after the deadline; {} still held",
                        name, (System.nanoTime() - overdueSince) / 1_000_000, held);
            }
        }
    }

    private record PluginRun(
        String name,
        AnalyzerPlugin plugin,
        PluginResult result,
        PluginExecution execution
    ) {}
}
