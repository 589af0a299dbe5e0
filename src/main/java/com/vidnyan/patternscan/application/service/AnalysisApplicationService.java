package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.patternscan.application.port.out.AnalysisRepository;
import com.vidnyan.patternscan.domain.error.NotFoundException;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import com.vidnyan.patternscan.domain.plugin.AnalysisConfig;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import com.vidnyan.patternscan.domain.plugin.SourceArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Main application service: accepts submissions, schedules them on the
 * submission executor and answers status and result queries.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeCodeUseCase {

    private static final String DEFAULT_FILENAME = "unknown";
    private static final String ANONYMOUS = "anonymous";

    private final AnalysisOrchestrator orchestrator;
    private final AnalysisRepository repository;
    private final ExecutorService submissionExecutor;
    private final Clock clock;

    private final Map<String, SubmissionProgress> inFlight = new ConcurrentHashMap<>();

    @Override
    public String submit(SubmissionRequest request) {
        if (request == null || request.source() == null) {
            throw new IllegalArgumentException("source is required");
        }
        String language = AnalyzerPlugin.normalizeLanguage(request.language());
        if (language.isEmpty()) {
            throw new IllegalArgumentException("language is required");
        }
        String filename = request.filename() == null || request.filename().isBlank()
                ? DEFAULT_FILENAME : request.filename();
        String userId = request.userId() == null || request.userId().isBlank()
                ? ANONYMOUS : request.userId();

        SourceArtifact source = SourceArtifact.of(filename, request.source());
        AnalysisConfig config = new AnalysisConfig(request.config());

        String id = UUID.randomUUID().toString();
        SubmissionProgress progress = new SubmissionProgress();
        inFlight.put(id, progress);
        Analysis pending = Analysis.pending(id, userId, language, filename, clock.instant());
        repository.save(pending);
        log.info("Analysis {} PENDING: {} from user {} ({})", id, filename, userId, language);

        try {
            submissionExecutor.execute(() -> run(pending, source, config, progress));
        } catch (RejectedExecutionException e) {
            inFlight.remove(id);
            Analysis failed = orchestrator.reject(pending, "submission rejected: " + e.getMessage());
            progress.completion.complete(failed);
        }
        return id;
    }

    private void run(Analysis pending, SourceArtifact source, AnalysisConfig config, SubmissionProgress progress) {
        try {
            Analysis terminal = orchestrator.process(pending, source, config, progress);
            progress.completion.complete(terminal);
        } catch (RuntimeException e) {
            log.error("Analysis {} aborted unexpectedly", pending.id(), e);
            progress.completion.completeExceptionally(e);
        } finally {
            inFlight.remove(pending.id());
        }
    }

    @Override
    public StatusView getStatus(String analysisId) {
        Analysis analysis = getResult(analysisId);
        int percent = switch (analysis.status()) {
            case PENDING -> 0;
            case PROCESSING -> {
                SubmissionProgress progress = inFlight.get(analysisId);
                yield progress == null ? 0 : progress.percent();
            }
            case COMPLETED, FAILED -> 100;
        };
        return new StatusView(analysis.id(), analysis.status(), percent, analysis.failure());
    }

    @Override
    public Analysis getResult(String analysisId) {
        return repository.findWithMetrics(analysisId)
                .orElseThrow(() -> new NotFoundException("Analysis", analysisId));
    }

    @Override
    public List<Analysis> getByUser(String userId, int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must be non-negative");
        }
        return repository.findByUser(userId, offset, limit);
    }

    @Override
    public List<Analysis> getByStatus(AnalysisStatus status) {
        return repository.findByStatus(status);
    }

    /**
     * Future completed with the terminal analysis. Already-finished analyses
     * yield a completed future; the repository holds the terminal record
     * before a submission leaves the in-flight map.
     *
     * @throws NotFoundException for an unknown id
     */
    public CompletableFuture<Analysis> completion(String analysisId) {
        SubmissionProgress progress = inFlight.get(analysisId);
        if (progress != null) {
            return progress.completion;
        }
        return CompletableFuture.completedFuture(getResult(analysisId));
    }

    private static final class SubmissionProgress implements AnalysisOrchestrator.ProgressListener {

        private final CompletableFuture<Analysis> completion = new CompletableFuture<>();
        private volatile int completed;
        private volatile int total;

        @Override
        public void onProgress(int completed, int total) {
            this.total = total;
            this.completed = completed;
        }

        int percent() {
            int t = total;
            return t == 0 ? 0 : Math.min(100, completed * 100 / t);
        }
    }
}
