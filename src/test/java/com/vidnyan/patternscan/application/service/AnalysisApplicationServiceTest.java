package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.adapter.out.persistence.InMemoryAnalysisRepository;
import com.vidnyan.patternscan.application.port.in.AnalyzeCodeUseCase.StatusView;
import com.vidnyan.patternscan.application.port.in.AnalyzeCodeUseCase.SubmissionRequest;
import com.vidnyan.patternscan.application.port.out.StatisticsStore;
import com.vidnyan.patternscan.domain.error.NotFoundException;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.FailureKind;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.plugin.MetricMerge;
import com.vidnyan.patternscan.domain.plugin.PluginResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.vidnyan.patternscan.application.service.StubPlugin.issue;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisApplicationServiceTest {

    private final Clock clock = Clock.systemUTC();
    private InMemoryAnalysisRepository repository;
    private StatisticsService statistics;
    private AnalysisOrchestrator orchestrator;
    private ExecutorService submissionExecutor;
    private AnalysisApplicationService service;

    @BeforeEach
    void setUp() {
        StubPlugin echo = new StubPlugin(Set.of("*"), source -> {
            // one issue per line that mentions "danger"
            List<Issue> issues = new ArrayList<>();
            String[] lines = source.text().split("\n");
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].contains("danger")) {
                    issues.add(Issue.builder()
                            .type("danger")
                            .severity(Severity.HIGH)
                            .category(Category.SECURITY)
                            .message(lines[i])
                            .file(source.filename())
                            .line(i + 1)
                            .build());
                }
            }
            return new PluginResult(issues, Map.of());
        }, MetricMerge.MAX);

        PluginRegistry registry = new PluginRegistry();
        registry.register("echo", StubPlugin.class);
        repository = new InMemoryAnalysisRepository();
        statistics = new StatisticsService(StatisticsStore.inMemory(), clock);
        orchestrator = new AnalysisOrchestrator(registry, (name, type) -> echo, repository, statistics,
                Executors.newFixedThreadPool(4), clock, Duration.ofSeconds(10));
        submissionExecutor = Executors.newFixedThreadPool(4);
        service = new AnalysisApplicationService(orchestrator, repository, submissionExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        submissionExecutor.shutdownNow();
        orchestrator.shutdown();
    }

    private Analysis await(String id) throws Exception {
        return service.completion(id).get(10, TimeUnit.SECONDS);
    }

    @Test
    void submit_ShouldRunAnalysisToCompletion() throws Exception {
        String id = service.submit(SubmissionRequest.ofText("ok\ndanger()\n", "app.ts", "TypeScript", "alice"));

        Analysis result = await(id);

        assertEquals(AnalysisStatus.COMPLETED, result.status());
        assertEquals("typescript", result.language());
        assertEquals(1, result.issues().size());
        assertEquals(2, result.issues().get(0).line());
        assertEquals(result, service.getResult(id));
        assertEquals(List.of(), service.getByStatus(AnalysisStatus.PENDING));
        assertEquals(List.of(result), service.getByStatus(AnalysisStatus.COMPLETED));
    }

    @Test
    void submit_ShouldApplyDefaultsForMissingFilenameAndUser() throws Exception {
        String id = service.submit(SubmissionRequest.ofText("x", null, "sql", " "));

        Analysis result = await(id);

        assertEquals("unknown", result.filename());
        assertEquals("anonymous", result.userId());
    }

    @Test
    void submit_ShouldRejectInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(null));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(new SubmissionRequest(null, "a.ts", "typescript", "u", Map.of())));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(SubmissionRequest.ofText("x", "a.ts", "  ", "u")));
        assertTrue(repository.findByStatus(AnalysisStatus.PENDING).isEmpty());
    }

    @Test
    void submit_ShouldKeepConcurrentUsersApart() throws Exception {
        List<String> aliceIds = new ArrayList<>();
        List<String> bobIds = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            aliceIds.add(service.submit(SubmissionRequest.ofText("danger\n", "alice" + i + ".ts", "typescript", "alice")));
            bobIds.add(service.submit(SubmissionRequest.ofText("clean\n", "bob" + i + ".ts", "typescript", "bob")));
        }
        for (String id : aliceIds) {
            assertEquals(1, await(id).issues().size());
        }
        for (String id : bobIds) {
            assertTrue(await(id).issues().isEmpty());
        }

        List<Analysis> alice = service.getByUser("alice", 0, 100);
        List<Analysis> bob = service.getByUser("bob", 0, 100);
        assertEquals(10, alice.size());
        assertEquals(10, bob.size());
        assertTrue(alice.stream().allMatch(a -> a.filename().startsWith("alice") && a.issues().size() == 1));
        assertTrue(bob.stream().allMatch(a -> a.filename().startsWith("bob") && a.issues().isEmpty()));
        assertEquals(20, statistics.getUsageStats().totalAnalyses());
        assertEquals(20, statistics.getHistory().size());
    }

    @Test
    void getStatus_ShouldReportFullProgressWhenTerminal() throws Exception {
        String id = service.submit(SubmissionRequest.ofText("x", "a.py", "python", "u"));
        await(id);

        StatusView status = service.getStatus(id);

        assertEquals(id, status.analysisId());
        assertEquals(AnalysisStatus.COMPLETED, status.status());
        assertEquals(100, status.progress());
        assertNull(status.failure());
    }

    @Test
    void getResult_ShouldThrowForUnknownId() {
        assertThrows(NotFoundException.class, () -> service.getResult("missing"));
        assertThrows(NotFoundException.class, () -> service.getStatus("missing"));
        assertThrows(NotFoundException.class, () -> service.completion("missing"));
    }

    @Test
    void getByUser_ShouldRejectNegativePaging() {
        assertThrows(IllegalArgumentException.class, () -> service.getByUser("u", -1, 10));
        assertThrows(IllegalArgumentException.class, () -> service.getByUser("u", 0, -1));
        assertTrue(service.getByUser("nobody", 0, 10).isEmpty());
    }

    @Test
    void submit_ShouldFailSubmissionRejectedByExecutor() throws Exception {
        submissionExecutor.shutdown();

        String id = service.submit(SubmissionRequest.ofText("danger", "a.ts", "typescript", "u"));

        Analysis result = await(id);
        assertEquals(AnalysisStatus.FAILED, result.status());
        assertEquals(FailureKind.CANCELLED, result.failure().kind());
        assertEquals(1, statistics.getUsageStats().errorCount());
    }

    @Test
    void submit_ShouldIgnoreNullConfigValues() throws Exception {
        Map<String, Object> config = new HashMap<>();
        config.put("minSeverity", null);
        config.put("disabledRules", List.of("other"));

        String id = service.submit(new SubmissionRequest(
                "danger\n".getBytes(StandardCharsets.UTF_8), "a.ts", "typescript", "u", config));

        Analysis result = await(id);
        assertEquals(AnalysisStatus.COMPLETED, result.status());
        assertEquals(1, result.issues().size());
        assertTrue(service.getByStatus(AnalysisStatus.PENDING).isEmpty());
        assertTrue(service.getByStatus(AnalysisStatus.PROCESSING).isEmpty());
    }
}
