package com.vidnyan.patternscan;

import com.vidnyan.patternscan.application.port.in.AnalysisHistoryUseCase;
import com.vidnyan.patternscan.application.port.in.AnalyzeCodeUseCase.SubmissionRequest;
import com.vidnyan.patternscan.application.service.AnalysisApplicationService;
import com.vidnyan.patternscan.application.service.PluginRegistry;
import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Issue;
import com.vidnyan.patternscan.domain.model.MetricKeys;
import com.vidnyan.patternscan.domain.model.PluginExecution.ExecutionStatus;
import com.vidnyan.patternscan.domain.model.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PatternScanApplicationTests {

    @Autowired
    private AnalysisApplicationService analysisService;

    @Autowired
    private AnalysisHistoryUseCase history;

    @Autowired
    private PluginRegistry registry;

    @Test
    void contextLoads_ShouldRegisterBuiltInPlugins() {
        assertEquals(List.of("generic", "metrics", "python", "sql", "typescript"),
                List.copyOf(registry.list().keySet()));
    }

    @Test
    void submit_ShouldFlagEvalInTypeScript() throws Exception {
        long before = history.getUsageStats().totalAnalyses();

        String id = analysisService.submit(
                SubmissionRequest.ofText("eval(userInput)", "app.ts", "typescript", "it-user"));
        Analysis result = analysisService.completion(id).get(30, TimeUnit.SECONDS);

        assertEquals(AnalysisStatus.COMPLETED, result.status());
        assertEquals(1, result.issues().size());
        Issue issue = result.issues().get(0);
        assertEquals("eval_usage", issue.type());
        assertEquals(Severity.HIGH, issue.severity());
        assertEquals(Category.SECURITY, issue.category());
        assertEquals(1, issue.line());
        assertEquals(7.5, result.scores().security(), 1e-9);
        assertEquals(9.0, result.scores().global(), 1e-9);
        assertEquals(List.of("generic", "metrics", "typescript"),
                result.executions().stream().map(e -> e.pluginName()).toList());
        assertTrue(result.executions().stream().allMatch(e -> e.status() == ExecutionStatus.SUCCESS));
        assertEquals(before + 1, history.getUsageStats().totalAnalyses());
    }

    @Test
    void submit_ShouldSkipPluginsForBinaryContent() throws Exception {
        byte[] binary = {0x00, 0x01, 0x02, (byte) 0xff, 0x00};

        String id = analysisService.submit(new SubmissionRequest(binary, "blob.bin", "sql", "it-user", Map.of()));
        Analysis result = analysisService.completion(id).get(30, TimeUnit.SECONDS);

        assertEquals(AnalysisStatus.COMPLETED, result.status());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.executions().stream().allMatch(e -> e.status() == ExecutionStatus.SKIPPED));
    }

    @Test
    void submit_ShouldSumSecurityIssueCountsAcrossPatternPlugins() throws Exception {
        String source = "const apiKey = \"sk_live_abcdef1234567890\";\neval(userInput)\n";

        String id = analysisService.submit(SubmissionRequest.ofText(source, "keys.ts", "typescript", "it-user"));
        Analysis result = analysisService.completion(id).get(30, TimeUnit.SECONDS);

        assertEquals(List.of("hardcoded_secret", "eval_usage"), result.issues().stream().map(Issue::type).toList());
        assertEquals(2.0, result.metric(MetricKeys.issues(Category.SECURITY)));
        assertEquals(0.0, result.metric(MetricKeys.issues(Category.PERFORMANCE)));
    }
}
