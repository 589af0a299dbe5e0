package com.vidnyan.patternscan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.patternscan.adapter.out.plugin.CodeMetricsPlugin;
import com.vidnyan.patternscan.adapter.out.plugin.GenericPatternPlugin;
import com.vidnyan.patternscan.adapter.out.plugin.PythonAnalyzerPlugin;
import com.vidnyan.patternscan.adapter.out.plugin.SqlAnalyzerPlugin;
import com.vidnyan.patternscan.adapter.out.plugin.TypeScriptAnalyzerPlugin;
import com.vidnyan.patternscan.adapter.out.stats.JsonFileStatisticsStore;
import com.vidnyan.patternscan.application.port.out.AnalysisRepository;
import com.vidnyan.patternscan.application.port.out.PluginFactory;
import com.vidnyan.patternscan.application.port.out.StatisticsStore;
import com.vidnyan.patternscan.application.service.AnalysisOrchestrator;
import com.vidnyan.patternscan.application.service.PluginRegistry;
import com.vidnyan.patternscan.application.service.StatisticsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration for the analysis engine.
 * Builds the registry, executors and stores that the services share.
 */
@Slf4j
@Configuration
public class PatternScanConfiguration {

    /**
     * ObjectMapper for pattern catalogs and statistics snapshots.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Registry holding the built-in plugins. Filled before any submission
     * can be accepted.
     */
    @Bean
    public PluginRegistry pluginRegistry(EngineProperties properties) {
        Map<String, Class<?>> builtIns = new LinkedHashMap<>();
        builtIns.put(TypeScriptAnalyzerPlugin.NAME, TypeScriptAnalyzerPlugin.class);
        builtIns.put(PythonAnalyzerPlugin.NAME, PythonAnalyzerPlugin.class);
        builtIns.put(SqlAnalyzerPlugin.NAME, SqlAnalyzerPlugin.class);
        builtIns.put(GenericPatternPlugin.NAME, GenericPatternPlugin.class);
        builtIns.put(CodeMetricsPlugin.NAME, CodeMetricsPlugin.class);

        PluginRegistry registry = new PluginRegistry();
        builtIns.forEach((name, type) -> {
            if (properties.getDisabledPlugins().contains(name)) {
                log.info("Plugin '{}' disabled by configuration", name);
            } else {
                registry.register(name, type);
            }
        });

        log.info("Registered {} analyzer plugins:", registry.size());
        registry.list().forEach((name, type) -> log.info("  - {} ({})", name, type.getSimpleName()));
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public AnalysisOrchestrator analysisOrchestrator(PluginRegistry registry,
                                                     PluginFactory pluginFactory,
                                                     AnalysisRepository repository,
                                                     StatisticsService statistics,
                                                     Clock clock,
                                                     EngineProperties properties) {
        int wanted = properties.getSubmissionThreads() * registry.size();
        if (properties.getPluginThreads() < wanted) {
            log.warn("plugin-threads={} is below submission-threads x plugins ({}); queued plugins use up "
                    + "their submission's {} timeout", properties.getPluginThreads(), wanted,
                    properties.getSubmissionTimeout());
        }
        ExecutorService pluginExecutor = Executors.newFixedThreadPool(
                properties.getPluginThreads(), new CustomizableThreadFactory("plugin-"));
        return new AnalysisOrchestrator(registry, pluginFactory, repository, statistics,
                pluginExecutor, clock, properties.getSubmissionTimeout());
    }

    /**
     * Executor driving submissions; the only {@link ExecutorService} bean.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService submissionExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getSubmissionThreads(), new CustomizableThreadFactory("submission-"));
    }

    @Bean
    public StatisticsStore statisticsStore(EngineProperties properties, ObjectMapper objectMapper) {
        String statsFile = properties.getStatsFile();
        if (statsFile == null || statsFile.isBlank()) {
            log.info("Statistics kept in memory only");
            return StatisticsStore.inMemory();
        }
        log.info("Statistics persisted to {}", statsFile);
        return new JsonFileStatisticsStore(objectMapper, Path.of(statsFile));
    }
}
