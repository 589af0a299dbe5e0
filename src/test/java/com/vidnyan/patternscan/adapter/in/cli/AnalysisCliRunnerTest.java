package com.vidnyan.patternscan.adapter.in.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCliRunnerTest {

    @Test
    void inferLanguage_ShouldMapKnownExtensions() {
        assertEquals("typescript", AnalysisCliRunner.inferLanguage(Path.of("src/app.tsx")));
        assertEquals("javascript", AnalysisCliRunner.inferLanguage(Path.of("index.MJS")));
        assertEquals("python", AnalysisCliRunner.inferLanguage(Path.of("tool.py")));
        assertEquals("sql", AnalysisCliRunner.inferLanguage(Path.of("schema.sql")));
    }

    @Test
    void inferLanguage_ShouldFallBackToExtensionOrText() {
        assertEquals("go", AnalysisCliRunner.inferLanguage(Path.of("main.go")));
        assertEquals("text", AnalysisCliRunner.inferLanguage(Path.of("Makefile")));
    }
}
