package com.vidnyan.patternscan.domain.plugin;

import com.vidnyan.patternscan.domain.error.ErrorKind;
import com.vidnyan.patternscan.domain.error.UnsupportedInputException;
import com.vidnyan.patternscan.domain.model.Category;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceArtifactTest {

    @Test
    void of_ShouldDecodeUtf8() {
        SourceArtifact source = SourceArtifact.of("a.py", "print('héllo')".getBytes(StandardCharsets.UTF_8));

        assertTrue(source.isText());
        assertEquals("print('héllo')", source.text());
        assertEquals(15, source.sizeBytes());
    }

    @Test
    void text_ShouldRejectInvalidUtf8() {
        SourceArtifact source = SourceArtifact.of("a.py", new byte[]{'a', (byte) 0xC3, (byte) 0x28});

        assertFalse(source.isText());
        UnsupportedInputException e = assertThrows(UnsupportedInputException.class, source::text);
        assertEquals(ErrorKind.UNSUPPORTED_INPUT, e.kind());
    }

    @Test
    void text_ShouldRejectBinaryContent() {
        SourceArtifact source = SourceArtifact.of("img.png", new byte[]{(byte) 0x89, 'P', 'N', 'G', 0, 0});

        assertThrows(UnsupportedInputException.class, source::text);
    }

    @Test
    void of_ShouldAcceptEmptyContent() {
        SourceArtifact source = SourceArtifact.of("empty.ts", new byte[0]);

        assertEquals("", source.text());
        assertEquals(0, source.sizeBytes());
    }

    @Test
    void supports_ShouldNormalizeLanguageAndHonourWildcard() {
        AnalyzerPlugin typed = new StubPlugin(Set.of("python"));
        AnalyzerPlugin any = new StubPlugin(Set.of(AnalyzerPlugin.ANY_LANGUAGE));

        assertTrue(typed.supports(" Python "));
        assertFalse(typed.supports("sql"));
        assertTrue(any.supports("cobol"));
        assertTrue(any.isLanguageAgnostic());
        assertEquals(MetricMerge.MAX, typed.metricMerge("complexity"));
    }

    private record StubPlugin(Set<String> supportedLanguages) implements AnalyzerPlugin {

        @Override
        public Set<Category> supportedCategories() {
            return Set.of();
        }

        @Override
        public PluginResult analyze(SourceArtifact source, String language, AnalysisConfig config) {
            return PluginResult.empty();
        }
    }
}
