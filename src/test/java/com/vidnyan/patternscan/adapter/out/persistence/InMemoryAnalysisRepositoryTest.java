package com.vidnyan.patternscan.adapter.out.persistence;

import com.vidnyan.patternscan.domain.model.Analysis;
import com.vidnyan.patternscan.domain.model.AnalysisStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAnalysisRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryAnalysisRepository repository = new InMemoryAnalysisRepository();

    private Analysis pending(String id, String user, int secondsAfterT0) {
        return Analysis.pending(id, user, "python", id + ".py", T0.plusSeconds(secondsAfterT0));
    }

    @Test
    void findByUser_ShouldReturnNewestFirstAndPageWithoutRepeats() {
        for (int i = 0; i < 7; i++) {
            repository.save(pending("a" + i, "alice", i));
        }
        repository.save(pending("b0", "bob", 100));

        List<String> seen = new ArrayList<>();
        for (int offset = 0; offset < 7; offset += 3) {
            repository.findByUser("alice", offset, 3).forEach(a -> seen.add(a.id()));
        }

        assertEquals(List.of("a6", "a5", "a4", "a3", "a2", "a1", "a0"), seen);
        assertEquals(7, new HashSet<>(seen).size());
        assertTrue(repository.findByUser("alice", 10, 3).isEmpty());
    }

    @Test
    void findByUser_ShouldBreakTimestampTiesById() {
        repository.save(pending("z", "carol", 0));
        repository.save(pending("m", "carol", 0));

        assertEquals(List.of("m", "z"), repository.findByUser("carol", 0, 10).stream().map(Analysis::id).toList());
    }

    @Test
    void save_ShouldReplaceWholeRecord() {
        Analysis pending = pending("a1", "alice", 0);
        repository.save(pending);
        repository.save(pending.startProcessing(T0.plusSeconds(1)));

        assertEquals(AnalysisStatus.PROCESSING, repository.findWithMetrics("a1").orElseThrow().status());
        assertEquals(Set.of("a1"), Set.copyOf(repository.findByStatus(AnalysisStatus.PROCESSING)
                .stream().map(Analysis::id).toList()));
        assertTrue(repository.findByStatus(AnalysisStatus.PENDING).isEmpty());
    }

    @Test
    void findWithMetrics_ShouldBeEmptyForUnknownId() {
        assertTrue(repository.findWithMetrics("missing").isEmpty());
        assertTrue(repository.findWithMetrics(null).isEmpty());
    }
}
