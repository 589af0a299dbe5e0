package com.vidnyan.patternscan.adapter.out.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.patternscan.application.port.out.StatisticsStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the statistics snapshot in a JSON file. Each save writes a sibling
 * temp file and moves it over the target, so a crash leaves either the old
 * or the new snapshot.
 */
@Slf4j
public class JsonFileStatisticsStore implements StatisticsStore {
    
    private final ObjectMapper objectMapper;
    private final Path file;
    
    public JsonFileStatisticsStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file.toAbsolutePath();
    }
    
    @Override
    public Optional<Snapshot> load() throws IOException {
        if (!Files.isRegularFile(file)) {
            log.info("No statistics snapshot at {}", file);
            return Optional.empty();
        }
        Snapshot snapshot = objectMapper.readValue(file.toFile(), Snapshot.class);
        log.info("Loaded statistics snapshot from {}", file);
        return Optional.of(snapshot);
    }
    
    @Override
    public void save(Snapshot snapshot) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), snapshot);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved statistics snapshot to {}", file);
    }
    
    public Path file() {
        return file;
    }
}
