package com.vidnyan.patternscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PatternScan - pluggable pattern-based code analysis engine.
 * 
 * Scans submitted sources with per-language rule catalogs, scores the
 * result and keeps a usage history.
 */
@SpringBootApplication
public class PatternScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternScanApplication.class, args);
    }
}
