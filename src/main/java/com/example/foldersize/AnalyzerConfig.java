package com.example.foldersize;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for the analyzer.
 */
public record AnalyzerConfig(
        int parallelism,
        Optional<Path> eventLogFile,
        boolean printEvents
) {
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(ConfigLoader.defaultParallelism(), Optional.empty(), true);
    }
}
