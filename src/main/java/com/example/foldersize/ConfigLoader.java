package com.example.foldersize;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public AnalyzerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        int parallelism = raw.parallelism != null && raw.parallelism > 0
                ? raw.parallelism
                : defaultParallelism();
        Optional<Path> eventLogFile = Optional.ofNullable(raw.eventLogFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        boolean printEvents = raw.printEvents == null || raw.printEvents;

        return new AnalyzerConfig(parallelism, eventLogFile, printEvents);
    }

    static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static class RawConfig {
        public Integer parallelism;
        public String eventLogFile;
        public Boolean printEvents;
    }
}
