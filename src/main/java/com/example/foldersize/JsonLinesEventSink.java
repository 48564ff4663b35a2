package com.example.foldersize;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends every size update as one JSON line to a file. Write failures are logged and the
 * update dropped; they never reach the computation that produced it.
 */
public final class JsonLinesEventSink implements SizeUpdateSink, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final ObjectMapper mapper;
    private final Path file;
    private final BufferedWriter writer;

    public JsonLinesEventSink(ObjectMapper mapper, Path file) throws IOException {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(
                file,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized void publish(SizeUpdate update) {
        try {
            writer.write(mapper.writeValueAsString(EventEnvelope.sizeUpdated(update)));
            writer.newLine();
            writer.flush();
        } catch (IOException ex) {
            LOGGER.warn("Failed to append size update for {} to {}", update.path(), file, ex);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
