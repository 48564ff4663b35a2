package com.example.foldersize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints envelopes as JSON lines, the console host's stand-in for the front-end event channel.
 */
public final class ConsoleEventSink implements SizeUpdateSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleEventSink.class);

    private final ObjectMapper mapper;
    private final PrintStream out;

    public ConsoleEventSink(ObjectMapper mapper, PrintStream out) {
        this.mapper = mapper;
        this.out = out;
    }

    @Override
    public void publish(SizeUpdate update) {
        print(EventEnvelope.sizeUpdated(update));
    }

    public void print(EventEnvelope envelope) {
        String line;
        try {
            line = mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to serialize {} envelope", envelope.type(), ex);
            return;
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
