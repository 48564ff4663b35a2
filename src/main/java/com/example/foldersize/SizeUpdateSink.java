package com.example.foldersize;

import java.util.List;

/**
 * Push channel towards the front end. Implementations are called concurrently from worker
 * threads and must be thread-safe.
 */
@FunctionalInterface
public interface SizeUpdateSink {
    void publish(SizeUpdate update);

    static SizeUpdateSink noop() {
        return update -> {
        };
    }

    static SizeUpdateSink fanOut(List<SizeUpdateSink> sinks) {
        List<SizeUpdateSink> targets = List.copyOf(sinks);
        return update -> {
            for (SizeUpdateSink sink : targets) {
                sink.publish(update);
            }
        };
    }
}
