package com.example.foldersize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the process-wide state: the size cache, the in-progress guard, the fork-join worker
 * pool for the recursive walk and the executor that runs one background job per root.
 * Created once at startup and handed to the request handlers.
 */
public final class AnalyzerContext implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzerContext.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30L;

    private final SizeCache sizeCache = new SizeCache();
    private final InProgressGuard inProgressGuard = new InProgressGuard(sizeCache);
    private final ForkJoinPool workerPool;
    private final ExecutorService backgroundExecutor;
    private final RecursiveSizeComputer computer;
    private final DirectoryLister lister;

    public AnalyzerContext(AnalyzerConfig config, SizeUpdateSink sink) {
        this.workerPool = new ForkJoinPool(config.parallelism());
        this.backgroundExecutor = Executors.newCachedThreadPool(daemonThreads("size-computation-"));
        this.computer = new RecursiveSizeComputer(sizeCache, sink, workerPool);
        this.lister = new DirectoryLister(sizeCache, inProgressGuard, computer, backgroundExecutor);
    }

    public SizeCache sizeCache() {
        return sizeCache;
    }

    public InProgressGuard inProgressGuard() {
        return inProgressGuard;
    }

    public RecursiveSizeComputer computer() {
        return computer;
    }

    public DirectoryLister lister() {
        return lister;
    }

    /**
     * Stops accepting background work and waits for running computations to drain.
     */
    @Override
    public void close() {
        backgroundExecutor.shutdown();
        workerPool.shutdown();
        try {
            if (!backgroundExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Background size computations still running after {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
            workerPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for size computations to stop.", ex);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
