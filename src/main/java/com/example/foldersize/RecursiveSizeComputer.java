package com.example.foldersize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Walks a directory tree on a fork-join pool and resolves the recursive size of every
 * directory in it. Each resolved directory is written to the {@link SizeCache} and announced
 * through the {@link SizeUpdateSink}; a parent is only announced after all of its children.
 */
public final class RecursiveSizeComputer {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecursiveSizeComputer.class);

    private final SizeCache cache;
    private final SizeUpdateSink sink;
    private final DirectoryScanner scanner;
    private final ForkJoinPool pool;

    public RecursiveSizeComputer(SizeCache cache, SizeUpdateSink sink, ForkJoinPool pool) {
        this(cache, sink, new DirectoryScanner(), pool);
    }

    RecursiveSizeComputer(SizeCache cache, SizeUpdateSink sink, DirectoryScanner scanner, ForkJoinPool pool) {
        this.cache = cache;
        this.sink = sink;
        this.scanner = scanner;
        this.pool = pool;
    }

    /**
     * Returns the recursive size of the directory, computing and caching every unresolved
     * subtree on the way. Never throws; faults are reported as a zero contribution.
     */
    public SizeRecord compute(String path) {
        String normalized = PathNormalizer.normalize(path);
        DirectorySizeTask task = new DirectorySizeTask(normalized);
        try {
            if (ForkJoinTask.getPool() == pool) {
                return task.invoke();
            }
            return pool.invoke(task);
        } catch (RuntimeException | StackOverflowError ex) {
            return reportFault(normalized, ex);
        }
    }

    /**
     * Logs the fault and publishes a zero update for {@code path} so observers waiting on it
     * are released.
     */
    SizeRecord reportFault(String path, Throwable ex) {
        LOGGER.warn("Size computation failed for {}; counting it as empty", path, ex);
        publish(SizeUpdate.zero(path));
        return SizeRecord.ZERO;
    }

    private void publish(SizeUpdate update) {
        try {
            sink.publish(update);
        } catch (RuntimeException ex) {
            LOGGER.warn("Size update sink rejected update for {}", update.path(), ex);
        }
    }

    private final class DirectorySizeTask extends RecursiveTask<SizeRecord> {
        private final String path;

        DirectorySizeTask(String path) {
            this.path = path;
        }

        @Override
        protected SizeRecord compute() {
            try {
                return aggregate();
            } catch (RuntimeException | StackOverflowError ex) {
                // Very deep trees can exhaust the worker stack; the branch then counts as empty.
                return reportFault(path, ex);
            }
        }

        private SizeRecord aggregate() {
            Optional<SizeRecord> cached = cache.get(path);
            if (cached.isPresent()) {
                LOGGER.debug("Using cached size for {}", path);
                return cached.get();
            }

            // Files are summed here, folders become subtasks.
            long fileBytes = 0L;
            long fileCount = 0L;
            List<DirectorySizeTask> subdirectoryTasks = new ArrayList<>();
            for (ScannedEntry entry : scanner.scan(path)) {
                if (entry.directory()) {
                    subdirectoryTasks.add(new DirectorySizeTask(PathNormalizer.normalize(entry.path())));
                } else {
                    fileBytes += entry.size();
                    fileCount++;
                }
            }

            SizeRecord total = new SizeRecord(fileBytes, fileCount);
            for (DirectorySizeTask subtask : ForkJoinTask.invokeAll(subdirectoryTasks)) {
                total = total.plus(subtask.join());
            }

            cache.insert(path, total);
            publish(SizeUpdate.of(path, total));
            return total;
        }
    }
}
