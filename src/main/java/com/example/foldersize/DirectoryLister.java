package com.example.foldersize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Answers listing requests with the direct entries of a directory, pre-filled from the
 * {@link SizeCache} where possible, and hands the recursive computation of an unresolved root
 * to a background executor. Listing never waits for that computation.
 */
public final class DirectoryLister {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryLister.class);

    private final SizeCache cache;
    private final InProgressGuard guard;
    private final RecursiveSizeComputer computer;
    private final Executor backgroundExecutor;
    private final DirectoryScanner scanner;

    public DirectoryLister(SizeCache cache,
                           InProgressGuard guard,
                           RecursiveSizeComputer computer,
                           Executor backgroundExecutor) {
        this(cache, guard, computer, backgroundExecutor, new DirectoryScanner());
    }

    DirectoryLister(SizeCache cache,
                    InProgressGuard guard,
                    RecursiveSizeComputer computer,
                    Executor backgroundExecutor,
                    DirectoryScanner scanner) {
        this.cache = cache;
        this.guard = guard;
        this.computer = computer;
        this.backgroundExecutor = backgroundExecutor;
        this.scanner = scanner;
    }

    public FileNode list(String path) {
        String rootPath = PathNormalizer.normalize(path);
        List<FileNode> children = new ArrayList<>();
        long baseSize = 0L;

        for (ScannedEntry entry : scanner.scan(rootPath)) {
            String entryPath = PathNormalizer.normalize(entry.path());
            if (!entry.directory()) {
                baseSize += entry.size();
                children.add(FileNode.file(entry.name(), entryPath, entry.size()));
                continue;
            }
            // Read-only lookup; subdirectories are resolved by the root's computation.
            Optional<SizeRecord> cached = cache.get(entryPath);
            children.add(new FileNode(
                    entry.name(),
                    entryPath,
                    cached.map(SizeRecord::totalSize).orElse(null),
                    0L,
                    true,
                    cached.map(SizeRecord::totalFileCount).orElse(0L),
                    null
            ));
        }
        children.sort(FileNode.LISTING_ORDER);

        if (guard.tryBegin(rootPath)) {
            submitComputation(rootPath);
        }

        Optional<SizeRecord> rootRecord = cache.get(rootPath);
        return new FileNode(
                nameOf(rootPath),
                rootPath,
                rootRecord.map(SizeRecord::totalSize).orElse(null),
                baseSize,
                true,
                rootRecord.map(SizeRecord::totalFileCount).orElse(0L),
                children
        );
    }

    private void submitComputation(String rootPath) {
        try {
            backgroundExecutor.execute(() -> computeInBackground(rootPath));
        } catch (RejectedExecutionException ex) {
            guard.end(rootPath);
            computer.reportFault(rootPath, ex);
        }
    }

    private void computeInBackground(String rootPath) {
        long started = System.nanoTime();
        LOGGER.debug("Started size computation for {}", rootPath);
        try {
            SizeRecord record = computer.compute(rootPath);
            LOGGER.info("Resolved {}: {} bytes in {} files ({} ms)",
                    rootPath,
                    record.totalSize(),
                    record.totalFileCount(),
                    (System.nanoTime() - started) / 1_000_000L);
        } catch (Error ex) {
            computer.reportFault(rootPath, ex);
            throw ex;
        } finally {
            guard.end(rootPath);
        }
    }

    private static String nameOf(String rootPath) {
        try {
            return DirectoryScanner.nameOf(Path.of(rootPath));
        } catch (InvalidPathException ex) {
            return rootPath;
        }
    }
}
