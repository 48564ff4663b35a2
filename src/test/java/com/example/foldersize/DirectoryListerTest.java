package com.example.foldersize;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryListerTest {
    @TempDir
    Path root;

    private ForkJoinPool pool;
    private SizeCache cache;
    private InProgressGuard guard;
    private RecordingSink sink;
    private QueuedExecutor executor;
    private DirectoryLister lister;

    @BeforeEach
    void setUp() {
        pool = new ForkJoinPool(2);
        cache = new SizeCache();
        guard = new InProgressGuard(cache);
        sink = new RecordingSink();
        executor = new QueuedExecutor();
        lister = new DirectoryLister(cache, guard, new RecursiveSizeComputer(cache, sink, pool), executor);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsShallowListingBeforeSizesAreKnown() throws Exception {
        Files.write(root.resolve("top.bin"), new byte[10]);
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.write(sub.resolve("a.bin"), new byte[20]);
        Files.write(sub.resolve("b.bin"), new byte[30]);
        String rootKey = PathNormalizer.normalize(root);

        FileNode listing = lister.list(root.toString());

        assertEquals(rootKey, listing.path());
        assertEquals(root.getFileName().toString(), listing.name());
        assertTrue(listing.directory());
        assertNull(listing.size());
        assertEquals(0L, listing.fileCount());
        assertEquals(10L, listing.baseSize());
        assertEquals(2, listing.children().size());

        FileNode subNode = listing.children().get(0);
        assertEquals("sub", subNode.name());
        assertTrue(subNode.directory());
        assertNull(subNode.size());
        assertEquals(0L, subNode.baseSize());
        assertEquals(0L, subNode.fileCount());
        assertNull(subNode.children());

        FileNode fileNode = listing.children().get(1);
        assertEquals(FileNode.file("top.bin", PathNormalizer.normalize(root.resolve("top.bin")), 10L), fileNode);

        assertTrue(guard.isInProgress(rootKey));
        assertTrue(sink.updates().isEmpty());
        assertEquals(1, executor.pending());
    }

    @Test
    void backgroundComputationFillsCacheAndReleasesGuard() throws Exception {
        Files.write(root.resolve("top.bin"), new byte[10]);
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.write(sub.resolve("a.bin"), new byte[20]);
        Files.write(sub.resolve("b.bin"), new byte[30]);
        String rootKey = PathNormalizer.normalize(root);

        lister.list(root.toString());
        executor.runAll();

        assertFalse(guard.isInProgress(rootKey));
        assertEquals(new SizeUpdate(rootKey, 60L, 3L), sink.updateFor(rootKey));
        assertTrue(sink.indexOf(PathNormalizer.normalize(sub)) < sink.indexOf(rootKey));

        FileNode again = lister.list(root.toString());
        assertEquals(60L, again.size());
        assertEquals(3L, again.fileCount());
        assertEquals(10L, again.baseSize());
        assertEquals(50L, again.children().get(0).size());
        assertEquals(2L, again.children().get(0).fileCount());
        assertEquals(0, executor.pending());
    }

    @Test
    void repeatedRequestsWhileRunningStartOneComputation() {
        lister.list(root.toString());
        lister.list(root.toString());
        lister.list(root.toString() + root.getFileSystem().getSeparator());

        assertEquals(1, executor.pending());
    }

    @Test
    void navigatingIntoResolvedSubtreeUsesCache() throws Exception {
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.write(sub.resolve("a.bin"), new byte[20]);
        lister.list(root.toString());
        executor.runAll();

        FileNode subListing = lister.list(sub.toString());

        assertEquals(20L, subListing.size());
        assertEquals(1L, subListing.fileCount());
        assertEquals(0, executor.pending());
    }

    @Test
    void sortsDirectoriesFirstThenBySizeThenByName() throws Exception {
        Path dirA = Files.createDirectory(root.resolve("dirA"));
        Path dirB = Files.createDirectory(root.resolve("dirB"));
        Files.write(root.resolve("fileZ"), new byte[300]);
        Files.write(root.resolve("fileC"), new byte[300]);
        Files.write(root.resolve("small"), new byte[1]);
        cache.insert(PathNormalizer.normalize(dirB), new SizeRecord(500L, 4L));

        FileNode listing = lister.list(root.toString());

        List<String> names = listing.children().stream().map(FileNode::name).collect(Collectors.toList());
        assertEquals(List.of("dirB", "dirA", "fileC", "fileZ", "small"), names);
        assertEquals(500L, listing.children().get(0).size());
        assertEquals(4L, listing.children().get(0).fileCount());
        assertEquals(dirA.getFileName().toString(), listing.children().get(1).name());
    }

    @Test
    void unreadableTargetYieldsEmptyListing() {
        Path missing = root.resolve("missing");

        FileNode listing = lister.list(missing.toString());

        assertTrue(listing.children().isEmpty());
        assertEquals(0L, listing.baseSize());
        executor.runAll();
        assertEquals(SizeUpdate.zero(PathNormalizer.normalize(missing)), sink.updateFor(PathNormalizer.normalize(missing)));
    }

    @Test
    void rejectedHandOffReleasesGuard() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("shut down");
        };
        DirectoryLister rejectingLister = new DirectoryLister(
                cache, guard, new RecursiveSizeComputer(cache, sink, pool), rejecting);

        FileNode listing = rejectingLister.list(root.toString());

        assertNull(listing.size());
        assertFalse(guard.isInProgress(PathNormalizer.normalize(root)));
        assertEquals(List.of(SizeUpdate.zero(PathNormalizer.normalize(root))), sink.updates());
    }

    @Test
    void errorInBackgroundComputationStillReportsRoot() {
        DirectoryScanner failing = new DirectoryScanner() {
            @Override
            public List<ScannedEntry> scan(String directory) {
                throw new InternalError("simulated failure");
            }
        };
        String rootKey = PathNormalizer.normalize(root);
        DirectoryLister failingLister = new DirectoryLister(
                cache, guard, new RecursiveSizeComputer(cache, sink, failing, pool), executor);

        failingLister.list(root.toString());

        assertThrows(InternalError.class, executor::runAll);
        assertEquals(SizeUpdate.zero(rootKey), sink.updateFor(rootKey));
        assertFalse(guard.isInProgress(rootKey));
    }

    private static final class QueuedExecutor implements Executor {
        private final Deque<Runnable> queue = new ArrayDeque<>();

        @Override
        public synchronized void execute(Runnable command) {
            queue.addLast(command);
        }

        synchronized int pending() {
            return queue.size();
        }

        void runAll() {
            Runnable next;
            while ((next = poll()) != null) {
                next.run();
            }
        }

        private synchronized Runnable poll() {
            return queue.pollFirst();
        }
    }
}
