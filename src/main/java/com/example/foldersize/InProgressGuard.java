package com.example.foldersize;

import java.util.HashSet;
import java.util.Set;

/**
 * Tracks root paths whose background size computation has started but not finished, so the
 * same subtree is never walked twice at once.
 */
public final class InProgressGuard {
    private final SizeCache cache;
    private final Set<String> inProgress = new HashSet<>();

    public InProgressGuard(SizeCache cache) {
        this.cache = cache;
    }

    /**
     * Marks the path as in progress unless it is already cached or already running.
     *
     * @return true if the caller now owns the computation and must call {@link #end(String)}
     */
    public synchronized boolean tryBegin(String normalizedPath) {
        if (cache.contains(normalizedPath)) {
            return false;
        }
        return inProgress.add(normalizedPath);
    }

    public synchronized void end(String normalizedPath) {
        inProgress.remove(normalizedPath);
    }

    public synchronized boolean isInProgress(String normalizedPath) {
        return inProgress.contains(normalizedPath);
    }
}
