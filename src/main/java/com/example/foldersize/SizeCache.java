package com.example.foldersize;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map from normalized path to its resolved {@link SizeRecord}. Entries are never
 * evicted; the last insert for a key wins.
 */
public final class SizeCache {
    private final ConcurrentHashMap<String, SizeRecord> records = new ConcurrentHashMap<>();

    public Optional<SizeRecord> get(String normalizedPath) {
        return Optional.ofNullable(records.get(normalizedPath));
    }

    public void insert(String normalizedPath, SizeRecord record) {
        records.put(normalizedPath, record);
    }

    public boolean contains(String normalizedPath) {
        return records.containsKey(normalizedPath);
    }

    public int size() {
        return records.size();
    }
}
