package com.example.foldersize;

/**
 * Recursive aggregate of a directory: bytes and regular files across all descendants.
 */
public record SizeRecord(
        long totalSize,
        long totalFileCount
) {
    public static final SizeRecord ZERO = new SizeRecord(0L, 0L);

    public SizeRecord plus(SizeRecord other) {
        return new SizeRecord(totalSize + other.totalSize, totalFileCount + other.totalFileCount);
    }
}
