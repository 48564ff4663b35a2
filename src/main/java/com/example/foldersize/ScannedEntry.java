package com.example.foldersize;

import java.nio.file.Path;

/**
 * One direct entry of a directory as read without following symlinks. {@code size} is the
 * reported entry length for non-directories and 0 for directories.
 */
public record ScannedEntry(
        Path path,
        String name,
        boolean directory,
        long size
) {
}
