package com.example.foldersize;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * One entry of a listing response. {@code size} is null while the recursive size of a
 * directory is unknown; {@code children} is only set on the directory that was requested.
 */
public record FileNode(
        String name,
        String path,
        Long size,
        @JsonProperty("base_size") long baseSize,
        @JsonProperty("is_dir") boolean directory,
        @JsonProperty("file_count") long fileCount,
        List<FileNode> children
) {
    /**
     * Directories first, then size descending with unknown sizes as 0, then case-insensitive name.
     */
    public static final Comparator<FileNode> LISTING_ORDER = Comparator
            .comparing((FileNode node) -> !node.directory())
            .thenComparing(Comparator.comparingLong(FileNode::sizeOrZero).reversed())
            .thenComparing(node -> node.name().toLowerCase(Locale.ROOT));

    public static FileNode file(String name, String path, long length) {
        return new FileNode(name, path, length, length, false, 1L, null);
    }

    @JsonIgnore
    public long sizeOrZero() {
        return size == null ? 0L : size;
    }
}
