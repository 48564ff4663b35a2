package com.example.foldersize;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the {@value #EVENT_NAME} event, pushed once per directory whose recursive
 * aggregate has just been resolved.
 */
public record SizeUpdate(
        String path,
        long size,
        @JsonProperty("file_count") long fileCount
) {
    public static final String EVENT_NAME = "folder-size-updated";

    public static SizeUpdate of(String path, SizeRecord record) {
        return new SizeUpdate(path, record.totalSize(), record.totalFileCount());
    }

    public static SizeUpdate zero(String path) {
        return of(path, SizeRecord.ZERO);
    }
}
