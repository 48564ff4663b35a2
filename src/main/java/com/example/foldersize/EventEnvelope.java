package com.example.foldersize;

/**
 * Wrapper used to write listings and size updates into one JSON stream.
 */
public record EventEnvelope(
        String type,
        Object payload
) {
    public static final String LISTING = "listing";

    public static EventEnvelope sizeUpdated(SizeUpdate update) {
        return new EventEnvelope(SizeUpdate.EVENT_NAME, update);
    }

    public static EventEnvelope listing(FileNode node) {
        return new EventEnvelope(LISTING, node);
    }
}
