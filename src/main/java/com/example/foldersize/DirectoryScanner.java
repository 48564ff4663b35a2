package com.example.foldersize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort one-level directory read. Unreadable directories produce whatever entries were
 * read before the failure (usually none); entries whose attributes cannot be read are skipped.
 * <p>
 * A {@link DirectoryIteratorException} ends the read of that directory: the stream cannot be
 * advanced past it, so entries after the failing one are not counted.
 */
public class DirectoryScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryScanner.class);

    public List<ScannedEntry> scan(String directory) {
        Path dir;
        try {
            dir = Path.of(directory);
        } catch (InvalidPathException ex) {
            LOGGER.warn("Cannot scan invalid path {}", directory, ex);
            return List.of();
        }
        return scan(dir);
    }

    public List<ScannedEntry> scan(Path directory) {
        List<ScannedEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException ex) {
                    LOGGER.debug("Skipping {} because its attributes are unreadable", entry, ex);
                    continue;
                }
                boolean isDirectory = attrs.isDirectory();
                entries.add(new ScannedEntry(
                        entry,
                        nameOf(entry),
                        isDirectory,
                        isDirectory ? 0L : attrs.size()
                ));
            }
        } catch (IOException | DirectoryIteratorException ex) {
            LOGGER.warn("Failed to list directory {}", directory, ex);
        }
        return entries;
    }

    static String nameOf(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }
}
