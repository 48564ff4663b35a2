package com.example.foldersize;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Produces the textual cache key for a path by splitting it into components and joining them
 * again in platform form. Purely syntactic: the filesystem is never consulted, symlinks are not
 * resolved, and {@code .}/{@code ..} segments as well as letter case are kept as written.
 */
public final class PathNormalizer {

    private PathNormalizer() {
    }

    public static String normalize(String raw) {
        Path parsed;
        try {
            parsed = Path.of(raw);
        } catch (InvalidPathException ex) {
            // Not representable on this platform; the raw text is the only stable key we have.
            return raw;
        }
        Path rebuilt = parsed.getRoot();
        for (Path component : parsed) {
            rebuilt = rebuilt == null ? component : rebuilt.resolve(component);
        }
        return rebuilt == null ? "" : rebuilt.toString();
    }

    public static String normalize(Path path) {
        return normalize(path.toString());
    }
}
