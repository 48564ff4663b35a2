package com.example.foldersize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Opens a path in the platform file manager. Directories are opened directly; for files the
 * containing folder is shown, with the file selected where the platform supports it.
 */
public final class ExplorerLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExplorerLauncher.class);

    private final String osName;
    private final ProcessStarter starter;

    public ExplorerLauncher() {
        this(System.getProperty("os.name", ""), command -> new ProcessBuilder(command).start());
    }

    ExplorerLauncher(String osName, ProcessStarter starter) {
        this.osName = osName;
        this.starter = starter;
    }

    public void open(String path) throws ExplorerException {
        Path target;
        try {
            target = Path.of(path);
        } catch (InvalidPathException ex) {
            throw new ExplorerException(ex.getMessage(), ex);
        }
        List<String> command = commandFor(target, Files.isDirectory(target));
        try {
            starter.start(command);
        } catch (IOException ex) {
            LOGGER.warn("Failed to launch {}", command, ex);
            throw new ExplorerException(ex.getMessage(), ex);
        }
    }

    List<String> commandFor(Path target, boolean directory) throws ExplorerException {
        String os = osName.toLowerCase(Locale.ROOT);
        String path = target.toString();
        if (os.startsWith("windows")) {
            return directory ? List.of("explorer", path) : List.of("explorer", "/select,", path);
        }
        if (os.startsWith("mac")) {
            return directory ? List.of("open", path) : List.of("open", "-R", path);
        }
        if (os.contains("linux") || os.contains("bsd")) {
            Path parent = target.getParent();
            String folder = directory || parent == null ? path : parent.toString();
            return List.of("xdg-open", folder);
        }
        throw new ExplorerException("Not supported on this OS");
    }

    @FunctionalInterface
    interface ProcessStarter {
        void start(List<String> command) throws IOException;
    }
}
