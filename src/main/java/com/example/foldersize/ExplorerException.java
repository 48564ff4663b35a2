package com.example.foldersize;

/**
 * Raised when the OS file manager cannot be opened for a path.
 */
public class ExplorerException extends Exception {
    public ExplorerException(String message) {
        super(message);
    }

    public ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }
}
