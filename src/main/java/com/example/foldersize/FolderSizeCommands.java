package com.example.foldersize;

/**
 * The operations exposed to the hosting application's command dispatch.
 */
public final class FolderSizeCommands {
    private final DirectoryLister lister;
    private final ExplorerLauncher explorerLauncher;

    public FolderSizeCommands(AnalyzerContext context) {
        this(context.lister(), new ExplorerLauncher());
    }

    FolderSizeCommands(DirectoryLister lister, ExplorerLauncher explorerLauncher) {
        this.lister = lister;
        this.explorerLauncher = explorerLauncher;
    }

    /**
     * Returns the shallow listing of {@code path} immediately; recursive sizes arrive later as
     * {@value SizeUpdate#EVENT_NAME} events.
     */
    public FileNode analyzeDirectory(String path) {
        return lister.list(path);
    }

    public void openInExplorer(String path) throws ExplorerException {
        explorerLauncher.open(path);
    }
}
