package com.example.foldersize;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Console host: prints the listing of one directory, then streams size updates until the
 * directory itself is resolved.
 */
public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: [--config <config.json>] <directory>
        if (args.length != 1 && !(args.length == 3 && "--config".equals(args[0]))) {
            LOGGER.error("Usage: java -jar folder-size-analyzer.jar [--config <config.json>] <directory>");
            System.exit(1);
            return;
        }
        AnalyzerConfig config;
        try {
            config = args.length == 3
                    ? new ConfigLoader().load(Path.of(args[1]))
                    : AnalyzerConfig.defaults();
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.error("Failed to load configuration", ex);
            System.exit(1);
            return;
        }
        run(config, args[args.length - 1]);
    }

    static void run(AnalyzerConfig config, String directory) throws IOException, InterruptedException {
        ObjectMapper mapper = new ObjectMapper();
        String rootPath = PathNormalizer.normalize(directory);
        CountDownLatch rootResolved = new CountDownLatch(1);
        ConsoleEventSink console = new ConsoleEventSink(mapper, System.out);

        List<SizeUpdateSink> sinks = new ArrayList<>();
        if (config.printEvents()) {
            sinks.add(console);
        }
        JsonLinesEventSink eventLog = null;
        if (config.eventLogFile().isPresent()) {
            eventLog = new JsonLinesEventSink(mapper, config.eventLogFile().get());
            sinks.add(eventLog);
        }
        sinks.add(update -> {
            if (update.path().equals(rootPath)) {
                rootResolved.countDown();
            }
        });

        LOGGER.info("Analyzing {} with parallelism {}", rootPath, config.parallelism());
        try (AnalyzerContext context = new AnalyzerContext(config, SizeUpdateSink.fanOut(sinks))) {
            FolderSizeCommands commands = new FolderSizeCommands(context);
            console.print(EventEnvelope.listing(commands.analyzeDirectory(rootPath)));
            rootResolved.await();
        } finally {
            if (eventLog != null) {
                eventLog.close();
            }
        }
    }
}
