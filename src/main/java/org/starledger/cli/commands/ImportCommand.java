package org.starledger.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.starledger.cli.CommandLineInterface;
import org.starledger.parser.io.SaveFileScanner;
import org.starledger.parser.io.SaveFileScanner.SaveFile;
import org.starledger.timeline.api.ExtractionSettings;
import org.starledger.timeline.importer.SnapshotImportService;
import org.starledger.timeline.pipeline.ImportResult;
import org.starledger.timeline.pipeline.TimelineExtractor;
import org.starledger.timeline.processors.ProcessorRegistry;
import org.starledger.timeline.store.h2.H2TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * One-shot import of every new save file below the save directory.
 * <p>
 * Each directory containing {@code .sav} files is one series. Snapshots already stored, or older than the
 * newest stored one, are reported and skipped. Ctrl-C stops after the snapshot being imported.
 */
@Command(
    name = "import",
    mixinStandardHelpOptions = true,
    description = "Import save files into the timeline database"
)
public class ImportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    @Option(
        names = {"--save-dir"},
        description = "Directory containing the save game folders (default: starledger.import.save-directory)"
    )
    private Path saveDirectory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig().getConfig("starledger");
            Path root = saveDirectory != null ? saveDirectory : Path.of(config.getString("import.save-directory"));
            if (!Files.isDirectory(root)) {
                err.println("Error: save directory does not exist: " + root.toAbsolutePath());
                return 1;
            }

            List<SaveFile> files = new SaveFileScanner(config.getConfig("import")).scan(root);
            out.println("Found " + files.size() + " save file(s) in " + root.toAbsolutePath());
            if (files.isEmpty()) {
                return 0;
            }

            try (H2TimelineStore store = new H2TimelineStore(config.getConfig("database"))) {
                TimelineExtractor extractor = new TimelineExtractor(store, ProcessorRegistry.fromConfig(config),
                        ExtractionSettings.fromConfig(config), config.getString("observer.multiplayer-username"));
                SnapshotImportService service = new SnapshotImportService(extractor,
                        config.getInt("import.threads"),
                        config.getInt("parser.max-nesting-depth"),
                        config.getBoolean("import.debug-mode"));

                Thread hook = new Thread(service::cancel, "import-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                SnapshotImportService.Summary summary;
                try {
                    summary = service.importFiles(files);
                } finally {
                    removeHook(hook);
                }
                printSummary(out, summary);
                if (summary.aborted()) {
                    err.println("Import aborted after a failed snapshot (debug mode)");
                    return 1;
                }
                return 0;
            }
        } catch (Exception e) {
            log.error("Import failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down
            log.debug("Shutdown in progress, hook stays registered");
        }
    }

    private static void printSummary(PrintWriter out, SnapshotImportService.Summary summary) {
        out.println();
        out.println("=== Import Summary ===");
        for (ImportResult.Status status : ImportResult.Status.values()) {
            out.printf("  %-16s %d%n", status.name().toLowerCase(Locale.ROOT), summary.count(status));
        }
        if (summary.cancelled()) {
            out.println("  (cancelled)");
        }
    }
}
