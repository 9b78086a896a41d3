package org.starledger.timeline.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.frontend.parser.FormatException;
import org.starledger.parser.frontend.parser.SnapshotParser;
import org.starledger.parser.io.SaveFileScanner.SaveFile;
import org.starledger.parser.io.SnapshotLoader;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.pipeline.ImportResult;
import org.starledger.timeline.pipeline.TimelineExtractor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Imports a list of save files: parsing runs on a worker pool, extraction runs on the calling thread in
 * file order.
 * <p>
 * Parsed snapshots that complete early wait in a {@link SnapshotReorderBuffer} until all earlier files have
 * been imported. At most twice the worker count of parsed snapshots are held in memory. A failed snapshot is
 * logged and skipped; in debug mode it aborts the import. {@link #cancel()} stops the import before the
 * next snapshot is started; a snapshot that is being extracted is always finished.
 */
public class SnapshotImportService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotImportService.class);

    /**
     * Outcome of an import run.
     *
     * @param results   The results of the imported snapshots, in file order.
     * @param aborted   Whether a failure stopped the import in debug mode.
     * @param cancelled Whether the import was cancelled.
     */
    public record Summary(List<ImportResult> results, boolean aborted, boolean cancelled) {

        public Summary {
            results = List.copyOf(results);
        }

        public long count(ImportResult.Status status) {
            return results.stream().filter(r -> r.status() == status).count();
        }

        public boolean hasFailures() {
            return count(ImportResult.Status.FAILED) > 0;
        }
    }

    private final TimelineExtractor extractor;
    private final int threads;
    private final int maxNestingDepth;
    private final boolean debugMode;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicInteger imported = new AtomicInteger();

    public SnapshotImportService(TimelineExtractor extractor, int threads, int maxNestingDepth, boolean debugMode) {
        if (threads < 1) {
            throw new IllegalArgumentException("import.threads must be at least 1, got " + threads);
        }
        this.extractor = extractor;
        this.threads = threads;
        this.maxNestingDepth = maxNestingDepth;
        this.debugMode = debugMode;
    }

    /**
     * Requests the running import to stop before its next snapshot.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    /**
     * @return The number of snapshots extracted so far, across runs.
     */
    public int importedCount() {
        return imported.get();
    }

    /**
     * Imports the files in list order.
     *
     * @param files The save files, usually ordered by path so that each series is in date order.
     * @return The summary.
     */
    public Summary importFiles(List<SaveFile> files) {
        cancelRequested.set(false);
        List<ImportResult> results = Collections.synchronizedList(new ArrayList<>());
        if (files.isEmpty()) {
            return new Summary(results, false, false);
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "snapshot-parser");
            thread.setDaemon(true);
            return thread;
        });
        CompletionService<ParsedSnapshot> completion = new ExecutorCompletionService<>(executor);
        SnapshotReorderBuffer<ParsedSnapshot> buffer = new SnapshotReorderBuffer<>();
        int maxInFlight = threads * 2;
        int submitted = 0;
        int inFlight = 0;
        boolean aborted = false;
        try {
            while (!cancelRequested.get() && !aborted && (submitted < files.size() || inFlight > 0)) {
                while (submitted < files.size() && inFlight + buffer.pendingCount() < maxInFlight) {
                    int sequence = submitted;
                    SaveFile file = files.get(sequence);
                    completion.submit(() -> parse(sequence, file));
                    submitted++;
                    inFlight++;
                }
                ParsedSnapshot parsed = completion.take().get();
                inFlight--;
                for (ParsedSnapshot ready : buffer.offer(parsed.sequence(), parsed)) {
                    if (cancelRequested.get()) {
                        break;
                    }
                    ImportResult result = importParsed(ready);
                    results.add(result);
                    if (result.status() == ImportResult.Status.FAILED && debugMode) {
                        log.error("Aborting import after failure of {} (debug mode)", ready.file().file());
                        aborted = true;
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested.set(true);
        } catch (ExecutionException e) {
            // parse() reports failures in its result, so this is a bug
            throw new IllegalStateException("Snapshot parser task failed", e.getCause());
        } finally {
            executor.shutdownNow();
            awaitTermination(executor);
        }
        boolean cancelled = cancelRequested.get();
        if (cancelled) {
            log.info("Import cancelled after {} of {} snapshots", results.size(), files.size());
        }
        return new Summary(results, aborted, cancelled);
    }

    private ParsedSnapshot parse(int sequence, SaveFile file) {
        try {
            SnapshotLoader.LoadResult loaded = SnapshotLoader.load(file.file());
            MapValue gamestate = SnapshotParser.parse(loaded.content(), maxNestingDepth);
            log.debug("Parsed {}", file.file());
            return ParsedSnapshot.success(sequence, file, gamestate);
        } catch (IOException | FormatException | RuntimeException e) {
            return ParsedSnapshot.failure(sequence, file, e);
        }
    }

    private ImportResult importParsed(ParsedSnapshot parsed) {
        String series = parsed.file().series();
        ImportResult result = parsed.isParsed()
                ? extractor.importSnapshot(series, parsed.gamestate())
                : ImportResult.failed(series, -1, parsed.failure());
        if (result.status() == ImportResult.Status.FAILED) {
            log.error("Snapshot {} for series {} failed to import: {}", parsed.file().file().getFileName(), series,
                    result.cause() == null ? "unknown cause" : result.cause().getMessage());
        } else if (result.status() == ImportResult.Status.REJECTED_STALE) {
            log.warn("Snapshot {} for series {} is older than the newest imported snapshot and was skipped",
                    parsed.file().file().getFileName(), series);
        }
        imported.incrementAndGet();
        return result;
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Snapshot parser threads did not stop within 30 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
