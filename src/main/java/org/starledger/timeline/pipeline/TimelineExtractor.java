package org.starledger.timeline.pipeline;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.GameDate;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ExtractionSettings;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.processors.Names;
import org.starledger.timeline.store.ITimelineStore;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.OptionalInt;

/**
 * Imports parsed snapshots into their series.
 * <p>
 * Snapshots of one series must be imported in increasing day order. A snapshot of the same day as the
 * newest stored one replaces it: the stored snapshot is rewound and the new one processed in the same
 * transaction. An older snapshot is rejected because replacing it would rewrite later history.
 * <p>
 * Imports of different series may run concurrently; imports of the same series are serialized by the
 * store's series lock.
 */
public class TimelineExtractor {

    private static final Logger log = LoggerFactory.getLogger(TimelineExtractor.class);

    private final ITimelineStore store;
    private final TimelinePipeline pipeline;
    private final ExtractionSettings settings;
    private final String multiplayerUsername;

    public TimelineExtractor(ITimelineStore store, TimelinePipeline pipeline, ExtractionSettings settings,
                             String multiplayerUsername) {
        this.store = store;
        this.pipeline = pipeline;
        this.settings = settings;
        this.multiplayerUsername = multiplayerUsername == null ? "" : multiplayerUsername;
    }

    /**
     * Extracts the history of one snapshot. Processing failures are reported in the result, never thrown.
     *
     * @param series    The series name.
     * @param gamestate The parsed snapshot.
     * @return The outcome.
     */
    public ImportResult importSnapshot(String series, MapValue gamestate) {
        String date = gamestate.string("date").orElse(null);
        OptionalInt day = date == null ? OptionalInt.empty() : GameDate.tryToDays(date);
        if (day.isEmpty()) {
            return ImportResult.failed(series, -1,
                    new IllegalArgumentException("Snapshot has no valid top-level date: " + date));
        }

        ObserverIdentification observer;
        try {
            observer = ObserverIdentification.identify(gamestate, multiplayerUsername);
        } catch (IllegalArgumentException e) {
            return ImportResult.failed(series, day.getAsInt(), e);
        }

        SnapshotInfo snapshot = new SnapshotInfo(series, day.getAsInt(), date, observer.observerCountry(),
                observer.otherPlayers());
        long start = System.currentTimeMillis();
        try {
            store.getOrCreateSeries(series);
            ImportResult result = importLocked(snapshot, gamestate);
            if (result.isSuccess()) {
                store.updateSeriesMetadata(series, metadata(gamestate, snapshot));
                log.info("{} Processed snapshot in {} ms ({})", snapshot.logPrefix(),
                        System.currentTimeMillis() - start, result.status());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("{} Snapshot failed to import", snapshot.logPrefix(), e);
            return ImportResult.failed(series, day.getAsInt(), e);
        }
    }

    private ImportResult importLocked(SnapshotInfo snapshot, MapValue gamestate) {
        ImportResult.Status status;
        try (ITimelineTransaction tx = store.begin(snapshot.series(), snapshot.day())) {
            OptionalInt latest = store.latestSnapshotDay(snapshot.series());
            if (latest.isPresent() && snapshot.day() < latest.getAsInt()) {
                log.warn("{} Ignoring snapshot older than the newest stored snapshot {}", snapshot.logPrefix(),
                        GameDate.fromDays(latest.getAsInt()));
                return new ImportResult(snapshot.series(), snapshot.day(), ImportResult.Status.REJECTED_STALE, null);
            }
            if (latest.isPresent() && snapshot.day() == latest.getAsInt()) {
                log.info("{} Replacing existing snapshot of the same day", snapshot.logPrefix());
                tx.rewindLatestSnapshot();
                status = ImportResult.Status.SUPERSEDED;
            } else {
                status = ImportResult.Status.COMMITTED;
            }
            TimelinePipeline.Run run = pipeline.run(gamestate, snapshot, tx, settings);
            if (!run.isCommitted()) {
                log.error("{} Snapshot failed to import", snapshot.logPrefix(), run.failure());
                return ImportResult.failed(snapshot.series(), snapshot.day(), run.failure());
            }
        }
        return new ImportResult(snapshot.series(), snapshot.day(), status, null);
    }

    private static JsonObject metadata(MapValue gamestate, SnapshotInfo snapshot) {
        JsonObject metadata = new JsonObject();
        if (snapshot.observerCountry() != null) {
            metadata.addProperty("observer_country", snapshot.observerCountry());
            metadata.addProperty("observer_country_name", gamestate.map("country")
                    .flatMap(c -> c.map(snapshot.observerCountry()))
                    .map(c -> Names.render(c.get("name")))
                    .orElse("Unknown"));
        } else {
            metadata.addProperty("observer_country_name", "Observer Mode");
        }
        MapValue galaxy = gamestate.map("galaxy").orElse(MapValue.EMPTY);
        metadata.addProperty("galaxy_template", galaxy.string("template", "Unknown"));
        metadata.addProperty("galaxy_shape", galaxy.string("shape", "Unknown"));
        metadata.addProperty("difficulty", galaxy.string("difficulty", "Unknown"));
        metadata.addProperty("last_date", snapshot.date());
        metadata.addProperty("version", gamestate.string("version", "Unknown"));
        return metadata;
    }
}
