package org.starledger.timeline.store;

import com.google.gson.JsonObject;
import org.starledger.timeline.model.Series;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Keyed persistent store holding the history of every series.
 * <p>
 * All writes for one snapshot go through a single {@link ITimelineTransaction}. At most one transaction per
 * series is open at any time; {@link #begin(String, int)} blocks while another one is active for the same
 * series. Different series are independent.
 */
public interface ITimelineStore extends AutoCloseable {

    /**
     * Returns the series with the given name, creating it and its storage on first use.
     *
     * @param name The series name.
     * @return The series.
     * @throws StoreException if the series cannot be created.
     */
    Series getOrCreateSeries(String name);

    Optional<Series> findSeries(String name);

    /**
     * Replaces the descriptive metadata of a series.
     *
     * @param name     The series name.
     * @param metadata The new metadata.
     */
    void updateSeriesMetadata(String name, JsonObject metadata);

    boolean snapshotExists(String series, int day);

    /**
     * @param series The series name.
     * @return The day of the newest committed snapshot, empty if the series has none.
     */
    OptionalInt latestSnapshotDay(String series);

    /**
     * Opens the write transaction for one snapshot.
     *
     * @param series The series name. The series must exist.
     * @param day    The snapshot day.
     * @return The transaction, holding the series lock until it is committed or rolled back.
     * @throws StoreException if the transaction cannot be started.
     */
    ITimelineTransaction begin(String series, int day);

    @Override
    void close();
}
