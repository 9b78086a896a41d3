package org.starledger.timeline.store;

import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventFilter;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.model.PointRecord;
import org.starledger.timeline.model.PointRecordKind;
import org.starledger.timeline.model.SeriesSummary;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to committed history.
 * <p>
 * Results reflect committed snapshots only. Unknown series yield empty results.
 */
public interface ITimelineReader {

    List<SeriesSummary> listSeries();

    /**
     * @param series The series name.
     * @return The days of all committed snapshots in ascending order.
     */
    List<Integer> snapshotDays(String series);

    /**
     * Returns the events of a series matching the filter, ordered by start day and creation.
     * <p>
     * The date range selects events whose interval overlaps it; open events extend to infinity.
     *
     * @param series The series name.
     * @param filter The filter.
     * @return The matching events.
     */
    List<HistoricalEvent> events(String series, EventFilter filter);

    /**
     * Returns the point records of one entity ordered by snapshot day.
     *
     * @param series   The series name.
     * @param kind     The record kind.
     * @param entityId The in-source id of the entity.
     * @return The records, ordered by day and breakdown.
     */
    List<PointRecord> pointRecords(String series, PointRecordKind kind, long entityId);

    Optional<Entity> findEntity(String series, EntityKind kind, long sourceId);
}
