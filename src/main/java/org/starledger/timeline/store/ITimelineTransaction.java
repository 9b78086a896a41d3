package org.starledger.timeline.store;

import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.model.PointRecord;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The write transaction of one snapshot of one series.
 * <p>
 * Entities are served from an identity cache: every lookup of the same (kind, id) within the transaction
 * returns the same instance, and modified entities are written back on {@link #commit()}. Events and point
 * records are written immediately but only become visible to readers on commit.
 * <p>
 * A transaction is used by a single thread. Closing a transaction that was neither committed nor rolled
 * back rolls it back.
 */
public interface ITimelineTransaction extends AutoCloseable {

    String series();

    /**
     * @return The day of the snapshot being written.
     */
    int day();

    Optional<Entity> findEntity(EntityKind kind, long sourceId);

    /**
     * Returns the cached entity, loading it or creating it with {@link #day()} as creation day.
     *
     * @param kind     The entity kind.
     * @param sourceId The in-source id.
     * @return The entity handle.
     */
    Entity getOrCreateEntity(EntityKind kind, long sourceId);

    /**
     * @param kind The entity kind.
     * @return All entities of the kind, stored or created in this transaction, ordered by id.
     */
    Collection<Entity> entities(EntityKind kind);

    /**
     * Persists a new event.
     *
     * @param draft The event, with id 0.
     * @return The stored event carrying its assigned id.
     */
    HistoricalEvent appendEvent(HistoricalEvent draft);

    /**
     * Finds events of a kind whose subject matches every non-null field of {@code subject}.
     *
     * @param kind     The event kind.
     * @param subject  The subject pattern.
     * @param openOnly Whether only open events are returned.
     * @return The events ordered by start day and creation.
     */
    List<HistoricalEvent> findEvents(EventKind kind, EventSubject subject, boolean openOnly);

    /**
     * @param kind The event kind.
     * @return All open events of the kind.
     */
    default List<HistoricalEvent> findOpenEvents(EventKind kind) {
        return findEvents(kind, EventSubject.NONE, true);
    }

    /**
     * Finds the most recent event of a kind with the given subject pattern and description.
     *
     * @param kind        The event kind.
     * @param subject     The subject pattern.
     * @param description The description to match, or {@code null} to match any.
     * @return The event with the highest start day, if any.
     */
    default Optional<HistoricalEvent> findLatestEvent(EventKind kind, EventSubject subject, String description) {
        List<HistoricalEvent> events = findEvents(kind, subject, false);
        for (int i = events.size() - 1; i >= 0; i--) {
            HistoricalEvent event = events.get(i);
            if (description == null || Objects.equals(description, event.description().orElse(null))) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /**
     * Writes the end, observation day and visibility of an existing event.
     *
     * @param event The modified event.
     */
    void updateEvent(HistoricalEvent event);

    /**
     * Extends the open event of {@code kind} with exactly this subject and description to the current day,
     * or appends a new open event starting at {@code start} if there is none.
     *
     * @param kind        A continuous event kind.
     * @param subject     The exact subject.
     * @param description The description, possibly {@code null}.
     * @param start       Start day for a new event.
     * @param known       Whether the observer currently knows about the fact.
     * @return The extended or appended event.
     */
    default HistoricalEvent appendOrExtendEvent(EventKind kind, EventSubject subject, String description,
                                                int start, boolean known) {
        for (HistoricalEvent open : findEvents(kind, subject, true)) {
            if (open.subject().equals(subject) && Objects.equals(description, open.description().orElse(null))) {
                open.extendTo(day());
                open.widenVisibility(known);
                updateEvent(open);
                return open;
            }
        }
        return appendEvent(HistoricalEvent.draft(kind, subject, description, start, null, known, day()));
    }

    void insertPointRecord(PointRecord record);

    /**
     * Reverts every write of the newest committed snapshot, which must be on {@link #day()}, so that the
     * snapshot can be processed again.
     */
    void rewindLatestSnapshot();

    /**
     * Records the snapshot, writes back modified entities and commits. Releases the series lock.
     */
    void commit();

    /**
     * Discards every write of this transaction. Releases the series lock.
     */
    void rollback();

    boolean isActive();

    @Override
    default void close() {
        if (isActive()) {
            rollback();
        }
    }
}
