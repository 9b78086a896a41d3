package org.starledger.timeline.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An append-only interval record.
 * <p>
 * Only three properties change after creation: the end day (set once when a continuous fact ends),
 * the last day a continuous fact was observed, and the visibility flag, which can only be widened.
 */
public final class HistoricalEvent {

    private final long id;
    private final EventKind kind;
    private final EventSubject subject;
    private final String description;
    private final int startDay;
    private final int createdDay;
    private Integer endDay;
    private int observedUntil;
    private boolean knownToObserver;

    public HistoricalEvent(long id, EventKind kind, EventSubject subject, String description, int startDay,
                           Integer endDay, int observedUntil, boolean knownToObserver, int createdDay) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.description = description;
        this.startDay = startDay;
        this.endDay = endDay;
        this.observedUntil = observedUntil;
        this.knownToObserver = knownToObserver;
        this.createdDay = createdDay;
    }

    /**
     * Creates an unsaved event. Continuous events start open; momentary events may carry an end day.
     *
     * @param kind            The event kind.
     * @param subject         The referenced entities.
     * @param description     Free text qualifying the event, e.g. a technology name, or {@code null}.
     * @param startDay        The first day of the event.
     * @param endDay          The end day, {@code null} for open events.
     * @param knownToObserver Whether the observer knows about the event.
     * @param createdDay      The snapshot day that created the event.
     * @return The new event with id 0.
     */
    public static HistoricalEvent draft(EventKind kind, EventSubject subject, String description, int startDay,
                                        Integer endDay, boolean knownToObserver, int createdDay) {
        return new HistoricalEvent(0L, kind, subject, description, startDay, endDay,
                Math.max(startDay, createdDay), knownToObserver, createdDay);
    }

    public HistoricalEvent withId(long newId) {
        return new HistoricalEvent(newId, kind, subject, description, startDay, endDay, observedUntil,
                knownToObserver, createdDay);
    }

    public long id() {
        return id;
    }

    public EventKind kind() {
        return kind;
    }

    public EventSubject subject() {
        return subject;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public int startDay() {
        return startDay;
    }

    public OptionalInt endDay() {
        return endDay == null ? OptionalInt.empty() : OptionalInt.of(endDay);
    }

    public boolean isOpen() {
        return endDay == null;
    }

    public int observedUntil() {
        return observedUntil;
    }

    public boolean knownToObserver() {
        return knownToObserver;
    }

    public int createdDay() {
        return createdDay;
    }

    /**
     * Records that a continuous fact still holds on {@code day}.
     * @param day The current snapshot day.
     */
    public void extendTo(int day) {
        if (!isOpen()) {
            throw new IllegalStateException("Cannot extend closed event " + this);
        }
        observedUntil = Math.max(observedUntil, day);
    }

    /**
     * Closes an open event. The end day never precedes the start day.
     * @param day The last day the fact held.
     */
    public void close(int day) {
        if (!isOpen()) {
            throw new IllegalStateException("Event is already closed: " + this);
        }
        endDay = Math.max(startDay, day);
        observedUntil = Math.max(observedUntil, endDay);
    }

    /**
     * Widens the visibility flag. A known event never becomes unknown again.
     * @param known The visibility computed for the current snapshot.
     * @return true if the flag changed.
     */
    public boolean widenVisibility(boolean known) {
        if (known && !knownToObserver) {
            knownToObserver = true;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "HistoricalEvent{" + id + " " + kind.id() + " " + subject + " [" + startDay + ", "
                + (endDay == null ? "open" : endDay) + "]" + (description != null ? " '" + description + "'" : "") + "}";
    }
}
