package org.starledger.timeline.pipeline;

import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The two event shapes shared by all processors.
 * <p>
 * Continuous facts are extended while they hold and closed on the day before they stop holding. Momentary
 * events are identified by kind, subject, description and start day and are written once.
 */
public final class EventHistory {

    /**
     * A continuous fact as it holds in the current snapshot.
     *
     * @param subject     The exact subject.
     * @param description The description, possibly {@code null}.
     * @param known       Whether the observer knows about the fact.
     */
    public record Fact(EventSubject subject, String description, boolean known) {
        public Fact {
            Objects.requireNonNull(subject, "subject");
        }

        boolean matches(HistoricalEvent event) {
            return event.subject().equals(subject) && Objects.equals(description, event.description().orElse(null));
        }
    }

    private EventHistory() {}

    /**
     * Extends the open event for the fact or opens one starting today.
     */
    public static HistoricalEvent extendOrOpen(ITimelineTransaction tx, EventKind kind, Fact fact) {
        return extendOrOpen(tx, kind, fact, tx.day());
    }

    /**
     * Extends the open event for the fact or opens one starting at {@code start}. A new event never starts
     * before the end of an earlier event of the same kind and subject.
     */
    public static HistoricalEvent extendOrOpen(ITimelineTransaction tx, EventKind kind, Fact fact, int start) {
        requireShape(kind, true);
        int effectiveStart = Math.min(start, tx.day());
        for (HistoricalEvent earlier : tx.findEvents(kind, fact.subject(), false)) {
            if (earlier.subject().equals(fact.subject()) && !earlier.isOpen()) {
                effectiveStart = Math.max(effectiveStart, Math.min(tx.day(), earlier.endDay().getAsInt() + 1));
            }
        }
        return tx.appendOrExtendEvent(kind, fact.subject(), fact.description(), effectiveStart, fact.known());
    }

    /**
     * Closes an open event on the day before the current snapshot.
     */
    public static void close(ITimelineTransaction tx, HistoricalEvent event) {
        closeAt(tx, event, tx.day() - 1);
    }

    public static void closeAt(ITimelineTransaction tx, HistoricalEvent event, int endDay) {
        if (!event.isOpen()) {
            return;
        }
        event.close(endDay);
        tx.updateEvent(event);
    }

    /**
     * Makes the open events of {@code kind} matching {@code pattern} reflect exactly {@code current}:
     * events whose fact no longer holds are closed, holding facts are extended or opened.
     *
     * @param tx      The transaction.
     * @param kind    A continuous kind.
     * @param pattern Subject pattern selecting the events owned by the caller, e.g. one country.
     * @param current The facts holding in the current snapshot, each matching {@code pattern}.
     * @return The events now representing {@code current}, in its order.
     */
    public static List<HistoricalEvent> reconcile(ITimelineTransaction tx, EventKind kind, EventSubject pattern,
                                                  Collection<Fact> current) {
        requireShape(kind, true);
        for (HistoricalEvent open : tx.findEvents(kind, pattern, true)) {
            if (current.stream().noneMatch(f -> f.matches(open))) {
                close(tx, open);
            }
        }
        List<HistoricalEvent> result = new ArrayList<>(current.size());
        for (Fact fact : current) {
            result.add(extendOrOpen(tx, kind, fact));
        }
        return result;
    }

    /**
     * Replaces whatever open event of {@code kind} matches {@code pattern} by the event for {@code fact}.
     *
     * @return The event for the fact.
     */
    public static HistoricalEvent closeAndOpen(ITimelineTransaction tx, EventKind kind, EventSubject pattern,
                                               Fact fact) {
        return reconcile(tx, kind, pattern, List.of(fact)).get(0);
    }

    /**
     * Closes every open event of {@code kind} matching {@code pattern}.
     *
     * @return The number of closed events.
     */
    public static int closeAll(ITimelineTransaction tx, EventKind kind, EventSubject pattern) {
        List<HistoricalEvent> open = tx.findEvents(kind, pattern, true);
        open.forEach(e -> close(tx, e));
        return open.size();
    }

    /**
     * Records a momentary event unless an event with the same identity already exists, in which case only its
     * visibility is widened.
     *
     * @param tx          The transaction.
     * @param kind        A momentary kind.
     * @param subject     The exact subject.
     * @param description The description, possibly {@code null}.
     * @param start       The day the event happened.
     * @param end         The end day, e.g. an edict's expiry, or {@code null}.
     * @param known       Whether the observer knows about the event.
     * @return The new or existing event.
     */
    public static HistoricalEvent recordMomentary(ITimelineTransaction tx, EventKind kind, EventSubject subject,
                                                  String description, int start, Integer end, boolean known) {
        requireShape(kind, false);
        Optional<HistoricalEvent> existing = tx.findEvents(kind, subject, false).stream()
                .filter(e -> e.subject().equals(subject))
                .filter(e -> e.startDay() == start)
                .filter(e -> Objects.equals(description, e.description().orElse(null)))
                .findFirst();
        if (existing.isPresent()) {
            if (existing.get().widenVisibility(known)) {
                tx.updateEvent(existing.get());
            }
            return existing.get();
        }
        Integer clampedEnd = end == null ? start : Math.max(start, end);
        return tx.appendEvent(HistoricalEvent.draft(kind, subject, description, start, clampedEnd, known, tx.day()));
    }

    /**
     * Whether any event, open or closed, of {@code kind} with exactly this subject was recorded.
     */
    public static boolean wasRecorded(ITimelineTransaction tx, EventKind kind, EventSubject subject) {
        return tx.findEvents(kind, subject, false).stream().anyMatch(e -> e.subject().equals(subject));
    }

    private static void requireShape(EventKind kind, boolean continuous) {
        if (kind.isContinuous() != continuous) {
            throw new IllegalArgumentException("Event kind " + kind.id() + " is "
                    + (continuous ? "momentary" : "continuous"));
        }
    }
}
