package org.starledger.timeline.model;

/**
 * Selection criteria for reading events. {@code null} fields do not restrict the result.
 *
 * @param kind       Only events of this kind.
 * @param country    Only events whose acting or target country is this id.
 * @param subject    Only events whose subject matches every non-null reference of this pattern.
 * @param fromDay    Only events that end on or after this day (open events always qualify).
 * @param toDay      Only events that start on or before this day.
 * @param knownOnly  Only events known to the observer.
 */
public record EventFilter(EventKind kind, Long country, EventSubject subject, Integer fromDay, Integer toDay,
                          boolean knownOnly) {

    public static EventFilter all() {
        return new EventFilter(null, null, null, null, null, false);
    }

    public EventFilter withKind(EventKind value) {
        return new EventFilter(value, country, subject, fromDay, toDay, knownOnly);
    }

    public EventFilter withCountry(Long value) {
        return new EventFilter(kind, value, subject, fromDay, toDay, knownOnly);
    }

    /**
     * Restricts the result to events filed under a subject, e.g. {@code EventSubject.NONE.withSystem(12L)} for
     * everything that happened in one system.
     */
    public EventFilter withSubject(EventSubject value) {
        return new EventFilter(kind, country, value, fromDay, toDay, knownOnly);
    }

    public EventFilter between(Integer from, Integer to) {
        return new EventFilter(kind, country, subject, from, to, knownOnly);
    }

    public EventFilter knownOnly(boolean value) {
        return new EventFilter(kind, country, subject, fromDay, toDay, value);
    }
}
