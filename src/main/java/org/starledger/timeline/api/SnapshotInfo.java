package org.starledger.timeline.api;

import java.util.Set;

/**
 * Identification of the snapshot being processed.
 *
 * @param series          The series name.
 * @param day             The snapshot day.
 * @param date            The in-game date as written in the snapshot.
 * @param observerCountry The observer country id, {@code null} in observer mode.
 * @param otherPlayers    Ids of human-controlled countries other than the observer.
 */
public record SnapshotInfo(String series, int day, String date, Long observerCountry, Set<Long> otherPlayers) {

    public SnapshotInfo {
        otherPlayers = Set.copyOf(otherPlayers);
    }

    /**
     * @return Whether no country is the observer, making every event known.
     */
    public boolean isObserverMode() {
        return observerCountry == null;
    }

    public boolean isObserver(Long countryId) {
        return observerCountry != null && observerCountry.equals(countryId);
    }

    public boolean isOtherPlayer(Long countryId) {
        return countryId != null && otherPlayers.contains(countryId);
    }

    /**
     * @return Prefix for log lines about this snapshot.
     */
    public String logPrefix() {
        return series + " " + date;
    }
}
