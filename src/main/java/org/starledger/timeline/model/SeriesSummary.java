package org.starledger.timeline.model;

import java.util.OptionalInt;

/**
 * Overview of a stored series.
 *
 * @param series    The series.
 * @param snapshots Number of committed snapshots.
 * @param firstDay  Day of the earliest snapshot, or {@code null} if there is none.
 * @param lastDay   Day of the latest snapshot, or {@code null} if there is none.
 */
public record SeriesSummary(Series series, int snapshots, Integer firstDay, Integer lastDay) {

    public OptionalInt latestDay() {
        return lastDay == null ? OptionalInt.empty() : OptionalInt.of(lastDay);
    }
}
