package org.starledger.timeline.pipeline;

/**
 * Outcome of importing one snapshot into a series.
 *
 * @param series The series name.
 * @param day    The snapshot day, -1 if the date could not be read.
 * @param status The outcome.
 * @param cause  Why the import failed, {@code null} unless {@link Status#FAILED}.
 */
public record ImportResult(String series, int day, Status status, Exception cause) {

    public enum Status {
        /** The snapshot was new and its history committed. */
        COMMITTED,
        /** A snapshot of the same day existed and was replaced. */
        SUPERSEDED,
        /** The snapshot is older than the newest one of the series and was ignored. */
        REJECTED_STALE,
        /** Processing failed and the snapshot's writes were rolled back. */
        FAILED
    }

    public static ImportResult failed(String series, int day, Exception cause) {
        return new ImportResult(series, day, Status.FAILED, cause);
    }

    public boolean isSuccess() {
        return status == Status.COMMITTED || status == Status.SUPERSEDED;
    }
}
