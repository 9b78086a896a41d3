package org.starledger.timeline.store;

/**
 * Thrown when the timeline store fails to read or write.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>The database cannot be opened or the connection pool cannot be started</li>
 *   <li>A statement fails while a snapshot is being written</li>
 *   <li>A stored row cannot be decoded</li>
 * </ul>
 * <p>
 * A store failure aborts the snapshot in flight; snapshots committed earlier are unaffected.
 */
public class StoreException extends RuntimeException {

    /**
     * Creates a StoreException with the specified message.
     *
     * @param message Description of the store failure
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * Creates a StoreException with the specified message and cause.
     *
     * @param message Description of the store failure
     * @param cause The underlying exception that caused the failure
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
