package org.starledger.timeline.model;

/**
 * The two extraction shapes of historical events.
 */
public enum EventShape {
    /** A condition that holds over an interval and is extended while it persists. */
    CONTINUOUS,
    /** A single occurrence that is recorded once and never extended. */
    MOMENTARY
}
