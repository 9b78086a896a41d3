package org.starledger.timeline.model;

/**
 * The subject an event is primarily filed under.
 */
public enum EventScope {
    GALAXY,
    COUNTRY,
    LEADER,
    SYSTEM
}
