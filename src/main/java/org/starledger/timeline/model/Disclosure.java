package org.starledger.timeline.model;

/**
 * Levels of information a country may disclose to the observer.
 */
public enum Disclosure {
    /** The country has met the observer. */
    CONTACT,
    DEMOGRAPHY,
    ECONOMY,
    TECHNOLOGY,
    MILITARY
}
