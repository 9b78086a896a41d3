package org.starledger.timeline.model;

/**
 * Kinds of long-lived entities tracked across snapshots. Together with the in-source id a kind
 * identifies an entity within a series.
 */
public enum EntityKind {
    COUNTRY,
    SYSTEM,
    PLANET,
    LEADER,
    SPECIES,
    FACTION,
    WAR
}
