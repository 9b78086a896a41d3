package org.starledger.timeline.model;

import java.util.Locale;

/**
 * All historical event kinds, with their extraction shape and scope.
 */
public enum EventKind {
    // systems
    EXPANDED_TO_SYSTEM(EventShape.CONTINUOUS, EventScope.SYSTEM),
    CONQUERED_SYSTEM(EventShape.CONTINUOUS, EventScope.SYSTEM),
    LOST_SYSTEM(EventShape.MOMENTARY, EventScope.SYSTEM),
    COLONIZATION(EventShape.CONTINUOUS, EventScope.SYSTEM),
    TERRAFORMING(EventShape.CONTINUOUS, EventScope.SYSTEM),
    PLANET_DESTROYED(EventShape.MOMENTARY, EventScope.SYSTEM),

    // diplomacy
    FIRST_CONTACT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    SENT_RIVALRY(EventShape.CONTINUOUS, EventScope.COUNTRY),
    RECEIVED_RIVALRY(EventShape.CONTINUOUS, EventScope.COUNTRY),
    CLOSED_BORDERS(EventShape.CONTINUOUS, EventScope.COUNTRY),
    RECEIVED_CLOSED_BORDERS(EventShape.CONTINUOUS, EventScope.COUNTRY),
    DEFENSIVE_PACT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    FORMED_FEDERATION(EventShape.CONTINUOUS, EventScope.COUNTRY),
    NON_AGGRESSION_PACT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    COMMERCIAL_PACT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    RESEARCH_AGREEMENT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    MIGRATION_TREATY(EventShape.CONTINUOUS, EventScope.COUNTRY),
    EMBASSY(EventShape.CONTINUOUS, EventScope.COUNTRY),

    // leaders
    LEADER_RECRUITED(EventShape.MOMENTARY, EventScope.LEADER),
    LEADER_DIED(EventShape.MOMENTARY, EventScope.LEADER),
    LEVEL_UP(EventShape.MOMENTARY, EventScope.LEADER),
    GAINED_TRAIT(EventShape.MOMENTARY, EventScope.LEADER),
    LOST_TRAIT(EventShape.MOMENTARY, EventScope.LEADER),
    RESEARCH_LEADER(EventShape.CONTINUOUS, EventScope.LEADER),
    FACTION_LEADER(EventShape.CONTINUOUS, EventScope.LEADER),

    // country
    RULED_EMPIRE(EventShape.CONTINUOUS, EventScope.COUNTRY),
    CAPITAL_RELOCATION(EventShape.MOMENTARY, EventScope.COUNTRY),
    TRADITION(EventShape.MOMENTARY, EventScope.COUNTRY),
    ASCENSION_PERK(EventShape.MOMENTARY, EventScope.COUNTRY),
    EDICT(EventShape.MOMENTARY, EventScope.COUNTRY),
    GOVERNMENT(EventShape.CONTINUOUS, EventScope.COUNTRY),
    GOVERNMENT_REFORM(EventShape.MOMENTARY, EventScope.COUNTRY),
    NEW_FACTION(EventShape.MOMENTARY, EventScope.COUNTRY),
    RESEARCHED_TECHNOLOGY(EventShape.MOMENTARY, EventScope.COUNTRY),

    // wars
    WAR(EventShape.CONTINUOUS, EventScope.COUNTRY),
    PEACE(EventShape.MOMENTARY, EventScope.COUNTRY),
    FLEET_COMBAT(EventShape.MOMENTARY, EventScope.GALAXY),
    ARMY_COMBAT(EventShape.MOMENTARY, EventScope.GALAXY);

    private final EventShape shape;
    private final EventScope scope;

    EventKind(EventShape shape, EventScope scope) {
        this.shape = shape;
        this.scope = scope;
    }

    public EventShape shape() {
        return shape;
    }

    public EventScope scope() {
        return scope;
    }

    public boolean isContinuous() {
        return shape == EventShape.CONTINUOUS;
    }

    /**
     * @return The lower-case name used in the store and on the command line.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a kind from its {@link #id()}, ignoring case.
     *
     * @param id The kind id, e.g. {@code ruled_empire}.
     * @return The kind.
     * @throws IllegalArgumentException if no kind has this id.
     */
    public static EventKind fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
