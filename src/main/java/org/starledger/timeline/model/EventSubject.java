package org.starledger.timeline.model;

/**
 * The entities an event refers to, by in-source id. Any reference may be {@code null}.
 *
 * @param country       The acting country.
 * @param targetCountry The counterpart country, e.g. the former owner of a conquered system.
 * @param leader        The leader involved.
 * @param system        The star system.
 * @param planet        The planet.
 * @param faction       The political faction.
 * @param war           The war.
 */
public record EventSubject(Long country, Long targetCountry, Long leader, Long system, Long planet,
                           Long faction, Long war) {

    public static final EventSubject NONE = new EventSubject(null, null, null, null, null, null, null);

    public static EventSubject ofCountry(long country) {
        return NONE.withCountry(country);
    }

    public EventSubject withCountry(Long id) {
        return new EventSubject(id, targetCountry, leader, system, planet, faction, war);
    }

    public EventSubject withTargetCountry(Long id) {
        return new EventSubject(country, id, leader, system, planet, faction, war);
    }

    public EventSubject withLeader(Long id) {
        return new EventSubject(country, targetCountry, id, system, planet, faction, war);
    }

    public EventSubject withSystem(Long id) {
        return new EventSubject(country, targetCountry, leader, id, planet, faction, war);
    }

    public EventSubject withPlanet(Long id) {
        return new EventSubject(country, targetCountry, leader, system, id, faction, war);
    }

    public EventSubject withFaction(Long id) {
        return new EventSubject(country, targetCountry, leader, system, planet, id, war);
    }

    public EventSubject withWar(Long id) {
        return new EventSubject(country, targetCountry, leader, system, planet, faction, id);
    }
}
