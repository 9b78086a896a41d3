package org.starledger.timeline.processors;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diplomatic relations of the current snapshot as seen from each country, plus the parties of each truce.
 */
public final class DiplomacyIndex {

    /**
     * Relation predicates of {@code relations_manager.relation} entries.
     */
    public enum Relation {
        RIVALRY("is_rival"),
        DEFENSIVE_PACT("defensive_pact"),
        FEDERATION("alliance"),
        NON_AGGRESSION_PACT("non_aggression_pledge"),
        CLOSED_BORDERS("closed_borders"),
        COMMUNICATIONS("communications"),
        MIGRATION_TREATY("migration_access"),
        COMMERCIAL_PACT("commercial_pact"),
        NEIGHBOR("borders"),
        RESEARCH_AGREEMENT("research_agreement"),
        EMBASSY("embassy");

        private final String key;

        Relation(String key) {
            this.key = key;
        }

        /**
         * @return The key that is {@code yes} when the relation holds.
         */
        public String key() {
            return key;
        }
    }

    private final Map<Long, EnumMap<Relation, Set<Long>>> relations = new HashMap<>();
    private final Map<Long, Set<Long>> truceParties = new HashMap<>();

    void add(long country, Relation relation, long target) {
        relations.computeIfAbsent(country, k -> new EnumMap<>(Relation.class))
                .computeIfAbsent(relation, k -> new TreeSet<>())
                .add(target);
    }

    void addTruceParty(long truce, long country) {
        truceParties.computeIfAbsent(truce, k -> new TreeSet<>()).add(country);
    }

    /**
     * @return The countries {@code country} has the relation with, in ascending id order.
     */
    public Set<Long> targets(long country, Relation relation) {
        EnumMap<Relation, Set<Long>> byRelation = relations.get(country);
        if (byRelation == null || !byRelation.containsKey(relation)) {
            return Set.of();
        }
        return Set.copyOf(byRelation.get(relation));
    }

    public boolean has(long country, Relation relation, Long target) {
        return target != null && targets(country, relation).contains(target);
    }

    /**
     * @return Truce id to the countries bound by it.
     */
    public Map<Long, Set<Long>> truceParties() {
        Map<Long, Set<Long>> copy = new HashMap<>();
        truceParties.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return copy;
    }
}
