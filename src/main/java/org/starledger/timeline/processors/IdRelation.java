package org.starledger.timeline.processors;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A one-to-many relation between in-source ids, e.g. owner country to owned systems.
 */
public final class IdRelation {

    private final Map<Long, Set<Long>> values = new HashMap<>();

    void add(long from, long to) {
        values.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
    }

    /**
     * @param from The source id.
     * @return The related ids in ascending order, empty if there are none.
     */
    public Set<Long> get(Long from) {
        Set<Long> related = from == null ? null : values.get(from);
        return related == null ? Set.of() : Set.copyOf(related);
    }

    public boolean contains(Long from, Long to) {
        return get(from).contains(to);
    }
}
