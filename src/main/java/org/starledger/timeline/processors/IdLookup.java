package org.starledger.timeline.processors;

import java.util.Map;
import java.util.Optional;

/**
 * A one-to-one lookup between in-source ids, e.g. fleet to owner country.
 *
 * @param values The mapping.
 */
public record IdLookup(Map<Long, Long> values) {

    public IdLookup {
        values = Map.copyOf(values);
    }

    public Optional<Long> get(Long key) {
        return key == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }
}
