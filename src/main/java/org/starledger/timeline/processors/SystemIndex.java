package org.starledger.timeline.processors;

import org.starledger.timeline.model.EntityKind;

import java.util.Map;
import java.util.Optional;

/**
 * Systems of the current snapshot and the system each starbase is located in.
 */
public final class SystemIndex {

    private final EntityIndex systems = new EntityIndex(EntityKind.SYSTEM);
    private final Map<Long, Long> starbaseSystems;

    SystemIndex(Map<Long, Long> starbaseSystems) {
        this.starbaseSystems = Map.copyOf(starbaseSystems);
    }

    public EntityIndex systems() {
        return systems;
    }

    public Optional<Long> systemOfStarbase(long starbaseId) {
        return Optional.ofNullable(starbaseSystems.get(starbaseId));
    }
}
