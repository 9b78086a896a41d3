package org.starledger.timeline.processors;

import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Entities of one kind that are present in the current snapshot, by in-source id.
 */
public final class EntityIndex {

    private final EntityKind kind;
    private final NavigableMap<Long, Entity> entities = new TreeMap<>();

    public EntityIndex(EntityKind kind) {
        this.kind = kind;
    }

    public EntityKind kind() {
        return kind;
    }

    void put(Entity entity) {
        if (entity.kind() != kind) {
            throw new IllegalArgumentException("Expected " + kind + " entity, got " + entity);
        }
        entities.put(entity.sourceId(), entity);
    }

    public Optional<Entity> get(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
    }

    public boolean contains(Long id) {
        return id != null && entities.containsKey(id);
    }

    public NavigableMap<Long, Entity> all() {
        return Collections.unmodifiableNavigableMap(entities);
    }

    public int size() {
        return entities.size();
    }
}
