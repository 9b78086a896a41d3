package org.starledger.timeline.model;

import java.util.Locale;

/**
 * Kinds of per-snapshot records and the entity kind they belong to.
 */
public enum PointRecordKind {
    COUNTRY_METRICS(EntityKind.COUNTRY),
    POP_STATS(EntityKind.COUNTRY);

    private final EntityKind entityKind;

    PointRecordKind(EntityKind entityKind) {
        this.entityKind = entityKind;
    }

    public EntityKind entityKind() {
        return entityKind;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
