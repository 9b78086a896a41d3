package org.starledger.timeline.model;

import com.google.gson.JsonObject;

import java.util.Objects;

/**
 * An immutable per-snapshot record owned by one entity and one snapshot.
 *
 * @param kind      The record kind.
 * @param entityId  The in-source id of the owning entity.
 * @param day       The snapshot day.
 * @param breakdown Qualifier for records that are split by category, e.g. {@code species:3}; empty otherwise.
 * @param metrics   The recorded values.
 */
public record PointRecord(PointRecordKind kind, long entityId, int day, String breakdown, JsonObject metrics) {

    public PointRecord {
        Objects.requireNonNull(kind, "kind");
        breakdown = breakdown == null ? "" : breakdown;
        metrics = metrics.deepCopy();
    }

    @Override
    public JsonObject metrics() {
        return metrics.deepCopy();
    }

    public double metric(String name) {
        return metrics.has(name) && metrics.get(name).isJsonPrimitive() ? metrics.get(name).getAsDouble() : 0.0;
    }
}
