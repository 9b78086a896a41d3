package org.starledger.timeline.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A long-lived object of a series, identified by its kind and in-source id.
 * <p>
 * Mutable attributes are kept as a JSON object and overwritten in place. References to other entities
 * are stored as in-source ids under attribute names such as {@code owner} or {@code country}. Setters
 * report whether the value actually changed and mark the entity dirty so the store only writes
 * entities that were modified.
 */
public final class Entity {

    private final EntityKind kind;
    private final long sourceId;
    private final int createdDay;
    private final JsonObject attributes;
    private boolean dirty;

    /**
     * Creates a new entity first seen on {@code createdDay}.
     */
    public Entity(EntityKind kind, long sourceId, int createdDay) {
        this(kind, sourceId, createdDay, new JsonObject());
        this.dirty = true;
    }

    /**
     * Restores an entity from its stored form.
     */
    public Entity(EntityKind kind, long sourceId, int createdDay, JsonObject attributes) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceId = sourceId;
        this.createdDay = createdDay;
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    public EntityKind kind() {
        return kind;
    }

    public long sourceId() {
        return sourceId;
    }

    public int createdDay() {
        return createdDay;
    }

    /**
     * @return A copy of the attributes.
     */
    public JsonObject attributes() {
        return attributes.deepCopy();
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markClean() {
        dirty = false;
    }

    public boolean has(String name) {
        return attributes.has(name) && !attributes.get(name).isJsonNull();
    }

    public Optional<String> getString(String name) {
        JsonElement e = attributes.get(name);
        return e != null && e.isJsonPrimitive() ? Optional.of(e.getAsString()) : Optional.empty();
    }

    public OptionalLong getLong(String name) {
        JsonElement e = attributes.get(name);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()
                ? OptionalLong.of(e.getAsLong()) : OptionalLong.empty();
    }

    public double getDouble(String name, double fallback) {
        JsonElement e = attributes.get(name);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber() ? e.getAsDouble() : fallback;
    }

    public boolean getBoolean(String name) {
        JsonElement e = attributes.get(name);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }

    public List<String> getStrings(String name) {
        List<String> result = new ArrayList<>();
        JsonElement e = attributes.get(name);
        if (e != null && e.isJsonArray()) {
            e.getAsJsonArray().forEach(x -> result.add(x.getAsString()));
        }
        return result;
    }

    public List<Long> getLongs(String name) {
        List<Long> result = new ArrayList<>();
        JsonElement e = attributes.get(name);
        if (e != null && e.isJsonArray()) {
            e.getAsJsonArray().forEach(x -> result.add(x.getAsLong()));
        }
        return result;
    }

    public JsonElement getJson(String name) {
        JsonElement e = attributes.get(name);
        return e == null ? null : e.deepCopy();
    }

    public boolean set(String name, String value) {
        return put(name, value == null ? null : new JsonPrimitive(value));
    }

    public boolean set(String name, Number value) {
        return put(name, value == null ? null : new JsonPrimitive(value));
    }

    public boolean set(String name, boolean value) {
        return put(name, new JsonPrimitive(value));
    }

    public boolean setStrings(String name, Collection<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return put(name, array);
    }

    public boolean setLongs(String name, Collection<Long> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return put(name, array);
    }

    public boolean setJson(String name, JsonElement value) {
        return put(name, value == null ? null : value.deepCopy());
    }

    public boolean remove(String name) {
        return put(name, null);
    }

    private boolean put(String name, JsonElement value) {
        JsonElement existing = attributes.get(name);
        if (value == null) {
            if (existing == null) {
                return false;
            }
            attributes.remove(name);
            dirty = true;
            return true;
        }
        if (value.equals(existing)) {
            return false;
        }
        attributes.add(name, value);
        dirty = true;
        return true;
    }

    @Override
    public String toString() {
        return kind + "#" + sourceId + attributes;
    }
}
