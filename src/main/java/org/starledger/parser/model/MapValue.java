package org.starledger.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * An ordered key/value block of the value tree. Keys are unique: repeated keys in the source are
 * collected into a {@link ListValue} by the parser.
 *
 * @param entries The entries in first-occurrence order.
 */
public record MapValue(Map<Key, Value> entries) implements Value {

    public static final MapValue EMPTY = new MapValue(new LinkedHashMap<>());

    public MapValue {
        entries = Collections.unmodifiableMap(entries);
    }

    public Optional<Value> get(Key key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<Value> get(String key) {
        return get(Key.of(key));
    }

    public Optional<Value> get(long id) {
        return get(Key.of(id));
    }

    public boolean has(String key) {
        return entries.containsKey(Key.of(key));
    }

    public int size() {
        return entries.size();
    }

    public Optional<MapValue> map(String key) {
        return get(key).flatMap(Value::asMap);
    }

    public Optional<MapValue> map(long id) {
        return get(id).flatMap(Value::asMap);
    }

    public Optional<String> string(String key) {
        return get(key).flatMap(Value::asString);
    }

    public String string(String key, String fallback) {
        return string(key).orElse(fallback);
    }

    public OptionalLong longValue(String key) {
        Optional<Value> value = get(key);
        return value.isPresent() ? value.get().asLong() : OptionalLong.empty();
    }

    public OptionalDouble doubleValue(String key) {
        Optional<Value> value = get(key);
        return value.isPresent() ? value.get().asDouble() : OptionalDouble.empty();
    }

    public double doubleValue(String key, double fallback) {
        return doubleValue(key).orElse(fallback);
    }

    public boolean isYes(String key) {
        return get(key).map(Value::isYes).orElse(false);
    }

    /**
     * Returns the value of {@code key} normalized by {@link Value#elements()}.
     * @param key The key.
     * @return The elements, empty if the key is absent.
     */
    public List<Value> list(String key) {
        return get(key).map(Value::elements).orElse(List.of());
    }

    /**
     * Returns the integer elements of {@code key}, skipping anything else.
     * @param key The key.
     * @return The integers in source order.
     */
    public List<Long> longs(String key) {
        List<Long> result = new ArrayList<>();
        for (Value v : list(key)) {
            v.asLong().ifPresent(result::add);
        }
        return result;
    }

    /**
     * Returns the string elements of {@code key}, skipping anything else.
     * @param key The key.
     * @return The strings in source order.
     */
    public List<String> strings(String key) {
        List<String> result = new ArrayList<>();
        for (Value v : list(key)) {
            v.asString().ifPresent(result::add);
        }
        return result;
    }

    /**
     * Returns the map-shaped values of the numeric keys in this block, ordered by id. Tables such as
     * {@code country} or {@code leaders} use this layout; deleted entries ({@code none}) are dropped.
     * @return The objects by id.
     */
    public NavigableMap<Long, MapValue> objectsById() {
        NavigableMap<Long, MapValue> result = new TreeMap<>();
        for (Map.Entry<Key, Value> entry : entries.entrySet()) {
            OptionalLong id = entry.getKey().id();
            if (id.isEmpty()) {
                continue;
            }
            entry.getValue().asMap().ifPresent(m -> result.put(id.getAsLong(), m));
        }
        return result;
    }

    /**
     * Returns the map-shaped elements of {@code key}, skipping anything else.
     * @param key The key.
     * @return The maps in source order.
     */
    public List<MapValue> maps(String key) {
        List<MapValue> result = new ArrayList<>();
        for (Value v : list(key)) {
            v.asMap().ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Optional<MapValue> asMap() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
