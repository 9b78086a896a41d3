package org.starledger.parser.model;

import java.util.List;
import java.util.Optional;

/**
 * An ordered list of values, parsed from a brace block without keys.
 *
 * @param values The elements in source order.
 */
public record ListValue(List<Value> values) implements Value {

    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    public Value get(int index) {
        return values.get(index);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Optional<MapValue> asMap() {
        return values.isEmpty() ? Optional.of(MapValue.EMPTY) : Optional.empty();
    }

    @Override
    public Optional<ListValue> asList() {
        return Optional.of(this);
    }

    @Override
    public List<Value> elements() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
