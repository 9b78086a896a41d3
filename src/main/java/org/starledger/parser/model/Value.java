package org.starledger.parser.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * A node of the generic value tree produced by the snapshot parser.
 * <p>
 * The accessors never throw on an unexpected shape; they return an empty result instead, so each
 * extraction step states the shape it expects at the call site and handles its absence explicitly.
 */
public sealed interface Value permits IntValue, FloatValue, StringValue, ListValue, MapValue {

    /**
     * Returns this value as a map. An empty list (written as {@code {}}) is treated as an empty map.
     * @return The map view, or empty if this value is not map-shaped.
     */
    default Optional<MapValue> asMap() {
        return Optional.empty();
    }

    /**
     * Returns this value as a list.
     * @return The list, or empty if this value is not a list.
     */
    default Optional<ListValue> asList() {
        return Optional.empty();
    }

    /**
     * Returns this value as text. Numbers are not converted.
     * @return The text, or empty if this value is not a string.
     */
    default Optional<String> asString() {
        return Optional.empty();
    }

    /**
     * Returns this value as an integer.
     * @return The integer, or empty if this value is not an integer.
     */
    default OptionalLong asLong() {
        return OptionalLong.empty();
    }

    /**
     * Returns this value as a number. Integers are widened.
     * @return The number, or empty if this value is not numeric.
     */
    default OptionalDouble asDouble() {
        return OptionalDouble.empty();
    }

    /**
     * Normalizes the list-or-single pattern of the format: a list yields its elements, the string
     * {@code none} yields nothing and any other value yields itself as the only element.
     * @return The elements.
     */
    default List<Value> elements() {
        return List.of(this);
    }

    /**
     * Returns whether this is the string {@code yes}.
     * @return true for {@code yes}.
     */
    default boolean isYes() {
        return false;
    }
}
