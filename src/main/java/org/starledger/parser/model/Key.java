package org.starledger.parser.model;

import java.util.OptionalLong;

/**
 * A map key of the value tree. Keys are either text (identifiers or quoted strings) or integers
 * (ids of countries, systems, leaders and similar objects).
 *
 * @param text    The textual form of the key.
 * @param numeric Whether the key was written as an integer.
 */
public record Key(String text, boolean numeric) implements Comparable<Key> {

    public static Key of(String text) {
        return new Key(text, false);
    }

    public static Key of(long id) {
        return new Key(Long.toString(id), true);
    }

    /**
     * Returns the integer form of a numeric key.
     * @return The id, or empty for text keys.
     */
    public OptionalLong id() {
        return numeric ? OptionalLong.of(Long.parseLong(text)) : OptionalLong.empty();
    }

    /**
     * Numeric keys sort before text keys and by value; text keys sort lexicographically.
     */
    @Override
    public int compareTo(Key other) {
        if (numeric && other.numeric) {
            return Long.compare(Long.parseLong(text), Long.parseLong(other.text));
        }
        if (numeric != other.numeric) {
            return numeric ? -1 : 1;
        }
        return text.compareTo(other.text);
    }

    @Override
    public String toString() {
        return text;
    }
}
