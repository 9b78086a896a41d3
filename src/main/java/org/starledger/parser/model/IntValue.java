package org.starledger.parser.model;

import java.util.OptionalDouble;
import java.util.OptionalLong;

public record IntValue(long value) implements Value {

    @Override
    public OptionalLong asLong() {
        return OptionalLong.of(value);
    }

    @Override
    public OptionalDouble asDouble() {
        return OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
