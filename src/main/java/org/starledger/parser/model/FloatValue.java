package org.starledger.parser.model;

import java.util.OptionalDouble;

public record FloatValue(double value) implements Value {

    @Override
    public OptionalDouble asDouble() {
        return OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
