package org.starledger.parser.model;

import java.util.List;
import java.util.Optional;

public record StringValue(String value) implements Value {

    @Override
    public Optional<String> asString() {
        return Optional.of(value);
    }

    @Override
    public List<Value> elements() {
        return "none".equals(value) ? List.of() : List.of(this);
    }

    @Override
    public boolean isYes() {
        return "yes".equals(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
