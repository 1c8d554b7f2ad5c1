package io.colabel.core.value;

import java.util.Objects;

public record TextValue(String value) implements Value {

    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String format(ValueFormatter formatter) {
        return value;
    }

    @Override
    public String asText(ValueFormatter formatter) {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }
}
