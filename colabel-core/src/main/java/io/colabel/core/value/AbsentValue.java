package io.colabel.core.value;

/// Null or missing data. Formats as empty text and is always falsy.
public record AbsentValue() implements Value {

    /// Shared instance; all absent values are equal.
    public static final AbsentValue INSTANCE = new AbsentValue();

    @Override
    public String format(ValueFormatter formatter) {
        return "";
    }

    @Override
    public String asText(ValueFormatter formatter) {
        return "";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }
}
