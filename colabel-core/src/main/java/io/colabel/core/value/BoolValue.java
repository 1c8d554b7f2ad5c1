package io.colabel.core.value;

public record BoolValue(boolean value) implements Value {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String format(ValueFormatter formatter) {
        return String.valueOf(value);
    }

    @Override
    public String asText(ValueFormatter formatter) {
        return String.valueOf(value);
    }

    @Override
    public boolean isTruthy() {
        return value;
    }
}
