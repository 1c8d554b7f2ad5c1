package io.colabel.core.value;

import java.math.BigDecimal;
import java.util.OptionalDouble;

/// A numeric value.
///
/// All numbers are carried as `double`; integral values print without a fractional part in
/// both display and comparison form.
///
/// @param value the number; negative zero is normalized to zero
public record NumberValue(double value) implements Value {

    public NumberValue {
        if (value == 0.0) {
            value = 0.0;
        }
    }

    /// Display form with locale grouping, e.g. `1,234` or `12.5`.
    @Override
    public String format(ValueFormatter formatter) {
        return formatter.formatNumber(value);
    }

    /// Comparison form without grouping, e.g. `1234` or `12.5`.
    @Override
    public String asText(ValueFormatter formatter) {
        return plainText();
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0 && !Double.isNaN(value);
    }

    @Override
    public OptionalDouble asNumber() {
        return OptionalDouble.of(value);
    }

    /// Returns whether this number can take part in column statistics.
    ///
    /// @return `true` unless the value is NaN or infinite
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    /// Returns the shortest plain decimal text for this number.
    ///
    /// @return `"0"`, `"1234"`, `"12.5"`, `"NaN"`, `"Infinity"`; never null
    public String plainText() {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
