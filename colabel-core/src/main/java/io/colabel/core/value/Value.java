package io.colabel.core.value;

import java.util.OptionalDouble;

/// A single named value available to a label template.
///
/// Closed variant over the kinds of data a render context can hold. Each variant carries
/// its own formatting and truthiness rule, so interpolation and condition evaluation never
/// inspect raw Java types at render time.
///
/// ### Permitted Implementations
/// - {@link AbsentValue} - null or missing data, formats as empty text
/// - {@link BoolValue} - `true` / `false`
/// - {@link NumberValue} - any numeric value, formatted with locale grouping
/// - {@link TextValue} - plain text
/// - {@link RecordValue} - one data row (ordered field map)
/// - {@link ListValue} - an ordered list of values
///
/// @implNote Implementations are immutable records and safe to share between threads.
///
/// @see Values#of(Object) for conversion from raw Java objects
/// @see ValueFormatter
public sealed interface Value
        permits AbsentValue, BoolValue, NumberValue, TextValue, RecordValue, ListValue {

    /// Formats this value for substitution into a placeholder.
    ///
    /// @param formatter the per-render formatter, not null
    /// @return display text, never null
    String format(ValueFormatter formatter);

    /// Returns the string form used by equality and prefix conditions.
    ///
    /// Unlike {@link #format(ValueFormatter)}, numbers are written without grouping
    /// separators so that `row_count == '1234'` compares as expected.
    ///
    /// @param formatter the per-render formatter, not null
    /// @return comparison text, never null
    String asText(ValueFormatter formatter);

    /// Returns whether this value counts as true in a bare-name condition.
    ///
    /// @return `false` for absent, `false`, zero and empty text; `true` otherwise
    boolean isTruthy();

    /// Returns the numeric content of this value, if it is a number.
    ///
    /// @return the number, or empty for every non-numeric variant
    default OptionalDouble asNumber() {
        return OptionalDouble.empty();
    }
}
