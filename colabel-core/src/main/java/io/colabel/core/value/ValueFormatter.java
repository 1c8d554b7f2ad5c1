package io.colabel.core.value;

import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;
import java.util.Objects;

/// Formatting rules for one render call.
///
/// Numbers use a locale-aware grouped decimal format (`1,234.5` for `Locale.US`); records
/// and lists are delegated to a {@link StructuredValueWriter}.
///
/// @implNote **Not thread-safe**: wraps a `NumberFormat`. Create one per render call; the
/// renderer does this for you.
public final class ValueFormatter {

    private final NumberFormat numberFormat;
    private final StructuredValueWriter structuredWriter;

    /// Creates a formatter.
    ///
    /// @param locale locale for grouping and decimal symbols, not null
    /// @param maxFractionDigits maximum number of fraction digits, must not be negative
    /// @param structuredWriter writer for record and list values, not null
    public ValueFormatter(
            Locale locale, int maxFractionDigits, StructuredValueWriter structuredWriter) {
        if (maxFractionDigits < 0) {
            throw new IllegalArgumentException("Max fraction digits cannot be negative");
        }
        this.numberFormat = NumberFormat.getNumberInstance(Objects.requireNonNull(locale));
        this.numberFormat.setGroupingUsed(true);
        this.numberFormat.setMinimumFractionDigits(0);
        this.numberFormat.setMaximumFractionDigits(maxFractionDigits);
        this.numberFormat.setRoundingMode(RoundingMode.HALF_UP);
        this.structuredWriter = Objects.requireNonNull(structuredWriter, "structuredWriter");
    }

    /// Formats any value for display.
    ///
    /// @param value the value, not null
    /// @return display text, never null
    public String format(Value value) {
        return value.format(this);
    }

    /// Returns the comparison form of a value.
    ///
    /// @param value the value, not null
    /// @return comparison text, never null
    public String asText(Value value) {
        return value.asText(this);
    }

    String formatNumber(double number) {
        return numberFormat.format(number);
    }

    String writeRecord(RecordValue record) {
        return structuredWriter.writeRecord(record);
    }

    String writeList(ListValue list) {
        return structuredWriter.writeList(list);
    }
}
