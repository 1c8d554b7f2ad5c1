package io.colabel.core.context;

import io.colabel.core.value.Value;
import java.util.Optional;
import java.util.OptionalDouble;

/// Aggregate statistics over the numeric entries of one column.
///
/// @param sum sum of the entries
/// @param avg arithmetic mean of the entries
/// @param min smallest entry
/// @param max largest entry
/// @param count number of entries, always positive
public record ColumnStatistics(double sum, double avg, double min, double max, int count) {

    public ColumnStatistics {
        if (count <= 0) {
            throw new IllegalArgumentException("Statistics require at least one entry");
        }
        if (min > max) {
            throw new IllegalArgumentException("Min must be less than or equal to max");
        }
    }

    /// Summarizes the finite numeric values in `values`; everything else is skipped.
    ///
    /// @param values column values in row order, not null
    /// @return statistics, or empty when no value is a finite number
    public static Optional<ColumnStatistics> summarize(Iterable<? extends Value> values) {
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int count = 0;

        for (Value value : values) {
            OptionalDouble number = value.asNumber();
            if (number.isEmpty() || !Double.isFinite(number.getAsDouble())) {
                continue;
            }
            double v = number.getAsDouble();
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
            count++;
        }

        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new ColumnStatistics(sum, sum / count, min, max, count));
    }
}
