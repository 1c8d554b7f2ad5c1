package io.colabel.core.context;

import io.colabel.core.ColabelConfig;
import io.colabel.core.naming.NameTransformer;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.Value;
import io.colabel.core.value.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Assembles the {@link LabelContext} for one column label.
///
/// ### Built-in keys
/// | Key | Value |
/// |---|---|
/// | `column_name` | column label run through the {@link NameTransformer} |
/// | `original_label` | column label as configured |
/// | `key` / `display_key` | column key, raw and transformed |
/// | `data_type` | declared type name, e.g. `NUMERIC` |
/// | `row_count` | number of rows |
/// | `first_row` / `last_row` | first and last row; the empty record when there are no rows |
/// | `first_value` / `last_value` | the column's value in the first and last row |
/// | `is_metric` / `is_percent_metric` / `is_numeric` | descriptor flags |
/// | `sum` / `avg` / `min` / `max` / `count` | {@link ColumnStatistics}, only when the column has a numeric entry |
/// | `metrics` / `metric_count` | active metrics, only when metric inclusion is enabled |
///
/// Auxiliary values are merged after the built-in keys. A name collision is resolved by
/// {@link ColabelConfig#getAuxiliaryPrecedence()} and reported to the listener.
///
/// @implNote Stateless and thread-safe. Every call returns a new context.
public final class ContextBuilder {

    private final ColabelConfig config;
    private final NameTransformer nameTransformer;

    /// Creates a context builder.
    ///
    /// @param config rendering configuration, not null
    /// @param nameTransformer transformer for `column_name` and `display_key`, not null
    public ContextBuilder(ColabelConfig config, NameTransformer nameTransformer) {
        this.config = Objects.requireNonNull(config, "config");
        this.nameTransformer = Objects.requireNonNull(nameTransformer, "nameTransformer");
    }

    /// Builds the context for one column.
    ///
    /// @param column the column being labelled, not null
    /// @param rows all rows of the current result set, may be null (treated as empty)
    /// @param auxiliary externally computed values, may be null
    /// @param metrics active metric identifiers, may be null
    /// @param listener receives collision events, not null
    /// @return new context, never null
    public LabelContext build(
            ColumnDescriptor column,
            List<? extends Map<String, ?>> rows,
            Map<String, ?> auxiliary,
            List<String> metrics,
            RenderListener listener) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(listener, "listener");
        List<? extends Map<String, ?>> safeRows = rows != null ? rows : List.of();

        LabelContext.Builder context = LabelContext.builder();
        context.put(ContextKeys.COLUMN_NAME, nameTransformer.transform(column.getLabel()));
        context.put(ContextKeys.ORIGINAL_LABEL, column.getLabel());
        context.put(ContextKeys.KEY, column.getKey());
        context.put(ContextKeys.DISPLAY_KEY, nameTransformer.transform(column.getKey()));
        context.put(ContextKeys.DATA_TYPE, column.getDataType().name());
        context.put(ContextKeys.ROW_COUNT, safeRows.size());

        RecordValue firstRow =
                safeRows.isEmpty() ? RecordValue.EMPTY : Values.record(safeRows.get(0));
        RecordValue lastRow =
                safeRows.isEmpty()
                        ? RecordValue.EMPTY
                        : Values.record(safeRows.get(safeRows.size() - 1));
        context.put(ContextKeys.FIRST_ROW, firstRow);
        context.put(ContextKeys.LAST_ROW, lastRow);

        context.put(ContextKeys.IS_METRIC, column.isMetric());
        context.put(ContextKeys.IS_PERCENT_METRIC, column.isPercentMetric());
        context.put(ContextKeys.IS_NUMERIC, column.isNumeric());
        context.put(ContextKeys.FIRST_VALUE, firstRow.get(column.getKey()));
        context.put(ContextKeys.LAST_VALUE, lastRow.get(column.getKey()));

        columnStatistics(column, safeRows)
                .ifPresent(
                        stats -> {
                            context.put(ContextKeys.SUM, stats.sum());
                            context.put(ContextKeys.AVG, stats.avg());
                            context.put(ContextKeys.MIN, stats.min());
                            context.put(ContextKeys.MAX, stats.max());
                            context.put(ContextKeys.COUNT, stats.count());
                        });

        if (config.isIncludeMetrics()) {
            List<String> safeMetrics = metrics != null ? metrics : List.of();
            context.put(ContextKeys.METRICS, Values.of(safeMetrics));
            context.put(ContextKeys.METRIC_COUNT, safeMetrics.size());
        }

        if (auxiliary != null) {
            mergeAuxiliary(context, auxiliary, listener);
        }
        return context.build();
    }

    /// Computes statistics over the column's own values.
    ///
    /// @param column the column, not null
    /// @param rows the rows, not null
    /// @return statistics, or empty when no row holds a finite number for the column
    public Optional<ColumnStatistics> columnStatistics(
            ColumnDescriptor column, List<? extends Map<String, ?>> rows) {
        List<Value> values = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            if (row != null) {
                values.add(Values.of(row.get(column.getKey())));
            }
        }
        return ColumnStatistics.summarize(values);
    }

    private void mergeAuxiliary(
            LabelContext.Builder context, Map<String, ?> auxiliary, RenderListener listener) {
        for (Map.Entry<String, ?> entry : auxiliary.entrySet()) {
            String name = entry.getKey();
            if (name == null) {
                continue;
            }
            if (ContextKeys.isReserved(name)) {
                boolean dropped =
                        config.getAuxiliaryPrecedence() == AuxiliaryPrecedence.RESERVE_BUILT_INS;
                listener.onAuxiliaryCollision(name, dropped);
                if (dropped) {
                    continue;
                }
            }
            context.put(name, entry.getValue());
        }
    }
}
