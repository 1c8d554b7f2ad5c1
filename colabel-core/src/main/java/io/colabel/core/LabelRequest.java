package io.colabel.core;

import io.colabel.core.context.ColumnDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Everything needed to render one column label: the template, the column, the current rows,
/// and the caller's extra values.
///
/// All collections are defensively copied and unmodifiable. Rows keep their key order.
///
/// ### Example
/// {@snippet :
/// LabelRequest request = LabelRequest.builder()
///     .template("{{column_name}} ({{row_count}} rows)")
///     .column(ColumnDescriptor.builder().key("sales").label("Sales").build())
///     .rows(rows)
///     .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see LabelEngine#renderColumnLabel(LabelRequest)
public final class LabelRequest {

    private final String template;
    private final ColumnDescriptor column;
    private final List<Map<String, Object>> rows;
    private final Map<String, Object> auxiliary;
    private final List<String> metrics;
    private final Map<String, String> labels;

    private LabelRequest(Builder builder) {
        this.column = Objects.requireNonNull(builder.column, "Column required");
        this.template = builder.template != null ? builder.template : "";
        this.rows = copyRows(builder.rows);
        this.auxiliary =
                builder.auxiliary != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.auxiliary))
                        : Map.of();
        this.metrics = builder.metrics != null ? List.copyOf(builder.metrics) : List.of();
        this.labels =
                builder.labels != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels))
                        : Map.of();
    }

    private static List<Map<String, Object>> copyRows(List<? extends Map<String, ?>> rows) {
        if (rows == null) {
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copy.add(
                    row != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(row))
                            : Map.of());
        }
        return Collections.unmodifiableList(copy);
    }

    /// @return the label template, empty when none was set, never null
    public String getTemplate() {
        return template;
    }

    /// @return the column being labelled, never null
    public ColumnDescriptor getColumn() {
        return column;
    }

    /// @return the rows in order, never null
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /// @return auxiliary values by name, never null
    public Map<String, Object> getAuxiliary() {
        return auxiliary;
    }

    /// @return active metric identifiers, never null
    public List<String> getMetrics() {
        return metrics;
    }

    /// Returns extra identifier labels used in addition to the engine's name table.
    ///
    /// @return identifier to label entries, never null
    public Map<String, String> getLabels() {
        return labels;
    }

    /// Returns a builder initialized with this request's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .template(template)
                .column(column)
                .rows(rows)
                .auxiliary(auxiliary)
                .metrics(metrics)
                .labels(labels);
    }

    /// Creates a new request builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable LabelRequest instances.
    ///
    /// Required fields: `column`
    public static final class Builder {
        private String template;
        private ColumnDescriptor column;
        private List<? extends Map<String, ?>> rows;
        private Map<String, ?> auxiliary;
        private List<String> metrics;
        private Map<String, String> labels;

        private Builder() {}

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder column(ColumnDescriptor column) {
            this.column = column;
            return this;
        }

        public Builder rows(List<? extends Map<String, ?>> rows) {
            this.rows = rows;
            return this;
        }

        public Builder auxiliary(Map<String, ?> auxiliary) {
            this.auxiliary = auxiliary;
            return this;
        }

        public Builder metrics(List<String> metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        /// Builds the request.
        ///
        /// @return new request, never null
        /// @throws NullPointerException if `column` was not set
        public LabelRequest build() {
            return new LabelRequest(this);
        }
    }
}
