package io.colabel.core.context;

import java.util.Objects;

/// Immutable description of the column whose label is being rendered.
///
/// ### Defaults
/// - `label`: the column key
/// - `dataType`: {@link ColumnDataType#STRING}
/// - `numeric`: `true` exactly when `dataType` is {@link ColumnDataType#NUMERIC}
/// - `metric`, `percentMetric`: `false`
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see ContextBuilder
public final class ColumnDescriptor {

    private final String label;
    private final String key;
    private final ColumnDataType dataType;
    private final boolean numeric;
    private final boolean metric;
    private final boolean percentMetric;

    private ColumnDescriptor(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "Column key required");
        this.label = builder.label != null ? builder.label : builder.key;
        this.dataType = builder.dataType != null ? builder.dataType : ColumnDataType.STRING;
        this.numeric =
                builder.numeric != null ? builder.numeric : dataType == ColumnDataType.NUMERIC;
        this.metric = builder.metric;
        this.percentMetric = builder.percentMetric;
    }

    /// Returns the display label as configured, e.g. `SUM(sell_in)`.
    ///
    /// @return label, never null
    public String getLabel() {
        return label;
    }

    /// Returns the internal key used to read the column from a row.
    ///
    /// @return key, never null
    public String getKey() {
        return key;
    }

    /// @return declared type, never null
    public ColumnDataType getDataType() {
        return dataType;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public boolean isMetric() {
        return metric;
    }

    public boolean isPercentMetric() {
        return percentMetric;
    }

    /// Creates a new descriptor builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable ColumnDescriptor instances.
    ///
    /// Required fields: `key`
    public static final class Builder {
        private String label;
        private String key;
        private ColumnDataType dataType;
        private Boolean numeric;
        private boolean metric;
        private boolean percentMetric;

        private Builder() {}

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder dataType(ColumnDataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder numeric(boolean numeric) {
            this.numeric = numeric;
            return this;
        }

        public Builder metric(boolean metric) {
            this.metric = metric;
            return this;
        }

        public Builder percentMetric(boolean percentMetric) {
            this.percentMetric = percentMetric;
            return this;
        }

        /// Builds the descriptor.
        ///
        /// @return new descriptor, never null
        /// @throws NullPointerException if `key` was not set
        public ColumnDescriptor build() {
            return new ColumnDescriptor(this);
        }
    }
}
