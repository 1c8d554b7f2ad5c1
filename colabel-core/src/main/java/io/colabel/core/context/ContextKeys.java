package io.colabel.core.context;

import java.util.Set;

/// Names of the built-in context keys.
///
/// Every name in {@link #RESERVED} is owned by the context builder, including the statistics
/// and metrics keys that are only present in some contexts.
public final class ContextKeys {

    private ContextKeys() {}

    public static final String COLUMN_NAME = "column_name";
    public static final String ORIGINAL_LABEL = "original_label";
    public static final String KEY = "key";
    public static final String DISPLAY_KEY = "display_key";
    public static final String DATA_TYPE = "data_type";
    public static final String ROW_COUNT = "row_count";
    public static final String FIRST_ROW = "first_row";
    public static final String LAST_ROW = "last_row";
    public static final String IS_METRIC = "is_metric";
    public static final String IS_PERCENT_METRIC = "is_percent_metric";
    public static final String IS_NUMERIC = "is_numeric";
    public static final String FIRST_VALUE = "first_value";
    public static final String LAST_VALUE = "last_value";

    // Present only when the column has at least one numeric entry
    public static final String SUM = "sum";
    public static final String AVG = "avg";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String COUNT = "count";

    // Present only when metric inclusion is enabled
    public static final String METRICS = "metrics";
    public static final String METRIC_COUNT = "metric_count";

    public static final Set<String> RESERVED =
            Set.of(
                    COLUMN_NAME,
                    ORIGINAL_LABEL,
                    KEY,
                    DISPLAY_KEY,
                    DATA_TYPE,
                    ROW_COUNT,
                    FIRST_ROW,
                    LAST_ROW,
                    IS_METRIC,
                    IS_PERCENT_METRIC,
                    IS_NUMERIC,
                    FIRST_VALUE,
                    LAST_VALUE,
                    SUM,
                    AVG,
                    MIN,
                    MAX,
                    COUNT,
                    METRICS,
                    METRIC_COUNT);

    /// Returns whether `name` is a built-in key.
    ///
    /// @param name candidate name, not null
    /// @return `true` if the context builder owns this name
    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }
}
