package io.colabel.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.colabel.core.ColabelConfig;
import io.colabel.core.naming.NameTransformer;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.BoolValue;
import io.colabel.core.value.ListValue;
import io.colabel.core.value.NumberValue;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.TextValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ContextBuilder")
class ContextBuilderTest {

    @Mock private RenderListener listener;

    private ColumnDescriptor salesColumn;
    private List<Map<String, Object>> rows;

    @BeforeEach
    void setUp() {
        salesColumn =
                ColumnDescriptor.builder()
                        .key("sell_in")
                        .label("SUM(sell_in)")
                        .dataType(ColumnDataType.NUMERIC)
                        .metric(true)
                        .build();
        rows = List.of(row("North", 10), row("South", 999), row("East", 50));
    }

    private ContextBuilder builder(ColabelConfig config) {
        return new ContextBuilder(config, NameTransformer.defaults());
    }

    @Nested
    @DisplayName("built-in keys")
    class BuiltInKeysTest {

        @Test
        @DisplayName("describes the column")
        void shouldDescribeColumn() {
            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, rows, null, null, listener);

            assertThat(context.lookup("column_name")).contains(new TextValue("Total Sell In"));
            assertThat(context.lookup("original_label")).contains(new TextValue("SUM(sell_in)"));
            assertThat(context.lookup("key")).contains(new TextValue("sell_in"));
            assertThat(context.lookup("display_key")).contains(new TextValue("Sell In"));
            assertThat(context.lookup("data_type")).contains(new TextValue("NUMERIC"));
            assertThat(context.lookup("is_metric")).contains(BoolValue.TRUE);
            assertThat(context.lookup("is_percent_metric")).contains(BoolValue.FALSE);
            assertThat(context.lookup("is_numeric")).contains(BoolValue.TRUE);
        }

        @Test
        @DisplayName("describes the rows")
        void shouldDescribeRows() {
            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, rows, null, null, listener);

            assertThat(context.lookup("row_count")).contains(new NumberValue(3));
            assertThat(context.lookup("first_value")).contains(new NumberValue(10));
            assertThat(context.lookup("last_value")).contains(new NumberValue(50));
            RecordValue lastRow = (RecordValue) context.lookup("last_row").orElseThrow();
            assertThat(lastRow.get("region")).isEqualTo(new TextValue("East"));
        }

        @Test
        @DisplayName("empty rows give empty records, never absent")
        void shouldUseEmptyRecordsWithoutRows() {
            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, null, null, null, listener);

            assertThat(context.lookup("row_count")).contains(new NumberValue(0));
            assertThat(context.lookup("first_row")).contains(RecordValue.EMPTY);
            assertThat(context.lookup("last_row")).contains(RecordValue.EMPTY);
            assertThat(context.lookup("first_value")).isPresent();
            assertThat(context.lookup("first_value").get().isTruthy()).isFalse();
        }

        @Test
        @DisplayName("keeps a fixed key order")
        void shouldKeepKeyOrder() {
            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, rows, null, null, listener);

            assertThat(context.names())
                    .startsWith("column_name", "original_label", "key", "display_key");
        }
    }

    @Nested
    @DisplayName("statistics")
    class StatisticsTest {

        @Test
        @DisplayName("computed over the column's numeric values")
        void shouldComputeStatistics() {
            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, rows, null, null, listener);

            assertThat(context.lookup("sum")).contains(new NumberValue(1059));
            assertThat(context.lookup("avg")).contains(new NumberValue(353));
            assertThat(context.lookup("min")).contains(new NumberValue(10));
            assertThat(context.lookup("max")).contains(new NumberValue(999));
            assertThat(context.lookup("count")).contains(new NumberValue(3));
        }

        @Test
        @DisplayName("omitted entirely when no numeric value exists")
        void shouldOmitStatisticsWithoutNumbers() {
            List<Map<String, Object>> textRows = List.of(row("North", null), row("South", "n/a"));

            LabelContext context =
                    builder(new ColabelConfig())
                            .build(salesColumn, textRows, null, null, listener);

            assertThat(context.names()).doesNotContain("sum", "avg", "min", "max", "count");
        }

        @Test
        @DisplayName("ignores other columns")
        void shouldIgnoreOtherColumns() {
            Map<String, Object> other = new HashMap<>();
            other.put("units", 5);
            List<Map<String, Object>> mixed = new ArrayList<>(rows);
            mixed.add(other);

            LabelContext context =
                    builder(new ColabelConfig()).build(salesColumn, mixed, null, null, listener);

            assertThat(context.lookup("count")).contains(new NumberValue(3));
            assertThat(context.lookup("row_count")).contains(new NumberValue(4));
        }
    }

    @Nested
    @DisplayName("metrics")
    class MetricsTest {

        @Test
        @DisplayName("added only when enabled")
        void shouldAddMetricsWhenEnabled() {
            ColabelConfig config = ColabelConfig.builder().includeMetrics(true).build();

            LabelContext context =
                    builder(config).build(salesColumn, rows, null, List.of("a", "b"), listener);

            assertThat(context.lookup("metrics"))
                    .contains(new ListValue(List.of(new TextValue("a"), new TextValue("b"))));
            assertThat(context.lookup("metric_count")).contains(new NumberValue(2));
        }

        @Test
        @DisplayName("absent by default")
        void shouldOmitMetricsByDefault() {
            LabelContext context =
                    builder(new ColabelConfig())
                            .build(salesColumn, rows, null, List.of("a"), listener);

            assertThat(context.contains("metrics")).isFalse();
            assertThat(context.contains("metric_count")).isFalse();
        }
    }

    @Nested
    @DisplayName("auxiliary values")
    class AuxiliaryTest {

        @Test
        @DisplayName("merged into the same namespace")
        void shouldMergeAuxiliaryValues() {
            LabelContext context =
                    builder(new ColabelConfig())
                            .build(salesColumn, rows, Map.of("target", 500), null, listener);

            assertThat(context.lookup("target")).contains(new NumberValue(500));
            verify(listener, never()).onAuxiliaryCollision("target", true);
        }

        @Test
        @DisplayName("never shadow built-in keys by default")
        void shouldReserveBuiltIns() {
            LabelContext context =
                    builder(new ColabelConfig())
                            .build(salesColumn, rows, Map.of("row_count", 1), null, listener);

            assertThat(context.lookup("row_count")).contains(new NumberValue(3));
            verify(listener).onAuxiliaryCollision("row_count", true);
        }

        @Test
        @DisplayName("reserve statistics names even when statistics are omitted")
        void shouldReserveStatisticsNames() {
            LabelContext context =
                    builder(new ColabelConfig())
                            .build(salesColumn, List.of(), Map.of("sum", 7), null, listener);

            assertThat(context.contains("sum")).isFalse();
            verify(listener).onAuxiliaryCollision("sum", true);
        }

        @Test
        @DisplayName("replace built-in keys when auxiliary values win")
        void shouldReplaceBuiltInsWhenConfigured() {
            ColabelConfig config =
                    ColabelConfig.builder()
                            .auxiliaryPrecedence(AuxiliaryPrecedence.AUXILIARY_WINS)
                            .build();

            LabelContext context =
                    builder(config)
                            .build(salesColumn, rows, Map.of("row_count", 1), null, listener);

            assertThat(context.lookup("row_count")).contains(new NumberValue(1));
            verify(listener).onAuxiliaryCollision("row_count", false);
        }
    }

    @Test
    @DisplayName("requires a column")
    void shouldRequireColumn() {
        assertThatThrownBy(
                        () -> builder(new ColabelConfig()).build(null, rows, null, null, listener))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("column descriptor defaults label and numeric flag")
    void shouldDefaultDescriptor() {
        ColumnDescriptor column = ColumnDescriptor.builder().key("region").build();

        assertThat(column.getLabel()).isEqualTo("region");
        assertThat(column.getDataType()).isEqualTo(ColumnDataType.STRING);
        assertThat(column.isNumeric()).isFalse();
    }

    private static Map<String, Object> row(String region, Object sellIn) {
        Map<String, Object> row = new HashMap<>();
        row.put("region", region);
        row.put("sell_in", sellIn);
        return row;
    }
}
