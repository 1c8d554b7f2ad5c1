package io.colabel.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.FallbackStructuredValueWriter;
import io.colabel.core.value.ListValue;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.StructuredValueWriter;
import io.colabel.core.value.ValueFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VariableInterpolator")
class VariableInterpolatorTest {

    private VariableInterpolator interpolator;
    private ValueFormatter formatter;
    private RenderListener listener;

    @BeforeEach
    void setUp() {
        interpolator = new VariableInterpolator();
        formatter = new ValueFormatter(Locale.US, 3, FallbackStructuredValueWriter.INSTANCE);
        listener = mock(RenderListener.class);
    }

    private String interpolate(String text, Map<String, ?> values) {
        return interpolator.interpolate(text, LabelContext.of(values), formatter, listener);
    }

    @Test
    @DisplayName("substitutes formatted values, tolerating whitespace")
    void shouldSubstituteValues() {
        String result =
                interpolate(
                        "{{column_name}} ({{ row_count }} rows)",
                        Map.of("column_name", "Sales", "row_count", 1234));

        assertThat(result).isEqualTo("Sales (1,234 rows)");
        verify(listener).onPlaceholderResolved("row_count", "1,234");
    }

    @Test
    @DisplayName("a shorter name never corrupts a longer one")
    void shouldResolveKeysThatArePrefixesOfOthers() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("sum", 1);
        values.put("sum_total", 2);

        assertThat(interpolate("{{sum}}/{{sum_total}}/{{ sum }}", values)).isEqualTo("1/2/1");
    }

    @Test
    @DisplayName("does not rescan substituted text")
    void shouldNotRescanSubstitutedText() {
        assertThat(interpolate("{{a}}", Map.of("a", "{{b}}", "b", "x"))).isEqualTo("{{b}}");
    }

    @Test
    @DisplayName("leaves unknown placeholders verbatim")
    void shouldKeepUnknownPlaceholders() {
        assertThat(interpolate("{{unknown_var}} and {{ other }}", Map.of()))
                .isEqualTo("{{unknown_var}} and {{ other }}");
        verify(listener).onUnresolvedPlaceholder("unknown_var");
        verify(listener).onUnresolvedPlaceholder("other");
    }

    @Test
    @DisplayName("present null values become empty text")
    void shouldFormatNullAsEmpty() {
        Map<String, Object> values = new HashMap<>();
        values.put("note", null);

        assertThat(interpolate("[{{note}}]", values)).isEqualTo("[]");
    }

    @Test
    @DisplayName("a failing writer keeps the placeholder and reports it")
    void shouldKeepPlaceholderWhenFormattingFails() {
        StructuredValueWriter writer = mock(StructuredValueWriter.class);
        when(writer.writeRecord(any(RecordValue.class))).thenThrow(new IllegalStateException("x"));
        ValueFormatter failing = new ValueFormatter(Locale.US, 3, writer);

        String result =
                interpolator.interpolate(
                        "row: {{first_row}}",
                        LabelContext.of(Map.of("first_row", Map.of("a", 1))),
                        failing,
                        listener);

        assertThat(result).isEqualTo("row: {{first_row}}");
        verify(listener).onRenderFailure(eq("{{first_row}}"), any(IllegalStateException.class));
    }

    @Test
    @DisplayName("writes lists through the structured writer")
    void shouldWriteLists() {
        StructuredValueWriter writer = mock(StructuredValueWriter.class);
        when(writer.writeList(any(ListValue.class))).thenReturn("<list>");

        String result =
                interpolator.interpolate(
                        "{{metrics}}",
                        LabelContext.of(Map.of("metrics", List.of("a"))),
                        new ValueFormatter(Locale.US, 3, writer),
                        listener);

        assertThat(result).isEqualTo("<list>");
    }
}
