package io.colabel.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import io.colabel.core.LabelEngine;
import io.colabel.core.context.LabelContext;
import io.colabel.core.value.ListValue;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.StructuredValueWriter;
import io.colabel.core.value.Values;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonStructuredValueWriterTest {

    private final JacksonStructuredValueWriter writer = new JacksonStructuredValueWriter();

    @Test
    void writeRecord_compactJson() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region", "North");
        row.put("sales", 1234);
        row.put("share", 0.25);
        row.put("active", true);
        row.put("note", null);

        String json = writer.writeRecord(Values.record(row));

        assertThat(json)
                .isEqualTo(
                        "{\"region\":\"North\",\"sales\":1234,\"share\":0.25,"
                                + "\"active\":true,\"note\":null}");
    }

    @Test
    void writeList_nestedValues() {
        ListValue list =
                (ListValue) Values.of(List.of(Map.of("a", 1), Arrays.asList(1.5, Double.NaN)));

        assertThat(writer.writeList(list)).isEqualTo("[{\"a\":1},[1.5,null]]");
    }

    @Test
    void writeRecord_empty() {
        assertThat(writer.writeRecord(RecordValue.EMPTY)).isEqualTo("{}");
        assertThat(writer.writeList(ListValue.EMPTY)).isEqualTo("[]");
    }

    @Test
    void discover_findsJacksonWriter() {
        assertThat(StructuredValueWriter.discover())
                .isInstanceOf(JacksonStructuredValueWriter.class);
    }

    @Test
    void engine_rendersRowsAsJson() {
        LabelEngine engine = LabelEngine.create();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region", "North");
        row.put("sales", 10);

        String label = engine.render("{{first_row}}", LabelContext.of(Map.of("first_row", row)));

        assertThat(label).isEqualTo("{\"region\":\"North\",\"sales\":10}");
    }
}
