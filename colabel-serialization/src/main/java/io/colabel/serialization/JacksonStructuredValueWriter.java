package io.colabel.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.colabel.core.value.ListValue;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.StructuredValueWriter;
import io.colabel.core.value.Value;

/// Writes record and list values as compact JSON, e.g. `{"region":"North","sales":10}`.
///
/// Registered in `META-INF/services`, so {@link StructuredValueWriter#discover()} picks it
/// up whenever this module is on the class path.
///
/// @implNote Thread-safe. Shares one `ObjectMapper`, which is safe for concurrent writes
/// once configured.
public final class JacksonStructuredValueWriter implements StructuredValueWriter {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().registerModule(new ColabelJacksonModule());

    /// Creates the writer. Public for `ServiceLoader`.
    public JacksonStructuredValueWriter() {}

    @Override
    public String writeRecord(RecordValue record) {
        return write(record);
    }

    @Override
    public String writeList(ListValue list) {
        return write(list);
    }

    private static String write(Value value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write value: " + e.getMessage(), e);
        }
    }
}
