package io.colabel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.colabel.core.value.AbsentValue;
import io.colabel.core.value.BoolValue;
import io.colabel.core.value.ListValue;
import io.colabel.core.value.NumberValue;
import io.colabel.core.value.RecordValue;
import io.colabel.core.value.TextValue;
import io.colabel.core.value.Value;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes the `Value` sealed hierarchy as plain JSON.
///
/// Emitted JSON per variant:
/// - **`AbsentValue`**: `null`
/// - **`BoolValue`**: `true` / `false`
/// - **`NumberValue`**: an integer when the number is integral (`1234`, not `1234.0`),
///   otherwise a decimal; `null` for NaN and infinities
/// - **`TextValue`**: a string
/// - **`RecordValue`**: an object, fields in insertion order
/// - **`ListValue`**: an array
///
/// @implNote Package-private. Registered by {@link ColabelJacksonModule}.
class ValueSerializer extends StdSerializer<Value> {

    @Serial private static final long serialVersionUID = 7718022931466420275L;

    ValueSerializer() {
        super(Value.class);
    }

    @Override
    public void serialize(Value value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof AbsentValue) {
            gen.writeNull();
        } else if (value instanceof BoolValue bool) {
            gen.writeBoolean(bool.value());
        } else if (value instanceof NumberValue number) {
            writeNumber(number.value(), gen);
        } else if (value instanceof TextValue text) {
            gen.writeString(text.value());
        } else if (value instanceof RecordValue record) {
            gen.writeStartObject();
            for (Map.Entry<String, Value> field : record.fields().entrySet()) {
                gen.writeFieldName(field.getKey());
                serialize(field.getValue(), gen, provider);
            }
            gen.writeEndObject();
        } else if (value instanceof ListValue list) {
            gen.writeStartArray();
            for (Value item : list.items()) {
                serialize(item, gen, provider);
            }
            gen.writeEndArray();
        } else {
            throw new IllegalStateException("Unknown value type: " + value.getClass());
        }
    }

    private static void writeNumber(double number, JsonGenerator gen) throws IOException {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            gen.writeNull();
        } else if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            gen.writeNumber((long) number);
        } else {
            gen.writeNumber(number);
        }
    }
}
