package io.colabel.core.value;

import java.util.Map;
import java.util.StringJoiner;

/// Writer used when no {@link StructuredValueWriter} provider is on the class path.
///
/// Produces `{name=Sales, total=1234}` and `[a, b]`, mirroring `Map.toString()` and
/// `List.toString()` with numbers in plain form.
public final class FallbackStructuredValueWriter implements StructuredValueWriter {

    public static final FallbackStructuredValueWriter INSTANCE =
            new FallbackStructuredValueWriter();

    private FallbackStructuredValueWriter() {}

    @Override
    public String writeRecord(RecordValue record) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, Value> field : record.fields().entrySet()) {
            joiner.add(field.getKey() + "=" + write(field.getValue()));
        }
        return joiner.toString();
    }

    @Override
    public String writeList(ListValue list) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Value item : list.items()) {
            joiner.add(write(item));
        }
        return joiner.toString();
    }

    private String write(Value value) {
        if (value instanceof RecordValue record) {
            return writeRecord(record);
        }
        if (value instanceof ListValue list) {
            return writeList(list);
        }
        if (value instanceof NumberValue number) {
            return number.plainText();
        }
        if (value instanceof AbsentValue) {
            return "null";
        }
        if (value instanceof BoolValue bool) {
            return String.valueOf(bool.value());
        }
        return ((TextValue) value).value();
    }
}
