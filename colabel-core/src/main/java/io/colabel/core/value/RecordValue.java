package io.colabel.core.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// One data row: an ordered mapping of field name to value.
///
/// Records are always truthy, including the empty record used for `first_row` / `last_row`
/// when the result set has no rows.
///
/// @param fields field values in column order, copied on construction
public record RecordValue(Map<String, Value> fields) implements Value {

    /// The empty record.
    public static final RecordValue EMPTY = new RecordValue(Map.of());

    public RecordValue {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /// Returns the value of a field.
    ///
    /// @param name field name, not null
    /// @return the field value, or {@link AbsentValue#INSTANCE} when the field is missing
    public Value get(String name) {
        Value value = fields.get(name);
        return value != null ? value : AbsentValue.INSTANCE;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public String format(ValueFormatter formatter) {
        return formatter.writeRecord(this);
    }

    @Override
    public String asText(ValueFormatter formatter) {
        return formatter.writeRecord(this);
    }

    @Override
    public boolean isTruthy() {
        return true;
    }
}
