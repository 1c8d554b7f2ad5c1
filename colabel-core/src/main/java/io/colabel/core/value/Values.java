package io.colabel.core.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Converts raw Java objects into {@link Value} variants.
///
/// Conversion happens once, when a context is built. Supported inputs:
/// - `null` and empty `Optional` become {@link AbsentValue}
/// - `Boolean` becomes {@link BoolValue}
/// - any `Number` becomes {@link NumberValue}
/// - `CharSequence` and `Character` become {@link TextValue}
/// - `Map` becomes {@link RecordValue} (keys via `String.valueOf`, order kept)
/// - `Collection` and object arrays become {@link ListValue}
/// - an existing `Value` is returned unchanged
///
/// Anything else becomes a `TextValue` of its `toString()`.
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class Values {

    private Values() {}

    /// Converts a raw object into a value.
    ///
    /// @param raw the object to convert, may be null
    /// @return the converted value, never null
    public static Value of(Object raw) {
        if (raw == null) {
            return AbsentValue.INSTANCE;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        if (raw instanceof Number number) {
            return new NumberValue(number.doubleValue());
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new TextValue(raw.toString());
        }
        if (raw instanceof Optional<?> optional) {
            return optional.map(Values::of).orElse(AbsentValue.INSTANCE);
        }
        if (raw instanceof Map<?, ?> map) {
            return record(map);
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (raw instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        return new TextValue(String.valueOf(raw));
    }

    /// Converts a data row into a record value.
    ///
    /// @param row the row, may be null (treated as empty)
    /// @return the record, never null
    public static RecordValue record(Map<?, ?> row) {
        if (row == null || row.isEmpty()) {
            return RecordValue.EMPTY;
        }
        Map<String, Value> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : row.entrySet()) {
            fields.put(String.valueOf(entry.getKey()), of(entry.getValue()));
        }
        return new RecordValue(fields);
    }
}
