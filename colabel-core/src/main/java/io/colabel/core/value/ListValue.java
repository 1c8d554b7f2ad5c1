package io.colabel.core.value;

import java.util.List;

/// An ordered list of values, e.g. the active metric identifiers.
///
/// Lists are always truthy, empty or not.
///
/// @param items list elements, copied on construction
public record ListValue(List<Value> items) implements Value {

    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    @Override
    public String format(ValueFormatter formatter) {
        return formatter.writeList(this);
    }

    @Override
    public String asText(ValueFormatter formatter) {
        return formatter.writeList(this);
    }

    @Override
    public boolean isTruthy() {
        return true;
    }
}
