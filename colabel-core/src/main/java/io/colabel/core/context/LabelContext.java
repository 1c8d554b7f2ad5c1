package io.colabel.core.context;

import io.colabel.core.value.Value;
import io.colabel.core.value.Values;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// The flat named-value bag available to one render call.
///
/// A name that is present with an {@link io.colabel.core.value.AbsentValue} formats as empty
/// text; a name that is not present at all leaves its placeholder verbatim.
///
/// @implNote Immutable and thread-safe. Contexts carry no identity beyond one render call;
/// build a fresh one for every label.
///
/// @see ContextBuilder
public final class LabelContext {

    private static final LabelContext EMPTY = new LabelContext(Map.of());

    private final Map<String, Value> values;

    private LabelContext(Map<String, Value> values) {
        this.values = values;
    }

    /// Returns the context with no names.
    public static LabelContext empty() {
        return EMPTY;
    }

    /// Creates a context from raw Java objects, converted with {@link Values#of(Object)}.
    ///
    /// Entries with a null name are skipped.
    ///
    /// @param raw name to object entries, may be null (treated as empty)
    /// @return new context, never null
    public static LabelContext of(Map<String, ?> raw) {
        Builder builder = builder();
        if (raw != null) {
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                if (entry.getKey() != null) {
                    builder.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return builder.build();
    }

    /// Looks up a name.
    ///
    /// @param name the name, not null
    /// @return the value, or empty when the name is not in this context
    public Optional<Value> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /// Returns all names in insertion order.
    ///
    /// @return unmodifiable set, never null
    public Set<String> names() {
        return values.keySet();
    }

    /// Returns the context as a map in insertion order.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Value> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelContext other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "LabelContext" + values;
    }

    /// Creates a new context builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link LabelContext}. Later puts for the same name replace earlier ones.
    public static final class Builder {
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {}

        /// Adds a raw value, converting it with {@link Values#of(Object)}.
        ///
        /// @param name the name, not null
        /// @param raw the value, may be null
        /// @return this builder for chaining
        public Builder put(String name, Object raw) {
            values.put(Objects.requireNonNull(name, "name"), Values.of(raw));
            return this;
        }

        public boolean contains(String name) {
            return values.containsKey(name);
        }

        /// Builds the context.
        ///
        /// @return new immutable context, never null
        public LabelContext build() {
            return new LabelContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
