package io.colabel.core.condition;

import io.colabel.core.context.LabelContext;
import io.colabel.core.value.AbsentValue;
import io.colabel.core.value.Value;
import io.colabel.core.value.ValueFormatter;
import java.util.Objects;
import java.util.OptionalDouble;

/// A parsed `if` / `elif` condition.
///
/// ### Permitted Implementations
/// - {@link Equality} - `name == 'literal'`, or `!=` when negated
/// - {@link Prefix} - `name.startswith('literal')`
/// - {@link Comparison} - `name > 10`, `name == 0` and the other numeric operators
/// - {@link Truthiness} - a bare `name`
/// - {@link Malformed} - anything else, always false
///
/// String forms compare against {@link Value#asText}; an unknown name compares as empty text.
///
/// @implNote Implementations are immutable records.
///
/// @see ConditionParser
public sealed interface Condition
        permits Condition.Equality,
                Condition.Prefix,
                Condition.Comparison,
                Condition.Truthiness,
                Condition.Malformed {

    /// Evaluates this condition.
    ///
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @return whether the condition holds
    boolean test(LabelContext context, ValueFormatter formatter);

    /// Returns whether this condition could not be parsed.
    default boolean isMalformed() {
        return false;
    }

    private static Value valueOf(LabelContext context, String name) {
        return context.lookup(name).orElse(AbsentValue.INSTANCE);
    }

    record Equality(String name, String literal, boolean negated) implements Condition {

        public Equality {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public boolean test(LabelContext context, ValueFormatter formatter) {
            boolean equal = formatter.asText(valueOf(context, name)).equals(literal);
            return negated != equal;
        }
    }

    record Prefix(String name, String prefix) implements Condition {

        public Prefix {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(prefix, "prefix");
        }

        @Override
        public boolean test(LabelContext context, ValueFormatter formatter) {
            return formatter.asText(valueOf(context, name)).startsWith(prefix);
        }
    }

    record Comparison(String name, ComparisonOperator operator, double operand)
            implements Condition {

        public Comparison {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(operator, "operator");
        }

        /// Non-numeric values never satisfy a comparison, not even `!=`.
        @Override
        public boolean test(LabelContext context, ValueFormatter formatter) {
            OptionalDouble actual = valueOf(context, name).asNumber();
            return actual.isPresent() && operator.matches(actual.getAsDouble(), operand);
        }
    }

    record Truthiness(String name) implements Condition {

        public Truthiness {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean test(LabelContext context, ValueFormatter formatter) {
            return context.lookup(name).map(Value::isTruthy).orElse(false);
        }
    }

    record Malformed(String text) implements Condition {

        @Override
        public boolean test(LabelContext context, ValueFormatter formatter) {
            return false;
        }

        @Override
        public boolean isMalformed() {
            return true;
        }
    }
}
