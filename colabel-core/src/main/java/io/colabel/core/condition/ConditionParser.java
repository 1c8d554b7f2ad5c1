package io.colabel.core.condition;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalDouble;

/// Parses condition text from `if` / `elif` tags.
///
/// Forms are tried in a fixed priority order; the first that applies wins:
/// 1. `name == 'literal'` or `name == "literal"` (string equality); with relational
///    conditions enabled also `name == 42` (numeric equality)
/// 2. `name != 'literal'` / `name != 42` (relational conditions only)
/// 3. `name.startswith('literal')`
/// 4. `name > n`, `name >= n`, `name < n`, `name <= n` (relational conditions only)
/// 5. a bare `name` (truthiness)
///
/// Text that fits none of these parses as {@link Condition.Malformed}. There are no boolean
/// combinators.
///
/// The parser scans with `indexOf` and fixed-position checks only; it never backtracks.
///
/// @implNote Immutable and thread-safe.
public final class ConditionParser {

    private static final String STARTSWITH = ".startswith(";

    private final boolean relational;

    /// Creates a parser.
    ///
    /// @param relational whether numeric and relational forms are recognized
    public ConditionParser(boolean relational) {
        this.relational = relational;
    }

    /// Parses one condition.
    ///
    /// @param text condition text as written between the tag keyword and `%}`, may be null
    /// @return the parsed condition, never null
    public Condition parse(String text) {
        if (text == null) {
            return new Condition.Malformed("");
        }
        String condition = text.strip();

        Condition parsed = parseEquality(condition, "==", false);
        if (parsed == null && relational) {
            parsed = parseEquality(condition, "!=", true);
        }
        if (parsed == null) {
            parsed = parsePrefix(condition);
        }
        if (parsed == null && relational) {
            parsed = parseRelational(condition);
        }
        if (parsed == null) {
            parsed =
                    isName(condition)
                            ? new Condition.Truthiness(condition)
                            : new Condition.Malformed(condition);
        }
        return parsed;
    }

    private Condition parseEquality(String condition, String operator, boolean negated) {
        int index = condition.indexOf(operator);
        if (index <= 0) {
            return null;
        }
        String name = condition.substring(0, index).strip();
        if (!isName(name)) {
            return null;
        }
        String operand = condition.substring(index + operator.length()).strip();

        Optional<String> literal = unquote(operand);
        if (literal.isPresent()) {
            return new Condition.Equality(name, literal.get(), negated);
        }
        if (relational) {
            OptionalDouble number = parseNumber(operand);
            if (number.isPresent()) {
                ComparisonOperator op = negated ? ComparisonOperator.NE : ComparisonOperator.EQ;
                return new Condition.Comparison(name, op, number.getAsDouble());
            }
        }
        return new Condition.Malformed(condition);
    }

    private Condition parsePrefix(String condition) {
        int index = condition.indexOf(STARTSWITH);
        if (index <= 0) {
            return null;
        }
        String name = condition.substring(0, index).strip();
        if (!isName(name)) {
            return null;
        }
        String rest = condition.substring(index + STARTSWITH.length());
        if (!rest.endsWith(")")) {
            return new Condition.Malformed(condition);
        }
        return unquote(rest.substring(0, rest.length() - 1).strip())
                .<Condition>map(prefix -> new Condition.Prefix(name, prefix))
                .orElseGet(() -> new Condition.Malformed(condition));
    }

    private Condition parseRelational(String condition) {
        int index = -1;
        for (int i = 0; i < condition.length(); i++) {
            char c = condition.charAt(i);
            if (c == '<' || c == '>') {
                index = i;
                break;
            }
        }
        if (index <= 0) {
            return null;
        }
        boolean orEqual = index + 1 < condition.length() && condition.charAt(index + 1) == '=';
        ComparisonOperator operator;
        if (condition.charAt(index) == '>') {
            operator = orEqual ? ComparisonOperator.GTE : ComparisonOperator.GT;
        } else {
            operator = orEqual ? ComparisonOperator.LTE : ComparisonOperator.LT;
        }

        String name = condition.substring(0, index).strip();
        if (!isName(name)) {
            return null;
        }
        String operand = condition.substring(index + (orEqual ? 2 : 1)).strip();
        OptionalDouble number = parseNumber(unquote(operand).orElse(operand));
        if (number.isEmpty()) {
            return new Condition.Malformed(condition);
        }
        return new Condition.Comparison(name, operator, number.getAsDouble());
    }

    /// Strips matching single or double quotes.
    ///
    /// @return the text between the quotes, or empty when `operand` is not exactly one
    /// quoted literal
    static Optional<String> unquote(String operand) {
        if (operand.length() < 2) {
            return Optional.empty();
        }
        char quote = operand.charAt(0);
        if (quote != '\'' && quote != '"') {
            return Optional.empty();
        }
        int closing = operand.indexOf(quote, 1);
        if (closing != operand.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(operand.substring(1, closing));
    }

    static OptionalDouble parseNumber(String text) {
        if (text.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(new BigDecimal(text).doubleValue());
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /// A name is any non-empty text without whitespace or quotes, e.g. `row_count` or
    /// `MAX(anio_id)`.
    static boolean isName(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '\'' || c == '"') {
                return false;
            }
        }
        return true;
    }
}
