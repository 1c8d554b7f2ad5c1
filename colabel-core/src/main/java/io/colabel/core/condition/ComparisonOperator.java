package io.colabel.core.condition;

/// Numeric comparison operators accepted in label conditions.
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /// Returns the operator as written in a template, e.g. `>=`.
    public String symbol() {
        return symbol;
    }

    /// Applies this operator.
    ///
    /// @param actual the context value
    /// @param operand the literal from the condition
    /// @return the comparison result; always `false` when either side is NaN
    public boolean matches(double actual, double operand) {
        if (Double.isNaN(actual) || Double.isNaN(operand)) {
            return false;
        }
        return switch (this) {
            case EQ -> actual == operand;
            case NE -> actual != operand;
            case GT -> actual > operand;
            case GTE -> actual >= operand;
            case LT -> actual < operand;
            case LTE -> actual <= operand;
        };
    }
}
