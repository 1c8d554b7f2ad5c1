package io.colabel.core.context;

/// Policy for an auxiliary value whose name collides with a built-in context key.
public enum AuxiliaryPrecedence {
    /// Built-in keys are reserved; the colliding auxiliary value is dropped.
    RESERVE_BUILT_INS,
    /// The auxiliary value replaces the built-in value.
    AUXILIARY_WINS
}
