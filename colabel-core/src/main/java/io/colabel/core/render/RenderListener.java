package io.colabel.core.render;

/// Listener for label rendering events.
///
/// Rendering never fails and never writes to the console; everything worth reporting about
/// a template or its context is delivered here instead. All methods have default no-op
/// implementations, allowing listeners to override only the events they care about.
///
/// ### Callback Order
/// For one call to {@link io.colabel.core.LabelEngine#renderColumnLabel}:
///
/// ```
/// onAuxiliaryCollision(name)          - while the context is built
/// onUnterminatedBlock(offset)         - while the template is parsed
/// onMalformedCondition / onConditionError
/// onBlockResolved(condition, index)   - once per conditional block
/// onPlaceholderResolved / onUnresolvedPlaceholder
/// ```
///
/// @implNote Listeners passed to concurrent render calls must be thread-safe.
///
/// @see LoggingRenderListener
/// @see CollectingRenderListener
public interface RenderListener {

    /// Called when a conditional block has chosen its branch.
    ///
    /// @param firstCondition the condition of the block's `if` tag, not null
    /// @param branchIndex index of the chosen branch, or `-1` when no branch matched
    default void onBlockResolved(String firstCondition, int branchIndex) {}

    /// Called when an `if` tag has no matching `endif`; the rest of the template is kept as
    /// literal text.
    ///
    /// @param offset character offset of the `if` tag in the template
    default void onUnterminatedBlock(int offset) {}

    /// Called when a condition matches none of the supported forms and evaluates to false.
    ///
    /// @param condition the condition text, not null
    default void onMalformedCondition(String condition) {}

    /// Called when evaluating a condition failed unexpectedly; the condition counts as false.
    ///
    /// @param condition the condition text, not null
    /// @param error the failure, not null
    default void onConditionError(String condition, RuntimeException error) {}

    /// Called for each substituted placeholder.
    ///
    /// @param name placeholder name, not null
    /// @param text the substituted text, not null
    default void onPlaceholderResolved(String name, String text) {}

    /// Called for each placeholder left verbatim because its name is not in the context.
    ///
    /// @param name placeholder name, not null
    default void onUnresolvedPlaceholder(String name) {}

    /// Called when an auxiliary value's name collides with a built-in context key.
    ///
    /// @param name the colliding name, not null
    /// @param dropped `true` if the auxiliary value was dropped, `false` if it replaced the
    /// built-in value
    default void onAuxiliaryCollision(String name, boolean dropped) {}

    /// Called when a rendering step failed unexpectedly and the affected text was kept
    /// verbatim.
    ///
    /// @param source the template fragment that was kept, not null
    /// @param error the failure, not null
    default void onRenderFailure(String source, RuntimeException error) {}

    /// No-op listener instance that ignores all events.
    ///
    /// Use this when no diagnostics are needed.
    RenderListener NOOP = new RenderListener() {};
}
