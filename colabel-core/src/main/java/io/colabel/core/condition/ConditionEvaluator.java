package io.colabel.core.condition;

import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.ValueFormatter;
import java.util.Objects;

/// Evaluates condition text against a context.
///
/// Never throws: malformed conditions and unexpected failures both evaluate to `false` and
/// are reported to the {@link RenderListener}.
///
/// @implNote Stateless and thread-safe.
///
/// @see ConditionParser for the supported grammar
public final class ConditionEvaluator {

    private final ConditionParser parser;

    public ConditionEvaluator(ConditionParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /// Evaluates one condition.
    ///
    /// @param condition condition text, may be null
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @param listener receives malformed-condition and error events, not null
    /// @return whether the condition holds; `false` on any problem
    public boolean evaluate(
            String condition,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        try {
            Condition parsed = parser.parse(condition);
            if (parsed.isMalformed()) {
                listener.onMalformedCondition(String.valueOf(condition));
                return false;
            }
            return parsed.test(context, formatter);
        } catch (RuntimeException e) {
            listener.onConditionError(String.valueOf(condition), e);
            return false;
        }
    }
}
