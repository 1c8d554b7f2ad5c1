package io.colabel.core.template;

import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.Value;
import io.colabel.core.value.ValueFormatter;
import java.util.List;
import java.util.Optional;

/// Substitutes placeholders with formatted context values.
///
/// Each `{{ name }}` is looked up by its exact trimmed name, so a shorter key never matches
/// part of a longer one (`{{sum}}` and `{{sum_total}}` resolve independently). Substituted
/// text is never rescanned. Names missing from the context leave the placeholder verbatim.
///
/// @implNote Stateless and thread-safe.
public final class VariableInterpolator {

    /// Interpolates placeholders in plain text.
    ///
    /// @param text text without directives, not null
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @param listener receives resolution events, not null
    /// @return interpolated text, never null
    public String interpolate(
            String text, LabelContext context, ValueFormatter formatter, RenderListener listener) {
        return interpolate(PlaceholderScanner.scan(text), context, formatter, listener);
    }

    /// Renders block-free nodes to text.
    ///
    /// Any conditional block still present is written back as its source.
    ///
    /// @param nodes literal and placeholder nodes, not null
    /// @param context the render context, not null
    /// @param formatter the per-render formatter, not null
    /// @param listener receives resolution events, not null
    /// @return interpolated text, never null
    public String interpolate(
            List<TemplateNode> nodes,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        StringBuilder result = new StringBuilder();
        for (TemplateNode node : nodes) {
            if (node instanceof TemplateNode.Placeholder placeholder) {
                result.append(resolve(placeholder, context, formatter, listener));
            } else {
                result.append(node.source());
            }
        }
        return result.toString();
    }

    private String resolve(
            TemplateNode.Placeholder placeholder,
            LabelContext context,
            ValueFormatter formatter,
            RenderListener listener) {
        Optional<Value> value = context.lookup(placeholder.name());
        if (value.isEmpty()) {
            listener.onUnresolvedPlaceholder(placeholder.name());
            return placeholder.source();
        }
        try {
            String text = formatter.format(value.get());
            listener.onPlaceholderResolved(placeholder.name(), text);
            return text;
        } catch (RuntimeException e) {
            listener.onRenderFailure(placeholder.source(), e);
            return placeholder.source();
        }
    }
}
