package io.colabel.core.template;

import io.colabel.core.ColabelConfig;
import io.colabel.core.condition.ConditionEvaluator;
import io.colabel.core.condition.ConditionParser;
import io.colabel.core.context.LabelContext;
import io.colabel.core.render.RenderListener;
import io.colabel.core.value.StructuredValueWriter;
import io.colabel.core.value.ValueFormatter;
import java.util.Locale;
import java.util.Objects;

/// Template renderer supporting `if / elif / else / endif` blocks and `{{ name }}`
/// placeholders.
///
/// Per call: {@link ConditionalBlockProcessor} reduces every block to its chosen body, then
/// {@link VariableInterpolator} fills the placeholders of the resulting text. A placeholder
/// may therefore be assembled by a block, as in `{{ {% if a %}x{% else %}y{% endif %} }}`.
///
/// ### Failure policy
/// Rendering is total. Malformed conditions are false, unknown placeholders and unterminated
/// blocks stay literal, and any unexpected failure returns the template unchanged after
/// reporting it to the listener. A null context renders like an empty one.
///
/// @implNote Thread-safe. Holds no per-call state; a new {@link ValueFormatter} is created
/// for every call.
public final class DirectiveTemplateRenderer implements TemplateRenderer {

    private final Locale locale;
    private final int maxFractionDigits;
    private final StructuredValueWriter structuredWriter;
    private final ConditionalBlockProcessor blockProcessor;
    private final VariableInterpolator interpolator;

    /// Creates a renderer.
    ///
    /// Settings are read once here; later changes to `config` do not affect this renderer.
    ///
    /// @param config formatting and grammar options, not null
    /// @param structuredWriter writer for record and list values, not null
    public DirectiveTemplateRenderer(ColabelConfig config, StructuredValueWriter structuredWriter) {
        Objects.requireNonNull(config, "config");
        this.locale = config.getLocale();
        this.maxFractionDigits = config.getMaxFractionDigits();
        this.structuredWriter = Objects.requireNonNull(structuredWriter, "structuredWriter");
        this.blockProcessor =
                new ConditionalBlockProcessor(
                        new TemplateParser(),
                        new ConditionEvaluator(
                                new ConditionParser(config.isRelationalConditions())));
        this.interpolator = new VariableInterpolator();
    }

    @Override
    public String render(String template, LabelContext context, RenderListener listener) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        LabelContext values = context != null ? context : LabelContext.empty();
        RenderListener events = listener != null ? listener : RenderListener.NOOP;
        try {
            ValueFormatter formatter = newFormatter();
            String reduced = blockProcessor.process(template, values, formatter, events);
            return interpolator.interpolate(reduced, values, formatter, events);
        } catch (RuntimeException e) {
            events.onRenderFailure(template, e);
            return template;
        }
    }

    /// Creates the formatter for one render call.
    ///
    /// @return new formatter, never null
    public ValueFormatter newFormatter() {
        return new ValueFormatter(locale, maxFractionDigits, structuredWriter);
    }
}
